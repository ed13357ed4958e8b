package cjkreflow;

/**
 * The prose paragraph currently being assembled by {@link CjkReflowEngine}.
 *
 * <p>Appending a fragment updates the dialog counters and the bracket stack
 * with that fragment only. {@link #flush()} hands the text over as a
 * {@link Segment} and resets every piece of state in one place.</p>
 *
 * <p>A buffer may hold a <em>heading seed</em>: a short heading line that is
 * kept open for one more line so the next line can decide whether it stands
 * alone or continues it.</p>
 */
public final class ParagraphBuffer {

    private final StringBuilder text = new StringBuilder();
    private final DialogState dialogState = new DialogState();
    private final PunctSets.BracketStack brackets = new PunctSets.BracketStack();
    private boolean headingSeed;

    public boolean isEmpty() {
        return text.length() == 0;
    }

    public CharSequence text() {
        return text;
    }

    public void append(String fragment) {
        if (fragment == null || fragment.isEmpty())
            return;

        text.append(fragment);
        dialogState.update(fragment);
        brackets.push(fragment);
        headingSeed = false;
    }

    /**
     * Starts the buffer with a short heading that the next line may still
     * join. The buffer must be empty.
     */
    void seedHeading(String heading) {
        if (!isEmpty())
            throw new IllegalStateException("heading seed requires an empty buffer");

        append(heading);
        headingSeed = true;
    }

    public boolean isHeadingSeed() {
        return headingSeed;
    }

    public boolean isDialogUnclosed() {
        return dialogState.isUnclosed();
    }

    public boolean hasUnclosedBracket() {
        return brackets.isUnbalanced();
    }

    /**
     * Last non-whitespace char of the buffer, {@code '\0'} when there is none.
     */
    public char lastNonWhitespace() {
        return PunctSets.lastNonWhitespace(text);
    }

    public boolean endsWithCommaLike() {
        return PunctSets.isCommaLike(lastNonWhitespace());
    }

    public boolean endsWithColonLike() {
        return PunctSets.isColonLike(lastNonWhitespace());
    }

    /**
     * Moves the buffered text into a segment and clears the buffer.
     *
     * @return the flushed segment, or {@code null} when the buffer was empty
     */
    public Segment flush() {
        if (isEmpty()) {
            clear();
            return null;
        }

        LineKind kind = headingSeed ? LineKind.SHORT_HEADING : LineKind.PROSE;
        Segment segment = new Segment(text.toString(), kind);
        clear();
        return segment;
    }

    public void clear() {
        text.setLength(0);
        dialogState.reset();
        brackets.clear();
        headingSeed = false;
    }

    @Override
    public String toString() {
        return text.toString();
    }
}
