package cjkreflow;

import java.util.Objects;

/**
 * One finished unit of reflow output: a verbatim structural line or a flushed paragraph.
 */
public final class Segment {

    private final String text;
    private final LineKind kind;

    public Segment(String text, LineKind kind) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public String getText() {
        return text;
    }

    public LineKind getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Segment)) return false;
        Segment other = (Segment) o;
        return text.equals(other.text) && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, kind);
    }

    @Override
    public String toString() {
        return kind + "[" + text + "]";
    }
}
