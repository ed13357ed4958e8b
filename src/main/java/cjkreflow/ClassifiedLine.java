package cjkreflow;

import java.util.Objects;

/**
 * Result of {@link LineClassifier#classify}: exactly one {@link LineKind} for a
 * {@link Line}. The line carries the text after repeat collapse.
 */
public final class ClassifiedLine {

    private final LineKind kind;
    private final Line line;

    ClassifiedLine(LineKind kind, Line line) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.line = Objects.requireNonNull(line, "line must not be null");
    }

    public LineKind getKind() {
        return kind;
    }

    public Line getLine() {
        return line;
    }

    public String getText() {
        return line.getStripped();
    }

    @Override
    public String toString() {
        return kind + "[" + line.getStripped() + "]";
    }
}
