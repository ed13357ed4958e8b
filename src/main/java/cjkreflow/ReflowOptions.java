package cjkreflow;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Per-call reflow configuration. Immutable; build with {@link #builder()}.
 */
public final class ReflowOptions {

    private static final ReflowOptions DEFAULTS = builder().build();

    private final boolean addPdfPageHeader;
    private final boolean compact;
    private final ShortHeadingSettings shortHeading;
    private final SentenceBoundaryLevel sentenceBoundaryLevel;
    private final Pattern customTitleHeading;

    private ReflowOptions(Builder b) {
        this.addPdfPageHeader = b.addPdfPageHeader;
        this.compact = b.compact;
        this.shortHeading = b.shortHeading;
        this.sentenceBoundaryLevel = b.sentenceBoundaryLevel;
        this.customTitleHeading = b.customTitleHeading;
    }

    public static ReflowOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.addPdfPageHeader = addPdfPageHeader;
        b.compact = compact;
        b.shortHeading = shortHeading;
        b.sentenceBoundaryLevel = sentenceBoundaryLevel;
        b.customTitleHeading = customTitleHeading;
        return b;
    }

    /**
     * Keep {@code === [Page X/Y] ===} markers. When off, markers are dropped and
     * blank lines after an unfinished sentence are treated as page-layout artifacts.
     */
    public boolean isAddPdfPageHeader() {
        return addPdfPageHeader;
    }

    /**
     * {@code true}: segments joined by one newline; {@code false}: a blank line between segments.
     */
    public boolean isCompact() {
        return compact;
    }

    public ShortHeadingSettings getShortHeading() {
        return shortHeading;
    }

    public SentenceBoundaryLevel getSentenceBoundaryLevel() {
        return sentenceBoundaryLevel;
    }

    /**
     * @return the user title pattern, or {@code null}
     */
    public Pattern getCustomTitleHeading() {
        return customTitleHeading;
    }

    @Override
    public String toString() {
        return "ReflowOptions{addPdfPageHeader=" + addPdfPageHeader
                + ", compact=" + compact
                + ", shortHeading=" + shortHeading
                + ", sentenceBoundaryLevel=" + sentenceBoundaryLevel
                + ", customTitleHeading=" + (customTitleHeading == null ? "none" : customTitleHeading.pattern())
                + '}';
    }

    public static final class Builder {
        private boolean addPdfPageHeader;
        private boolean compact;
        private ShortHeadingSettings shortHeading = ShortHeadingSettings.defaults();
        private SentenceBoundaryLevel sentenceBoundaryLevel = SentenceBoundaryLevel.BALANCED;
        private Pattern customTitleHeading;

        private Builder() {
        }

        public Builder addPdfPageHeader(boolean value) {
            this.addPdfPageHeader = value;
            return this;
        }

        public Builder compact(boolean value) {
            this.compact = value;
            return this;
        }

        public Builder shortHeading(ShortHeadingSettings value) {
            this.shortHeading = Objects.requireNonNull(value, "shortHeading must not be null");
            return this;
        }

        public Builder sentenceBoundaryLevel(SentenceBoundaryLevel value) {
            this.sentenceBoundaryLevel = Objects.requireNonNull(value, "sentenceBoundaryLevel must not be null");
            return this;
        }

        /**
         * Numeric form, clamped into 1..3.
         */
        public Builder sentenceBoundaryLevel(int value) {
            this.sentenceBoundaryLevel = SentenceBoundaryLevel.of(value);
            return this;
        }

        public Builder customTitleHeading(Pattern value) {
            this.customTitleHeading = value;
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code regex} does not compile
         */
        public Builder customTitleHeadingRegex(String regex) {
            this.customTitleHeading = TitleHeadingRules.compileCustom(regex);
            return this;
        }

        public ReflowOptions build() {
            return new ReflowOptions(this);
        }
    }
}
