package cjkreflow;

/**
 * The single kind assigned to an input line by {@link LineClassifier}.
 */
public enum LineKind {
    EMPTY,
    /**
     * Box-drawing / dash / star divider such as {@code ──────}.
     */
    VISUAL_DIVIDER,
    /**
     * {@code === [Page X/Y] ===}
     */
    PAGE_MARKER,
    TITLE_HEADING,
    CUSTOM_TITLE_HEADING,
    METADATA,
    SHORT_HEADING,
    BRACKET_STRUCTURAL,
    PROSE
}
