package cjkreflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CJK-aware paragraph reflow for text extracted from PDF / EPUB / Office documents.
 *
 * <p>Physical line breaks in extracted text follow the page layout, not the
 * sentence structure. The engine walks the lines once, classifies each with
 * {@link LineClassifier}, and either emits it as a structural segment
 * (heading, page marker, metadata, divider) or merges it into the paragraph
 * being assembled until a boundary decision flushes that paragraph.</p>
 *
 * <p>All methods are stateless and safe to call concurrently on independent
 * inputs. Each call owns its own {@link ParagraphBuffer}.</p>
 */
public final class CjkReflowEngine {

    private static final Logger LOGGER = Logger.getLogger(CjkReflowEngine.class.getName());

    static {
        // Disable logging by default
        LOGGER.setLevel(Level.OFF);
    }

    private CjkReflowEngine() {
    }

    /**
     * Enables or disables verbose logging for the reflow engine.
     * <p>
     * When enabled, every call logs one summary line (input lines, output
     * segments and the options used).
     *
     * @param enabled {@code true} to enable, {@code false} to silence
     */
    public static void setVerboseLogging(boolean enabled) {
        LOGGER.setLevel(enabled ? Level.INFO : Level.OFF);
    }

    // ======================================================================
    // Public API
    // ======================================================================

    /**
     * Reflows CJK text extracted from PDF with default heading and boundary settings.
     *
     * @param text             raw text extracted from PDF
     * @param addPdfPageHeader whether to keep PDF page headers (=== [Page 1/10] ===)
     * @param compact          true = "p1\np2\np3", false = "p1\n\np2\n\np3"
     */
    public static String reflowCjkParagraphs(String text, boolean addPdfPageHeader, boolean compact) {
        return reflow(text, ReflowOptions.builder()
                .addPdfPageHeader(addPdfPageHeader)
                .compact(compact)
                .build());
    }

    /**
     * Default: novel mode (with blank line between paragraphs).
     */
    public static String reflowCjkParagraphs(String text, boolean addPdfPageHeader) {
        return reflowCjkParagraphs(text, addPdfPageHeader, false);
    }

    /**
     * Reflows {@code text} and joins the segments per {@link ReflowOptions#isCompact()}.
     *
     * @return reflowed text; {@code ""} for empty or whitespace-only input
     */
    public static String reflow(String text, ReflowOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        return join(segment(text, options), options.isCompact());
    }

    /**
     * Runs the segmentation pass and returns the segments in input order.
     *
     * @param text    line-oriented text; {@code \r\n} and {@code \r} are normalized
     * @param options per-call configuration
     * @return unmodifiable list of segments, empty for blank input
     */
    public static List<Segment> segment(String text, ReflowOptions options) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(options, "options must not be null");

        if (text.trim().isEmpty()) {
            return Collections.emptyList();
        }

        // Normalize CRLF → LF
        text = text.replace("\r\n", "\n").replace("\r", "\n");

        // Split with limit to preserve empty lines
        String[] lines = text.split("\n", -1);

        Pass pass = new Pass(options);
        for (String rawLine : lines) {
            pass.accept(rawLine);
        }
        List<Segment> segments = pass.finish();

        if (LOGGER.isLoggable(Level.INFO)) {
            LOGGER.info("Reflowed " + lines.length + " lines into " + segments.size()
                    + " segments with " + options);
        }

        return Collections.unmodifiableList(segments);
    }

    /**
     * Joins segments with {@code "\n"} (compact) or {@code "\n\n"} (novel).
     */
    public static String join(List<Segment> segments, boolean compact) {
        String joiner = compact ? "\n" : "\n\n";
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            if (sb.length() > 0) {
                sb.append(joiner);
            }
            sb.append(segment.getText());
        }
        return sb.toString();
    }

    // ======================================================================
    // Segmentation pass
    // ======================================================================

    /**
     * State of one reflow call: the paragraph buffer and the emitted segments.
     */
    private static final class Pass {
        private final ReflowOptions options;
        private final LineClassifier classifier;
        private final ParagraphBuffer buffer = new ParagraphBuffer();
        private final List<Segment> segments = new ArrayList<>();

        Pass(ReflowOptions options) {
            this.options = options;
            this.classifier = new LineClassifier(options);
        }

        void accept(String rawLine) {
            ClassifiedLine classified = classifier.classify(rawLine, buffer);
            Line line = classified.getLine();

            switch (classified.getKind()) {
                case EMPTY:
                    onEmpty();
                    break;

                case PAGE_MARKER:
                    if (options.isAddPdfPageHeader()) {
                        emitStructural(line.getStripped(), LineKind.PAGE_MARKER);
                    } else {
                        // stripped marker: behaves like the blank line of a page break
                        onEmpty();
                    }
                    break;

                case VISUAL_DIVIDER:
                case TITLE_HEADING:
                case CUSTOM_TITLE_HEADING:
                case METADATA:
                case BRACKET_STRUCTURAL:
                    emitStructural(line.getStripped(), classified.getKind());
                    break;

                case SHORT_HEADING:
                    onShortHeading(line);
                    break;

                default:
                    onProse(line);
                    break;
            }
        }

        List<Segment> finish() {
            flush();
            return segments;
        }

        private void flush() {
            Segment segment = buffer.flush();
            if (segment != null) {
                segments.add(segment);
            }
        }

        private void emitStructural(String text, LineKind kind) {
            flush();
            segments.add(new Segment(text, kind));
        }

        private void onShortHeading(Line line) {
            flush();

            // CJK and "item:" headings stay open for one line: the next line may continue them
            String probe = line.getProbe();
            if (CjkText.containsAnyCjk(probe) || PunctSets.endsWithColonLike(probe)) {
                buffer.seedHeading(line.getStripped());
            } else {
                segments.add(new Segment(line.getStripped(), LineKind.SHORT_HEADING));
            }
        }

        private void onEmpty() {
            if (buffer.isEmpty())
                return;

            if (buffer.isHeadingSeed()) {
                flush();
                return;
            }

            // Never flush mid-dialog because of a blank line (cross-page artifact)
            if (buffer.isDialogUnclosed())
                return;

            if (!options.isAddPdfPageHeader()) {
                if (buffer.hasUnclosedBracket())
                    return;

                // Page-break-like empty line
                if (!PunctSets.isClauseOrEndPunct(buffer.lastNonWhitespace()))
                    return;
            }

            // End of paragraph → flush buffer (do NOT emit "")
            flush();
        }

        private void onProse(Line line) {
            String stripped = line.getStripped();

            if (buffer.isEmpty()) {
                buffer.append(stripped);
                return;
            }

            // --- Colon + dialog continuation: 他說：\n「你好」 ---
            if (buffer.endsWithColonLike() && line.isDialogStarter()) {
                buffer.append(stripped);
                return;
            }

            if (buffer.isHeadingSeed()) {
                // the heading stands alone when a new paragraph visibly starts here
                if (line.isDialogStarter() || line.isIndented()) {
                    flush();
                }
                buffer.append(stripped);
                return;
            }

            if (line.isDialogStarter()) {
                // Comma-ending or open quote / bracket means the sentence is not finished
                boolean continuation = buffer.endsWithCommaLike()
                        || buffer.isDialogUnclosed()
                        || buffer.hasUnclosedBracket();

                if (!continuation) {
                    flush();
                }
                buffer.append(stripped);
                return;
            }

            // Dialog safety gate has the highest priority:
            // while a quote is open the paragraph is never split.
            if (!buffer.isDialogUnclosed() && endsParagraphBefore(line)) {
                flush();
            }

            // --- Default: soft join ---
            buffer.append(stripped);
        }

        private boolean endsParagraphBefore(Line line) {
            CharSequence text = buffer.text();

            if (SentenceBoundary.endsWithSentenceBoundary(text, options.getSentenceBoundaryLevel())
                    && !buffer.hasUnclosedBracket())
                return true;

            if (SentenceBoundary.endsWithCjkBracketBoundary(text))
                return true;

            // --- Indentation → new paragraph ---
            return line.isIndented();
        }
    }
}
