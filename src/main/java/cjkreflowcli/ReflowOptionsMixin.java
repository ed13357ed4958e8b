package cjkreflowcli;

import cjkreflow.ReflowOptions;
import cjkreflow.ReflowSettings;
import cjkreflow.ShortHeadingSettings;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Reflow options shared by the {@code reflow} and {@code pdf} subcommands.
 * Command line values override the settings file, which overrides the bundled defaults.
 */
class ReflowOptionsMixin {

    @Option(
            names = {"--settings"},
            paramLabel = "<file>",
            description = "JSON settings file merged over the bundled defaults"
    )
    Path settingsFile;

    @Option(
            names = {"-H", "--header"},
            description = "Keep / insert per-page header markers (=== [Page X/Y] ===)"
    )
    Boolean addHeader;

    @Option(
            names = {"--compact"},
            description = "One newline between paragraphs instead of a blank line"
    )
    Boolean compact;

    @Option(
            names = {"--max-len"},
            paramLabel = "<n>",
            description = "Short heading max length (3-30, default: 8)"
    )
    Integer maxLen;

    @Option(
            names = {"--boundary"},
            paramLabel = "<level>",
            description = "Sentence boundary level: 1 = very lenient, 2 = balanced (default), 3 = strict"
    )
    Integer boundaryLevel;

    @Option(
            names = {"--title-regex"},
            paramLabel = "<regex>",
            description = "Custom title heading pattern; matching lines always stand alone"
    )
    String titleRegex;

    private ReflowSettings settings;

    ReflowSettings settings() {
        if (settings == null) {
            settings = ReflowSettings.load(settingsFile);
        }
        return settings;
    }

    /**
     * @throws IllegalArgumentException if {@code --title-regex} does not compile
     */
    ReflowOptions resolve() {
        ReflowOptions base = settings().toReflowOptions();
        ReflowOptions.Builder b = base.toBuilder();

        if (addHeader != null) {
            b.addPdfPageHeader(addHeader);
        }
        if (compact != null) {
            b.compact(compact);
        }
        if (maxLen != null) {
            ShortHeadingSettings sh = base.getShortHeading().withMaxLen(maxLen);
            b.shortHeading(sh);
        }
        if (boundaryLevel != null) {
            b.sentenceBoundaryLevel(boundaryLevel);
        }
        if (titleRegex != null) {
            b.customTitleHeadingRegex(titleRegex);
        }

        return b.build();
    }
}
