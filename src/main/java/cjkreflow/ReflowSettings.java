package cjkreflow;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * JSON settings document for reflow and PDF extraction.
 *
 * <pre>
 * {
 *   "pdfOptions": {
 *     "addPdfPageHeader": 0, "compactPdfText": 0, "autoReflowPdfText": 1, "pdfEngine": 1,
 *     "shortHeadingSettings": { "maxLen": 8, "allCjk": 1, ... }
 *   },
 *   "sentenceBoundaryMode": { "value": 2 }
 * }
 * </pre>
 *
 * <p>Flags are 0/1 integers. Unknown keys are ignored. A default document is
 * bundled as {@value #DEFAULT_RESOURCE}.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReflowSettings {

    private static final Logger LOGGER = Logger.getLogger(ReflowSettings.class.getName());

    /**
     * Classpath location of the bundled defaults.
     */
    public static final String DEFAULT_RESOURCE = "/reflow-settings.json";

    /**
     * PDF extraction and reflow options.
     */
    @JsonMerge
    public PdfOptions pdfOptions = new PdfOptions();

    /**
     * Sentence boundary strictness.
     */
    @JsonMerge
    public SentenceBoundaryMode sentenceBoundaryMode = new SentenceBoundaryMode();

    /**
     * Constructs settings with built-in defaults. Used by Jackson as well.
     */
    public ReflowSettings() {
        // defaults come from field initializers
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PdfOptions {
        public int addPdfPageHeader;
        public int compactPdfText;
        public int autoReflowPdfText = 1;
        /**
         * 1 = text stripper, 2 = text objects with overlay filtering
         */
        public int pdfEngine = 1;

        @JsonMerge
        public ShortHeadingOptions shortHeadingSettings = new ShortHeadingOptions();

        void normalize() {
            if (pdfEngine != 1 && pdfEngine != 2)
                pdfEngine = 1;
            if (shortHeadingSettings == null)
                shortHeadingSettings = new ShortHeadingOptions();
            shortHeadingSettings.normalize();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ShortHeadingOptions {
        public int maxLen = ShortHeadingSettings.DEFAULT_MAX_LEN;

        // JSON expects 0/1 flags
        public int allCjk = 1;
        public int allAscii = 1;
        public int allAsciiDigits = 1;
        public int mixedCjkAscii;

        public String customTitleHeadingRegex = "";

        void normalize() {
            maxLen = ShortHeadingSettings.clampMaxLen(maxLen);
            if (customTitleHeadingRegex == null)
                customTitleHeadingRegex = "";
        }

        public ShortHeadingSettings toShortHeadingSettings() {
            return new ShortHeadingSettings(maxLen, allCjk > 0, allAscii > 0, allAsciiDigits > 0, mixedCjkAscii > 0);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SentenceBoundaryMode {
        public int value = SentenceBoundaryLevel.BALANCED.getValue();

        void normalize() {
            if (value < 1 || value > 3)
                value = SentenceBoundaryLevel.BALANCED.getValue();
        }
    }

    /**
     * Repairs out-of-range values in place: clamps {@code maxLen}, resets an
     * unknown {@code pdfEngine} to 1 and an unknown boundary mode to 2.
     *
     * @return this instance
     */
    public ReflowSettings normalize() {
        if (pdfOptions == null)
            pdfOptions = new PdfOptions();
        if (sentenceBoundaryMode == null)
            sentenceBoundaryMode = new SentenceBoundaryMode();

        pdfOptions.normalize();
        sentenceBoundaryMode.normalize();
        return this;
    }

    // ======================================================================
    // Conversion
    // ======================================================================

    /**
     * Converts this document into per-call reflow options.
     * <p>
     * A custom title regex that does not compile is logged at {@code WARNING}
     * and ignored, so a hand-edited settings file never breaks a reflow run.
     */
    public ReflowOptions toReflowOptions() {
        normalize();

        Pattern custom = null;
        String regex = pdfOptions.shortHeadingSettings.customTitleHeadingRegex;
        try {
            custom = TitleHeadingRules.compileCustom(regex);
        } catch (IllegalArgumentException e) {
            LOGGER.log(Level.WARNING, "Ignoring invalid custom title heading regex: " + regex, e);
        }

        return ReflowOptions.builder()
                .addPdfPageHeader(pdfOptions.addPdfPageHeader > 0)
                .compact(pdfOptions.compactPdfText > 0)
                .shortHeading(pdfOptions.shortHeadingSettings.toShortHeadingSettings())
                .sentenceBoundaryLevel(sentenceBoundaryMode.value)
                .customTitleHeading(custom)
                .build();
    }

    @JsonIgnore
    public boolean isAutoReflow() {
        return pdfOptions != null && pdfOptions.autoReflowPdfText > 0;
    }

    // ======================================================================
    // Loading / saving
    // ======================================================================

    /**
     * Loads the bundled defaults from {@value #DEFAULT_RESOURCE}.
     *
     * @return normalized default settings; built-in values if the resource is missing
     */
    public static ReflowSettings loadDefaults() {
        try (InputStream in = ReflowSettings.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                LOGGER.warning("Bundled settings " + DEFAULT_RESOURCE + " not found; using built-in defaults");
                return new ReflowSettings().normalize();
            }
            return fromJson(in);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to read bundled settings " + DEFAULT_RESOURCE, e);
            return new ReflowSettings().normalize();
        }
    }

    /**
     * Reads a settings document from a stream.
     *
     * @throws IOException if the JSON cannot be read or parsed
     */
    public static ReflowSettings fromJson(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        return mapper.readValue(in, ReflowSettings.class).normalize();
    }

    /**
     * Merges a user settings file over the bundled defaults. Keys absent from
     * the user file keep their default value.
     *
     * <p>A missing or unreadable user file yields the defaults and a {@code WARNING}.</p>
     *
     * @param userFile settings file, may be {@code null}
     */
    public static ReflowSettings load(Path userFile) {
        ReflowSettings settings = loadDefaults();
        if (userFile == null)
            return settings;

        if (!Files.isRegularFile(userFile)) {
            LOGGER.warning("Settings file not found: " + userFile + "; using defaults");
            return settings;
        }

        ObjectMapper mapper = new ObjectMapper();
        try (InputStream in = Files.newInputStream(userFile)) {
            return mapper.readerForUpdating(settings).<ReflowSettings>readValue(in).normalize();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to read settings file: " + userFile + "; using defaults", e);
            return loadDefaults();
        }
    }

    /**
     * Writes this document as pretty-printed UTF-8 JSON.
     *
     * @throws IOException if writing fails
     */
    public void save(Path output) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        try (Writer writer = new OutputStreamWriter(Files.newOutputStream(output), StandardCharsets.UTF_8)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, this);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Unable to write settings to file: " + output, e);
            throw e;
        }
    }
}
