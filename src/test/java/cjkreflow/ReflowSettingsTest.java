package cjkreflow;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReflowSettingsTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String json) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, json.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void bundledDefaultsMatchBuiltInOptions() {
        ReflowSettings settings = ReflowSettings.loadDefaults();

        assertThat(settings.pdfOptions.pdfEngine).isEqualTo(1);
        assertThat(settings.pdfOptions.shortHeadingSettings.maxLen).isEqualTo(8);
        assertThat(settings.sentenceBoundaryMode.value).isEqualTo(2);
        assertThat(settings.isAutoReflow()).isTrue();

        ReflowOptions options = settings.toReflowOptions();
        assertThat(options.isAddPdfPageHeader()).isFalse();
        assertThat(options.isCompact()).isFalse();
        assertThat(options.getShortHeading()).isEqualTo(ShortHeadingSettings.defaults());
        assertThat(options.getSentenceBoundaryLevel()).isEqualTo(SentenceBoundaryLevel.BALANCED);
        assertThat(options.getCustomTitleHeading()).isNull();
    }

    @Test
    void userFileIsMergedOverDefaults() throws IOException {
        Path file = write("settings.json",
                "{\"pdfOptions\":{\"compactPdfText\":1,\"shortHeadingSettings\":{\"maxLen\":12}},"
                        + "\"unknownKey\":true}");

        ReflowSettings settings = ReflowSettings.load(file);

        assertThat(settings.pdfOptions.compactPdfText).isEqualTo(1);
        assertThat(settings.pdfOptions.addPdfPageHeader).isEqualTo(0);
        assertThat(settings.pdfOptions.shortHeadingSettings.maxLen).isEqualTo(12);
        assertThat(settings.pdfOptions.shortHeadingSettings.allCjk).isEqualTo(1);
        assertThat(settings.sentenceBoundaryMode.value).isEqualTo(2);

        ReflowOptions options = settings.toReflowOptions();
        assertThat(options.isCompact()).isTrue();
        assertThat(options.getShortHeading().getMaxLen()).isEqualTo(12);
    }

    @Test
    void outOfRangeValuesAreNormalized() throws IOException {
        Path file = write("bad-values.json",
                "{\"pdfOptions\":{\"pdfEngine\":7,\"shortHeadingSettings\":{\"maxLen\":99}},"
                        + "\"sentenceBoundaryMode\":{\"value\":9}}");

        ReflowSettings settings = ReflowSettings.load(file);

        assertThat(settings.pdfOptions.pdfEngine).isEqualTo(1);
        assertThat(settings.pdfOptions.shortHeadingSettings.maxLen).isEqualTo(30);
        assertThat(settings.sentenceBoundaryMode.value).isEqualTo(2);
    }

    @Test
    void invalidCustomRegexIsIgnored() throws IOException {
        Path file = write("regex.json",
                "{\"pdfOptions\":{\"shortHeadingSettings\":{\"customTitleHeadingRegex\":\"(\"}}}");

        ReflowOptions options = ReflowSettings.load(file).toReflowOptions();

        assertThat(options.getCustomTitleHeading()).isNull();
    }

    @Test
    void validCustomRegexIsCompiled() throws IOException {
        Path file = write("regex.json",
                "{\"pdfOptions\":{\"shortHeadingSettings\":{\"customTitleHeadingRegex\":\"^Part \\\\d+\"}}}");

        ReflowOptions options = ReflowSettings.load(file).toReflowOptions();

        assertThat(options.getCustomTitleHeading()).isNotNull();
        assertThat(options.getCustomTitleHeading().pattern()).isEqualTo("^Part \\d+");
    }

    @Test
    void missingOrCorruptFileFallsBackToDefaults() throws IOException {
        ReflowSettings missing = ReflowSettings.load(tempDir.resolve("nope.json"));
        ReflowSettings corrupt = ReflowSettings.load(write("corrupt.json", "{not json"));

        assertThat(missing.toReflowOptions().getShortHeading()).isEqualTo(ShortHeadingSettings.defaults());
        assertThat(corrupt.toReflowOptions().getShortHeading()).isEqualTo(ShortHeadingSettings.defaults());
        assertThat(ReflowSettings.load(null).isAutoReflow()).isTrue();
    }

    @Test
    void savedSettingsCanBeLoadedBack() throws IOException {
        ReflowSettings settings = ReflowSettings.loadDefaults();
        settings.pdfOptions.addPdfPageHeader = 1;
        settings.pdfOptions.pdfEngine = 2;
        settings.sentenceBoundaryMode.value = 3;

        Path file = tempDir.resolve("saved.json");
        settings.save(file);

        String json = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        assertThat(json).contains("\"pdfEngine\" : 2").doesNotContain("autoReflow\"");

        ReflowOptions options = ReflowSettings.load(file).toReflowOptions();
        assertThat(options.isAddPdfPageHeader()).isTrue();
        assertThat(options.getSentenceBoundaryLevel()).isEqualTo(SentenceBoundaryLevel.STRICT);
    }
}
