package cjkreflowcli;

import cjkreflow.CjkReflowEngine;
import cjkreflow.ReflowOptions;
import cjkreflow.ReflowSettings;
import pdfboxhelper.ExtractionResult;
import pdfboxhelper.PdfBoxHelper;
import pdfboxhelper.PdfEngine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand for PDF files (extract + optional reflow).
 *
 * <p>Typical usage:
 * <pre>
 *   cjkreflow pdf \
 *     -i input.pdf \
 *     -o output.txt \
 *     -H \
 *     -r \
 *     --engine TEXT_OBJECTS \
 *     --compact
 * </pre>
 *
 * <ul>
 *   <li>Only text-embedded PDF files are supported (no OCR).</li>
 *   <li>Output is always saved as UTF-8 plain text.</li>
 * </ul>
 */
@Command(
        name = "pdf",
        description = "\033[1;34mExtract PDF text, optionally reflow CJK paragraphs\033[0m",
        mixinStandardHelpOptions = true
)
public class PdfCommand implements Callable<Integer> {

    @Option(
            names = {"-i", "--input"},
            paramLabel = "<file>",
            description = "Input PDF file",
            required = true
    )
    private File input;

    @Option(
            names = {"-o", "--output"},
            paramLabel = "<file>",
            description = "Output text file (UTF-8). If omitted, '<name>_extracted.txt' is used next to input."
    )
    private File output;

    @Option(
            names = {"-r", "--reflow"},
            description = "Reflow CJK paragraphs after extraction (default: settings autoReflowPdfText with --settings, else false)"
    )
    private Boolean reflow;

    @Option(
            names = {"-e", "--engine"},
            paramLabel = "<engine>",
            description = "Extraction engine: ${COMPLETION-CANDIDATES} (default: settings pdfEngine)"
    )
    private PdfEngine engine;

    @Mixin
    private ReflowOptionsMixin reflowOptions;

    @Spec
    private CommandSpec spec;

    private static final Logger LOGGER = Logger.getLogger(PdfCommand.class.getName());

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();

        try {
            if (!validateInputPdf(err)) {
                return 1;
            }

            if (output == null) {
                String inputName = removeExtension(input.getName());
                String defaultName = inputName + "_extracted.txt";
                output = new File(input.getAbsoluteFile().getParentFile(), defaultName);
                err.println("ℹ️ Output file not specified. Using: " + output.getAbsolutePath());
            }

            ReflowSettings settings = reflowOptions.settings();
            ReflowOptions options = reflowOptions.resolve();
            PdfEngine selected = engine != null ? engine : PdfEngine.fromId(settings.pdfOptions.pdfEngine);
            boolean doReflow = reflow != null
                    ? reflow
                    : reflowOptions.settingsFile != null && settings.isAutoReflow();

            ConsoleProgressBar progressBar = new ConsoleProgressBar(40, err);
            err.println("📄 Extracting PDF text (" + selected + ")...");
            ExtractionResult extracted = PdfBoxHelper.tryExtract(
                    input,
                    options.isAddPdfPageHeader(),
                    selected,
                    progressBar::update,
                    null
            );

            if (!extracted.success) {
                err.println(extracted.message);
                return 1;
            }

            String processed = extracted.result.text;
            if (doReflow) {
                err.println("🧹 Reflowing CJK paragraphs...");
                processed = CjkReflowEngine.reflow(processed, options);
            }

            PdfBoxHelper.saveTextToFile(processed, output);

            err.println("✅ PDF extraction succeeded.");
            err.println("📄 Input : " + input.getAbsolutePath());
            err.println("📁 Output: " + output.getAbsolutePath());
            err.println("⚙️  Pages: " + extracted.result.pageCount +
                    (options.isAddPdfPageHeader() ? ", header" : "") +
                    (doReflow ? ", reflow" : "") +
                    (options.isCompact() ? ", compact" : ""));
            return 0;
        } catch (IllegalArgumentException ex) {
            err.println("❌ " + ex.getMessage());
            return 1;
        } catch (Exception ex) {
            LOGGER.log(Level.SEVERE, "Error during PDF extraction", ex);
            err.println("❌ Exception occurred: " + ex.getMessage());
            return 1;
        }
    }

    // ---- helpers ---------------------------------------------------------

    private boolean validateInputPdf(PrintWriter err) {
        if (!input.exists()) {
            err.println("❌ Input file does not exist: " + input.getAbsolutePath());
            return false;
        }
        if (!input.isFile()) {
            err.println("❌ Input path is not a file: " + input.getAbsolutePath());
            return false;
        }

        String ext = getExtension(input.getName()).toLowerCase(Locale.ROOT);
        if (!".pdf".equals(ext)) {
            err.println("❌ Input file is not a PDF: " + input.getName());
            return false;
        }
        return true;
    }

    private String removeExtension(String filename) {
        int idx = filename.lastIndexOf('.');
        return (idx != -1) ? filename.substring(0, idx) : filename;
    }

    private String getExtension(String filename) {
        int idx = filename.lastIndexOf('.');
        return (idx != -1) ? filename.substring(idx) : "";
    }
}
