package cjkreflowcli;

import cjkreflow.CjkReflowEngine;
import cjkreflow.ReflowOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand for reflowing already extracted plain text.
 *
 * <pre>
 *   cjkreflow reflow -i book.txt -o book_reflowed.txt --compact
 *   cat book.txt | cjkreflow reflow --boundary 3
 * </pre>
 */
@Command(
        name = "reflow",
        description = "\033[1;34mReflow CJK paragraphs of extracted plain text\033[0m",
        mixinStandardHelpOptions = true
)
public class ReflowCommand implements Callable<Integer> {

    @Option(names = {"-i", "--input"}, paramLabel = "<file>", description = "Input text file (default: stdin)")
    private File input;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>", description = "Output file, UTF-8 (default: stdout)")
    private File output;

    @Option(names = {"--in-enc"}, paramLabel = "<encoding>", defaultValue = "UTF-8", description = "Input encoding")
    private String inEncoding;

    @Option(names = {"-v", "--verbose"}, description = "Log reflow statistics")
    private boolean verbose;

    @Mixin
    private ReflowOptionsMixin reflowOptions;

    @Spec
    private CommandSpec spec;

    private static final Logger LOGGER = Logger.getLogger(ReflowCommand.class.getName());

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();

        try {
            if (input != null && !input.isFile()) {
                err.println("❌ Input file does not exist: " + input.getAbsolutePath());
                return 1;
            }

            ReflowOptions options = reflowOptions.resolve();
            CjkReflowEngine.setVerboseLogging(verbose);

            String text = stripBom(readInput(Charset.forName(inEncoding)));
            String reflowed = CjkReflowEngine.reflow(text, options);

            if (output != null) {
                Files.write(output.toPath(), reflowed.getBytes(StandardCharsets.UTF_8));
                err.println("✅ Reflow completed: " + (input != null ? input.getPath() : "<stdin>")
                        + " → " + output.getPath());
            } else {
                PrintWriter out = spec.commandLine().getOut();
                out.print(reflowed);
                out.println();
                out.flush();
            }
            return 0;
        } catch (IllegalArgumentException ex) {
            err.println("❌ " + ex.getMessage());
            return 1;
        } catch (Exception ex) {
            LOGGER.log(Level.SEVERE, "Error during reflow", ex);
            err.println("❌ Exception occurred: " + ex.getMessage());
            return 1;
        }
    }

    private String readInput(Charset charset) throws IOException {
        if (input != null) {
            return new String(Files.readAllBytes(input.toPath()), charset);
        }
        return new String(System.in.readAllBytes(), charset);
    }

    static String stripBom(String s) {
        if (s != null && !s.isEmpty() && s.charAt(0) == '\uFEFF') {
            return s.substring(1);
        }
        return s;
    }
}
