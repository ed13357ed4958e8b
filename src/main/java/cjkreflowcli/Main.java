package cjkreflowcli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
        name = "cjkreflow",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "\033[1;34mCJK paragraph reflow for PDF / plain text extractions\033[0m",
        subcommands = {
                ReflowCommand.class,
                PdfCommand.class
        }
)
public class Main implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        // Called when no subcommand is provided
        spec.commandLine().getOut().println("Use --help or a subcommand (reflow / pdf)");
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
