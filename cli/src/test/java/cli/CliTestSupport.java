package cli;

import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs the CLI in-process with captured streams and an isolated state directory.
 */
final class CliTestSupport {
    private final Path stateDir;
    private StringWriter out;
    private StringWriter err;

    CliTestSupport(Path stateDir) {
        this.stateDir = stateDir;
    }

    int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine commandLine = HttpProbeCli.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));

        // Subcommand name first, then shared options
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        arguments.add(1, "--state-dir");
        arguments.add(2, stateDir.toString());
        arguments.add(3, "-nc");
        return commandLine.execute(arguments.toArray(new String[0]));
    }

    String out() {
        return out.toString();
    }

    String err() {
        return err.toString();
    }
}
