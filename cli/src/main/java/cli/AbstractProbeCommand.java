package cli;

import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;
import probe.bruteforce.WordlistException;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base for subcommands: builds the {@link ProbeContext} and maps failures to exit codes.
 *
 * <ul>
 *   <li>{@link IllegalArgumentException} and {@link WordlistException}: {@link ExitCodes#INVALID_INPUT}</li>
 *   <li>anything else: {@link ExitCodes#UNEXPECTED_ERROR}</li>
 * </ul>
 */
abstract class AbstractProbeCommand implements Callable<Integer> {
    private static final Logger logger = Logger.getLogger(AbstractProbeCommand.class.getName());

    @Mixin
    CommonOptions options;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (options.isVerbose()) {
            LoggingSetup.enableVerbose();
        }

        ProbeContext context;
        try {
            context = ProbeContext.open(options, out, err);
        } catch (IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            err.flush();
            return ExitCodes.INVALID_INPUT;
        }

        try {
            return execute(context);
        } catch (WordlistException | IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            context.logError(spec.name() + ": " + e.getMessage());
            return ExitCodes.INVALID_INPUT;
        } catch (Exception e) {
            logger.log(Level.FINE, "Unexpected failure in " + spec.name(), e);
            err.println("ERROR: Unexpected error occurred: " + e.getMessage());
            if (options.isVerbose()) {
                e.printStackTrace(err);
            }
            context.logError(spec.name() + ": unexpected error - " + e);
            return ExitCodes.UNEXPECTED_ERROR;
        } finally {
            context.close();
        }
    }

    /**
     * Run the command.
     *
     * @return process exit code
     */
    protected abstract int execute(ProbeContext context) throws Exception;
}
