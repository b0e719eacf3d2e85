package cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Main CLI entry point for the HTTP probe toolkit.
 *
 * <p>Examples:
 * <pre>
 * # Send a request and classify the response
 * http-probe request -X POST --json -d '{"q":1}' https://target.example/api
 *
 * # Fuzz a query parameter with SQL and XSS payloads, 20 requests in flight
 * http-probe inject -p id --category sql --category xss -c 20 https://target.example/item
 *
 * # Brute-force a login form carrying a CSRF token
 * http-probe brute --username admin -w passwords.txt --csrf-field csrf_token \
 *   --failure "Invalid password" https://target.example/login
 * </pre>
 */
@Command(
    name = "http-probe",
    description = "HTTP probing and attack-testing toolkit",
    mixinStandardHelpOptions = true,
    version = "1.0-SNAPSHOT",
    subcommands = {
        RequestCommand.class,
        ScanCommand.class,
        InjectCommand.class,
        BruteCommand.class,
        LoginCommand.class,
        HeadersCommand.class,
        PayloadsCommand.class,
        SessionCommand.class
    }
)
public class HttpProbeCli implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return ExitCodes.OK;
    }

    public static CommandLine commandLine() {
        return new CommandLine(new HttpProbeCli());
    }

    public static void main(String[] args) {
        LoggingSetup.configure();
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
