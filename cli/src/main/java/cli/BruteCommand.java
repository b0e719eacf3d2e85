package cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import probe.bruteforce.BruteForceConfig;
import probe.bruteforce.BruteForceEngine;
import probe.bruteforce.BruteForceProgressListener;
import probe.bruteforce.BruteForceResult;
import probe.bruteforce.BruteForceState;
import probe.bruteforce.LoginAttempt;
import probe.bruteforce.PasswordSource;
import probe.log.LogChannel;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Brute-forces one username against a login form with passwords from a wordlist.
 */
@Command(name = "brute", mixinStandardHelpOptions = true,
    description = "Try passwords from a wordlist against a login form")
class BruteCommand extends AbstractProbeCommand {

    @Parameters(index = "0", description = "Login form URL")
    String url;

    @Option(names = {"-u", "--username"}, required = true, description = "Username to attack")
    String username;

    @Option(names = {"-w", "--wordlist"}, required = true, description = "Password file, one password per line")
    Path wordlist;

    @Mixin
    LoginFormOptions form;

    @Option(names = {"--delay"}, description = "Delay in milliseconds between attempts (default: ${DEFAULT-VALUE})",
        defaultValue = "0")
    int delayMs;

    @Override
    protected int execute(ProbeContext context) throws Exception {
        // Open the wordlist before anything touches the network
        try (PasswordSource passwords = PasswordSource.fromFile(wordlist)) {
            BruteForceProgressListener listener = context.isJsonOutput()
                ? BruteForceProgressListener.noOp()
                : new ConsoleProgressListener(context.err());

            BruteForceConfig config = form.applyTo(BruteForceConfig.builder())
                .loginUrl(url)
                .username(username)
                .requestDelayMs(delayMs)
                .progressListener(listener)
                .build();

            context.log(LogChannel.BRUTE_FORCE, "Run " + url + " user=" + username + " wordlist=" + wordlist);
            BruteForceResult result = new BruteForceEngine(context.httpClient()).run(config, passwords);
            logAttempts(context, LogChannel.BRUTE_FORCE, result);

            context.render((reporter, writer) -> reporter.generate(result, writer));
            if (result.isSuccess()) {
                context.saveSession();
                return ExitCodes.ISSUES_FOUND;
            }
            return result.getState() == BruteForceState.ABORTED ? ExitCodes.INVALID_INPUT : ExitCodes.OK;
        }
    }

    static void logAttempts(ProbeContext context, LogChannel channel, BruteForceResult result) {
        String source = channel.name().toLowerCase(Locale.ROOT);
        if (result.isCsrfRequested()) {
            context.log(channel, "CSRF token " + (result.getCsrfToken().isPresent() ? "extracted" : "not found") +
                " at " + result.getLoginUrl());
        }
        for (LoginAttempt attempt : result.getAttempts()) {
            String prefix = "user=" + result.getUsername() + " password=" + attempt.password();
            if (attempt.isTransportFailure()) {
                String error = attempt.result().getError().orElse("");
                context.log(channel, prefix + " ERROR " + error);
                context.logError(source + ": " + error + " (user: " + result.getUsername() +
                    ", password: " + attempt.password() + ")");
            } else {
                context.log(channel, prefix + " status=" + attempt.result().getStatusCode().getAsInt() +
                    (attempt.success() ? " SUCCESS" : " failed"));
            }
        }
        result.getErrorMessage().ifPresent(message -> context.logError(source + ": " + message));
        context.log(channel, "Finished: " + result.getState() + " after " + result.getAttemptCount() + " attempt(s)");
    }
}
