package cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import probe.bruteforce.BruteForceConfig;
import probe.bruteforce.BruteForceEngine;
import probe.bruteforce.BruteForceResult;
import probe.bruteforce.PasswordSource;
import probe.log.LogChannel;

/**
 * Submits a single credential and keeps the session cookies when it is accepted.
 */
@Command(name = "login", mixinStandardHelpOptions = true,
    description = "Log in with one credential and store the session on success")
class LoginCommand extends AbstractProbeCommand {

    @Parameters(index = "0", description = "Login form URL")
    String url;

    @Option(names = {"-u", "--username"}, required = true, description = "Username")
    String username;

    @Option(names = {"-p", "--password"}, required = true, description = "Password")
    String password;

    @Mixin
    LoginFormOptions form;

    @Override
    protected int execute(ProbeContext context) throws Exception {
        BruteForceConfig config = form.applyTo(BruteForceConfig.builder())
            .loginUrl(url)
            .username(username)
            .build();

        context.log(LogChannel.LOGIN, "Login " + url + " user=" + username);
        BruteForceResult result = new BruteForceEngine(context.httpClient()).run(config, PasswordSource.of(password));
        BruteCommand.logAttempts(context, LogChannel.LOGIN, result);

        context.render((reporter, writer) -> reporter.generate(result, writer));

        if (result.isSuccess()) {
            context.saveSession();
            return ExitCodes.OK;
        }
        return result.getTransportFailureCount() > 0 ? ExitCodes.TRANSPORT_FAILURE : ExitCodes.LOGIN_REJECTED;
    }
}
