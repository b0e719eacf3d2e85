package cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import probe.session.DocumentStore;
import probe.session.SessionDocument;
import probe.session.StoredCookie;

import java.io.PrintWriter;

/**
 * Shows or clears the stored session.
 */
@Command(name = "session", mixinStandardHelpOptions = true,
    description = "Show or clear the stored session cookies and headers")
class SessionCommand extends AbstractProbeCommand {

    @Option(names = {"--clear"}, description = "Delete the stored session")
    boolean clear;

    @Override
    protected int execute(ProbeContext context) throws Exception {
        PrintWriter out = context.out();
        if (clear) {
            boolean deleted = context.store().delete(DocumentStore.SESSION);
            out.println(deleted ? "Session cleared." : "No stored session.");
            out.flush();
            return ExitCodes.OK;
        }

        SessionDocument session = context.store().loadSession();
        if (session.isEmpty()) {
            out.println("No stored session.");
            out.flush();
            return ExitCodes.OK;
        }

        out.println("Headers: " + session.headers().size());
        session.headers().forEach((name, value) -> out.println("  " + name + ": " + value));
        out.println("Cookies: " + session.cookies().size());
        for (StoredCookie cookie : session.cookies()) {
            out.println("  " + cookie.name() + "=" + cookie.value() +
                " (domain=" + cookie.domain() + ", path=" + cookie.path() + (cookie.secure() ? ", secure" : "") + ")");
        }
        out.flush();
        return ExitCodes.OK;
    }
}
