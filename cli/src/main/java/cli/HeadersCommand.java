package cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import util.HeaderParser;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Edits the saved custom headers sent with every request.
 */
@Command(name = "headers", mixinStandardHelpOptions = true,
    description = "List, set or remove saved custom headers")
class HeadersCommand extends AbstractProbeCommand {

    @Option(names = {"--set"}, paramLabel = "NAME:VALUE", description = "Add or replace a header (repeatable)")
    List<String> set = new ArrayList<>();

    @Option(names = {"--remove"}, paramLabel = "NAME", description = "Remove a header (repeatable)")
    List<String> remove = new ArrayList<>();

    @Option(names = {"--clear"}, description = "Remove all saved headers")
    boolean clear;

    @Override
    protected int execute(ProbeContext context) throws Exception {
        // Validate everything before touching the stored document
        Map<String, String> additions = HeaderParser.parseAll(set);

        Map<String, String> headers = clear ? new LinkedHashMap<>() : context.store().loadHeaders();
        boolean changed = clear;
        for (String name : remove) {
            changed |= removeIgnoreCase(headers, name.trim());
        }
        for (Map.Entry<String, String> entry : additions.entrySet()) {
            removeIgnoreCase(headers, entry.getKey());
            headers.put(entry.getKey(), entry.getValue());
            changed = true;
        }

        if (changed) {
            context.store().saveHeaders(headers);
        }

        PrintWriter out = context.out();
        if (headers.isEmpty()) {
            out.println("No saved headers.");
        } else {
            headers.forEach((name, value) -> out.println(name + ": " + value));
        }
        out.flush();
        return ExitCodes.OK;
    }

    private static boolean removeIgnoreCase(Map<String, String> headers, String name) {
        return headers.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
    }
}
