package cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import probe.payload.PayloadCategory;
import probe.payload.PayloadLibrary;
import probe.session.DocumentStore;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Shows and extends the stored payload library used by {@code inject}.
 */
@Command(name = "payloads", mixinStandardHelpOptions = true,
    description = "List, add or reset injection payloads")
class PayloadsCommand extends AbstractProbeCommand {

    @Option(names = {"--add"}, paramLabel = "CATEGORY=PAYLOAD",
        description = "Append a payload to a category (repeatable)")
    List<String> add = new ArrayList<>();

    @Option(names = {"--reset"}, description = "Discard stored payloads and return to the built-in set")
    boolean reset;

    @Option(names = {"--category"}, description = "Only list these categories (repeatable)")
    List<String> categories = new ArrayList<>();

    @Override
    protected int execute(ProbeContext context) throws Exception {
        Set<PayloadCategory> shown = EnumSet.noneOf(PayloadCategory.class);
        for (String category : categories) {
            shown.add(PayloadCategory.fromKey(category));
        }

        if (reset) {
            context.store().delete(DocumentStore.PAYLOADS);
        }

        PayloadLibrary library = context.store().loadPayloads();
        if (!add.isEmpty()) {
            for (String entry : add) {
                int separator = entry.indexOf('=');
                if (separator <= 0) {
                    throw new IllegalArgumentException(
                        "Invalid payload '" + entry + "'. Expected CATEGORY=PAYLOAD");
                }
                PayloadCategory category = PayloadCategory.fromKey(entry.substring(0, separator));
                String value = entry.substring(separator + 1);
                if (value.isEmpty()) {
                    throw new IllegalArgumentException("Payload for category '" + category + "' cannot be empty");
                }
                library = library.withPayload(category, value);
            }
            context.store().savePayloads(library);
        }

        PrintWriter out = context.out();
        Set<PayloadCategory> listed = shown.isEmpty() ? EnumSet.allOf(PayloadCategory.class) : shown;
        for (PayloadCategory category : listed) {
            List<String> values = library.get(category);
            out.println(category.getDisplayName() + " (" + category.getKey() + "): " + values.size());
            for (String value : values) {
                out.println("  " + value);
            }
        }
        out.flush();
        return ExitCodes.OK;
    }
}
