package cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import probe.injection.InjectionConfig;
import probe.injection.InjectionEngine;
import probe.injection.InjectionOutcome;
import probe.injection.InjectionProgressListener;
import probe.injection.InjectionReport;
import probe.log.LogChannel;
import probe.model.ProbeResult;
import probe.payload.Payload;
import probe.payload.PayloadCategory;
import probe.payload.PayloadLibrary;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Runs the injection engine against one URL parameter.
 */
@Command(name = "inject", mixinStandardHelpOptions = true,
    description = "Inject stored payloads into a URL parameter and flag suspicious responses")
class InjectCommand extends AbstractProbeCommand {

    @Parameters(index = "0", description = "Target URL")
    String url;

    @Option(names = {"-p", "--param"},
        description = "Query parameter to inject into; without it payloads are appended to the URL as given")
    String param;

    @Option(names = {"--category"},
        description = "Payload category: sql, xss, path_traversal, command_injection (repeatable, default: all)")
    List<String> categories = new ArrayList<>();

    @Option(names = {"-c", "--concurrency"}, description = "Maximum requests in flight (default: ${DEFAULT-VALUE})",
        defaultValue = "10")
    int concurrency;

    @Option(names = {"--isolate-cookies"}, description = "Do not store cookies set by responses during the run")
    boolean isolateCookies;

    @Option(names = {"--delay-threshold"},
        description = "Elapsed milliseconds reported as a time-based delay (default: ${DEFAULT-VALUE})",
        defaultValue = "1000")
    double delayThresholdMs;

    @Override
    protected int execute(ProbeContext context) throws Exception {
        Set<PayloadCategory> selected = EnumSet.noneOf(PayloadCategory.class);
        for (String category : categories) {
            selected.add(PayloadCategory.fromKey(category));
        }

        PayloadLibrary library = context.store().loadPayloads();
        List<Payload> payloads = library.select(selected);
        String template = buildTemplate(url, param);

        InjectionProgressListener listener = context.isJsonOutput()
            ? InjectionProgressListener.noOp()
            : new ConsoleProgressListener(context.err());

        InjectionConfig config = InjectionConfig.builder()
            .urlTemplate(template)
            .payloads(payloads)
            .concurrency(concurrency)
            .delayThresholdMs(delayThresholdMs)
            .isolateCookies(isolateCookies)
            .progressListener(listener)
            .build();

        InjectionReport report = new InjectionEngine(context.httpClient()).run(config);
        logOutcomes(context, report);

        context.render((reporter, writer) -> reporter.generate(report, writer));
        context.saveSession();
        return report.getSignalledCount() > 0 ? ExitCodes.ISSUES_FOUND : ExitCodes.OK;
    }

    /**
     * URL ending at the injection point. With a parameter name, {@code name=} is appended
     * as a new query parameter.
     */
    static String buildTemplate(String url, String param) {
        if (param == null || param.isBlank()) {
            return url;
        }
        String separator = url.contains("?") ? (url.endsWith("?") || url.endsWith("&") ? "" : "&") : "?";
        return url + separator + URLEncoder.encode(param, StandardCharsets.UTF_8) + "=";
    }

    private static void logOutcomes(ProbeContext context, InjectionReport report) {
        context.log(LogChannel.INJECTION_TEST, "Run " + report.getUrlTemplate() + " payloads=" + report.size() +
            " concurrency=" + report.getConcurrency());
        for (InjectionOutcome outcome : report.getOutcomes()) {
            ProbeResult result = outcome.getResult();
            Payload payload = outcome.getPayload();
            if (result.isFailed()) {
                String error = result.getError().orElse("");
                context.log(LogChannel.INJECTION_TEST, "payload=" + payload + " url=" + result.getRequest().getUrl() +
                    " ERROR " + error);
                context.logError("inject: " + error + " (payload: " + payload + ")");
                continue;
            }
            context.log(LogChannel.INJECTION_TEST, "payload=" + payload +
                " url=" + result.getRequest().getUrl() +
                " status=" + result.getStatusCode().getAsInt() +
                " time=" + String.format(Locale.ROOT, "%.1f", result.getElapsedMs()) + "ms" +
                " length=" + result.getBodyLength() +
                outcome.getSignal().map(signal -> " note=" + signal.getNote()).orElse(""));
        }
        context.log(LogChannel.INJECTION_TEST, "Finished: " + report.getSignalledCount() + " signalled, " +
            report.getFailedCount() + " failed");
    }
}
