package cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import probe.classifier.ResponseClassifier;
import probe.log.LogChannel;
import probe.model.Finding;
import probe.model.HttpMethod;
import probe.model.ProbeRequest;
import probe.model.ProbeResult;
import report.ExchangeReport;
import util.HttpMethodParser;
import util.JsonBodyValidator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Sends one custom request and classifies the response.
 */
@Command(name = "request", mixinStandardHelpOptions = true,
    description = "Send a custom HTTP request and classify the response")
class RequestCommand extends AbstractProbeCommand {

    @Parameters(index = "0", description = "Target URL")
    String url;

    @Option(names = {"-X", "--method"}, description = "HTTP method: GET, POST, PUT, DELETE, HEAD (default: GET)",
        defaultValue = "GET")
    String method;

    @Option(names = {"-d", "--data"}, description = "Raw request body")
    String body;

    @Option(names = {"--json"}, description = "Validate the body as JSON and send it as application/json")
    boolean json;

    @Option(names = {"--form"}, description = "Form field (format: name=value), repeatable")
    Map<String, String> form = new LinkedHashMap<>();

    @Override
    protected int execute(ProbeContext context) throws Exception {
        HttpMethod httpMethod = HttpMethodParser.parse(method);
        ProbeRequest request = buildRequest(httpMethod);

        ProbeResult result = context.send(request);
        List<Finding> findings = result.getResponse()
            .map(response -> new ResponseClassifier().classify(response))
            .orElse(List.of());

        if (result.isFailed()) {
            context.log(LogChannel.CUSTOM_REQUEST, request + " -> ERROR " + result.getError().orElse(""));
            context.logError("request: " + request.getUrl() + ": " + result.getError().orElse("failed"));
        } else {
            context.log(LogChannel.CUSTOM_REQUEST, request + " -> " + result.getStatusCode().getAsInt() +
                " (" + String.format(Locale.ROOT, "%.1f", result.getElapsedMs()) + "ms, " +
                result.getBodyLength() + " bytes)" + describeFindings(findings));
        }

        context.render((reporter, writer) -> reporter.generate(ExchangeReport.of(result, findings), writer));
        context.saveSession();
        return result.isFailed() ? ExitCodes.TRANSPORT_FAILURE : ExitCodes.OK;
    }

    ProbeRequest buildRequest(HttpMethod httpMethod) {
        ProbeRequest.Builder builder = ProbeRequest.builder()
            .url(url)
            .method(httpMethod);

        if (json) {
            JsonBodyValidator.validate(body);
            builder.body(body).bodyContentType(JsonBodyValidator.JSON_CONTENT_TYPE);
        } else if (body != null) {
            builder.body(body);
        }
        if (!form.isEmpty()) {
            builder.formFields(form);
        }
        return builder.build();
    }

    static String describeFindings(List<Finding> findings) {
        if (findings.isEmpty()) {
            return "";
        }
        return " findings: " + findings.stream().map(Finding::getLabel).collect(Collectors.joining(", "));
    }
}
