package cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import probe.classifier.ResponseClassifier;
import probe.log.LogChannel;
import probe.model.Finding;
import probe.model.ProbeRequest;
import probe.model.ProbeResult;
import report.ExchangeReport;

import java.util.List;

/**
 * GETs a URL and reports the classifier findings.
 */
@Command(name = "scan", mixinStandardHelpOptions = true,
    description = "Fetch a URL and check the response for missing security headers and disclosures")
class ScanCommand extends AbstractProbeCommand {

    @Parameters(index = "0", description = "Target URL")
    String url;

    @Override
    protected int execute(ProbeContext context) throws Exception {
        ProbeRequest request = ProbeRequest.builder().url(url).build();
        ProbeResult result = context.send(request);

        if (result.isFailed()) {
            String error = result.getError().orElse(request + " failed");
            context.log(LogChannel.INTERCEPT, request + " -> ERROR " + error);
            context.logError("scan: " + error);
            context.render((reporter, writer) -> reporter.generate(ExchangeReport.of(result, List.of()), writer));
            return ExitCodes.TRANSPORT_FAILURE;
        }

        List<Finding> findings = new ResponseClassifier().classify(result.getResponse().get());
        context.log(LogChannel.INTERCEPT, request + " -> " + result.getStatusCode().getAsInt() +
            RequestCommand.describeFindings(findings));

        context.render((reporter, writer) -> reporter.generate(ExchangeReport.of(result, findings), writer));
        context.saveSession();
        return findings.isEmpty() ? ExitCodes.OK : ExitCodes.ISSUES_FOUND;
    }
}
