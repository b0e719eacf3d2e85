package probe.classifier;

import probe.model.Finding;
import probe.model.FindingType;
import probe.model.ProbeResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps a completed response to heuristic security findings.
 *
 * <p>Checks, in evaluation order:
 * <ol>
 *   <li>missing {@code X-XSS-Protection}</li>
 *   <li>missing {@code Content-Security-Policy}</li>
 *   <li>missing {@code X-Frame-Options}</li>
 *   <li>missing {@code Strict-Transport-Security}</li>
 *   <li>{@code Server} value naming Apache, nginx or IIS</li>
 *   <li>non-empty {@code X-Powered-By}</li>
 *   <li>body containing {@code "Index of /"}</li>
 * </ol>
 * Every check runs on every response, independently of the others, and yields at most
 * one finding. Findings are returned in check order.
 *
 * <p>Stateless and thread-safe.
 */
public final class ResponseClassifier {

    private static final List<SecurityHeaderCheck> SECURITY_HEADER_CHECKS = List.of(
        new SecurityHeaderCheck("X-XSS-Protection", FindingType.MISSING_XSS_PROTECTION),
        new SecurityHeaderCheck("Content-Security-Policy", FindingType.MISSING_CSP),
        new SecurityHeaderCheck("X-Frame-Options", FindingType.MISSING_FRAME_OPTIONS),
        new SecurityHeaderCheck("Strict-Transport-Security", FindingType.MISSING_HSTS)
    );

    private static final List<String> DISCLOSED_SERVERS = List.of("apache", "nginx", "iis");

    private static final String DIRECTORY_LISTING_MARKER = "Index of /";

    /**
     * Classify a response that completed at the HTTP level.
     *
     * @param response response without transport error
     * @return findings in check order, possibly empty
     */
    public List<Finding> classify(ProbeResponse response) {
        Objects.requireNonNull(response, "response cannot be null");
        List<Finding> findings = new ArrayList<>();

        for (SecurityHeaderCheck check : SECURITY_HEADER_CHECKS) {
            if (!response.hasHeader(check.headerName())) {
                findings.add(Finding.of(check.findingType()));
            }
        }

        Optional<String> server = response.getHeader("Server");
        if (server.isPresent() && disclosesServer(server.get())) {
            findings.add(Finding.of(FindingType.SERVER_DISCLOSURE, server.get()));
        }

        Optional<String> poweredBy = response.getHeader("X-Powered-By");
        if (poweredBy.isPresent() && !poweredBy.get().isEmpty()) {
            findings.add(Finding.of(FindingType.FRAMEWORK_DISCLOSURE, poweredBy.get()));
        }

        String body = response.getBody();
        if (body != null && body.contains(DIRECTORY_LISTING_MARKER)) {
            findings.add(Finding.of(FindingType.DIRECTORY_LISTING_ENABLED));
        }

        return findings;
    }

    private static boolean disclosesServer(String serverValue) {
        String lowered = serverValue.toLowerCase(Locale.ROOT);
        return DISCLOSED_SERVERS.stream().anyMatch(lowered::contains);
    }

    private record SecurityHeaderCheck(String headerName, FindingType findingType) {
    }
}
