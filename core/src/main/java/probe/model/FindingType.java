package probe.model;

/**
 * Heuristic security observations the response classifier can emit.
 * Declaration order is the order in which the classifier evaluates its checks.
 */
public enum FindingType {
    MISSING_XSS_PROTECTION("missing-xss-protection", "X-XSS-Protection header is missing"),
    MISSING_CSP("missing-csp", "Content-Security-Policy header is missing"),
    MISSING_FRAME_OPTIONS("missing-frame-options", "X-Frame-Options header is missing"),
    MISSING_HSTS("missing-hsts", "Strict-Transport-Security header is missing"),
    SERVER_DISCLOSURE("server-disclosure", "Server header discloses web server software"),
    FRAMEWORK_DISCLOSURE("framework-disclosure", "X-Powered-By header discloses framework"),
    DIRECTORY_LISTING_ENABLED("directory-listing-enabled", "Directory listing appears to be enabled");

    private final String label;
    private final String description;

    FindingType(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return label;
    }
}
