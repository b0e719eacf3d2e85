package probe.log;

/**
 * Append-only activity log channels, one file each.
 */
public enum LogChannel {
    INTERCEPT("intercept.log"),
    ERROR("errors.log"),
    CUSTOM_REQUEST("custom_requests.log"),
    INJECTION_TEST("injection_tests.log"),
    BRUTE_FORCE("brute_force.log"),
    LOGIN("login.log");

    private final String fileName;

    LogChannel(String fileName) {
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
