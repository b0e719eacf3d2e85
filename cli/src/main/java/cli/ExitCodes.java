package cli;

/**
 * Process exit codes shared by all subcommands.
 */
public final class ExitCodes {
    public static final int OK = 0;
    public static final int INVALID_INPUT = 1;
    public static final int TRANSPORT_FAILURE = 2;
    public static final int ISSUES_FOUND = 3;
    public static final int LOGIN_REJECTED = 4;
    public static final int UNEXPECTED_ERROR = 99;

    private ExitCodes() {
        throw new UnsupportedOperationException("Utility class");
    }
}
