package probe.bruteforce;

/**
 * Listener for brute-force run progress. All callbacks arrive on the caller's thread.
 */
public interface BruteForceProgressListener {

    /**
     * Called on every state transition.
     */
    void onStateChange(BruteForceState from, BruteForceState to);

    /**
     * Called after each login attempt.
     */
    void onAttempt(LoginAttempt attempt);

    static BruteForceProgressListener noOp() {
        return new BruteForceProgressListener() {
            @Override
            public void onStateChange(BruteForceState from, BruteForceState to) {}

            @Override
            public void onAttempt(LoginAttempt attempt) {}
        };
    }
}
