package probe.bruteforce;

/**
 * States of a brute-force run.
 * {@link #SUCCESS}, {@link #EXHAUSTED} and {@link #ABORTED} are terminal.
 */
public enum BruteForceState {
    INIT,
    CSRF_FETCH,
    ITERATING,
    SUCCESS,
    EXHAUSTED,
    ABORTED;

    public boolean isTerminal() {
        return this == SUCCESS || this == EXHAUSTED || this == ABORTED;
    }
}
