package probe.injection;

/**
 * Listener for injection run progress.
 * Callbacks for individual outcomes arrive on worker threads, in completion order.
 */
public interface InjectionProgressListener {

    /**
     * Called once before any request is dispatched.
     *
     * @param totalPayloads number of payloads to test
     * @param workers       number of worker threads
     */
    void onRunStart(int totalPayloads, int workers);

    /**
     * Called when one payload has been evaluated.
     *
     * @param index     submission index of the payload
     * @param completed number of payloads finished so far
     * @param outcome   the outcome for that payload
     */
    void onOutcome(int index, int completed, InjectionOutcome outcome);

    /**
     * Called after every payload has been evaluated.
     */
    void onRunComplete(InjectionReport report);

    static InjectionProgressListener noOp() {
        return new InjectionProgressListener() {
            @Override
            public void onRunStart(int totalPayloads, int workers) {}

            @Override
            public void onOutcome(int index, int completed, InjectionOutcome outcome) {}

            @Override
            public void onRunComplete(InjectionReport report) {}
        };
    }
}
