package cli;

import probe.bruteforce.BruteForceProgressListener;
import probe.bruteforce.BruteForceState;
import probe.bruteforce.LoginAttempt;
import probe.injection.InjectionOutcome;
import probe.injection.InjectionProgressListener;
import probe.injection.InjectionReport;

import java.io.PrintWriter;

/**
 * Prints run progress to the error stream while the report is being built.
 * Injection callbacks arrive from worker threads, so printing is synchronized.
 */
final class ConsoleProgressListener implements InjectionProgressListener, BruteForceProgressListener {
    private final PrintWriter err;
    private int total;

    ConsoleProgressListener(PrintWriter err) {
        this.err = err;
    }

    @Override
    public synchronized void onRunStart(int totalPayloads, int workers) {
        this.total = totalPayloads;
        err.println("Testing " + totalPayloads + " payload(s) with " + workers + " worker(s)...");
        err.flush();
    }

    @Override
    public synchronized void onOutcome(int index, int completed, InjectionOutcome outcome) {
        String status = outcome.getResult().getStatusCode().isPresent()
            ? String.valueOf(outcome.getResult().getStatusCode().getAsInt())
            : "ERROR";
        String note = outcome.getSignal().map(signal -> " " + signal.getNote()).orElse("");
        err.println("[" + completed + "/" + total + "] " + outcome.getPayload() + " -> " + status + note);
        err.flush();
    }

    @Override
    public synchronized void onRunComplete(InjectionReport report) {
        err.println("Done: " + report.getSignalledCount() + " signalled, " + report.getFailedCount() + " failed");
        err.flush();
    }

    @Override
    public void onStateChange(BruteForceState from, BruteForceState to) {
        if (to == BruteForceState.CSRF_FETCH) {
            err.println("Fetching CSRF token...");
            err.flush();
        }
    }

    @Override
    public void onAttempt(LoginAttempt attempt) {
        String outcome;
        if (attempt.isTransportFailure()) {
            outcome = "ERROR";
        } else {
            outcome = attempt.success() ? "SUCCESS" : "failed";
        }
        err.println("[#" + attempt.number() + "] " + attempt.password() + " -> " + outcome);
        err.flush();
    }
}
