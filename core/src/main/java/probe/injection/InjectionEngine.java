package probe.injection;

import probe.classifier.ResponseClassifier;
import probe.http.HttpClient;
import probe.model.Finding;
import probe.model.HttpMethod;
import probe.model.ProbeRequest;
import probe.model.ProbeResponse;
import probe.model.ProbeResult;
import probe.payload.Payload;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans payloads out against a URL parameter and collects one outcome per payload.
 *
 * <p>Each payload is percent-encoded and appended to the URL template, then sent as a GET
 * through the shared {@link HttpClient}. Up to {@code concurrency} requests are in flight;
 * the rest queue on a fixed pool created for the run. Outcomes are written into slots
 * indexed by submission order, so the report order never depends on completion order.
 *
 * <p>A transport failure is recorded as that payload's outcome and the run continues.
 * Requests are attempted exactly once.
 */
public final class InjectionEngine {
    private static final Logger logger = Logger.getLogger(InjectionEngine.class.getName());

    private final HttpClient httpClient;
    private final ResponseClassifier classifier;

    public InjectionEngine(HttpClient httpClient) {
        this(httpClient, new ResponseClassifier());
    }

    public InjectionEngine(HttpClient httpClient, ResponseClassifier classifier) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier cannot be null");
    }

    /**
     * Run payloads against a template with default settings.
     *
     * @param urlTemplate URL ending at the injection point
     * @param payloads    payloads in submission order
     * @param concurrency maximum requests in flight, must be positive
     * @return report index-aligned with {@code payloads}
     */
    public InjectionReport run(String urlTemplate, List<Payload> payloads, int concurrency) {
        return run(InjectionConfig.builder()
            .urlTemplate(urlTemplate)
            .payloads(payloads)
            .concurrency(concurrency)
            .build());
    }

    /**
     * Run an injection test and block until every payload has been evaluated.
     *
     * @param config run parameters
     * @return report index-aligned with the configured payloads
     */
    public InjectionReport run(InjectionConfig config) {
        Instant startTime = Instant.now();
        List<Payload> payloads = config.getPayloads();
        int total = payloads.size();
        InjectionProgressListener listener = config.getProgressListener();

        if (total == 0) {
            logger.info("No payloads to test against " + config.getUrlTemplate());
            InjectionReport empty = new InjectionReport(
                config.getUrlTemplate(), config.getConcurrency(), List.of(), startTime, Instant.now());
            notifySafely(() -> listener.onRunComplete(empty));
            return empty;
        }

        int workers = Math.min(config.getConcurrency(), total);
        logger.info("Starting injection run: " + total + " payload(s), " + workers +
                    " worker(s), template " + config.getUrlTemplate());
        notifySafely(() -> listener.onRunStart(total, workers));

        AtomicReferenceArray<InjectionOutcome> slots = new AtomicReferenceArray<>(total);
        AtomicInteger completed = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        List<Future<?>> futures = new ArrayList<>(total);

        try {
            for (int i = 0; i < total; i++) {
                final int index = i;
                final Payload payload = payloads.get(i);
                futures.add(executor.submit(() -> {
                    InjectionOutcome outcome = evaluate(payload, config);
                    slots.set(index, outcome);
                    int done = completed.incrementAndGet();
                    notifySafely(() -> listener.onOutcome(index, done, outcome));
                }));
            }

            awaitAll(futures, payloads, config, slots);
        } finally {
            executor.shutdownNow();
        }

        List<InjectionOutcome> outcomes = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            outcomes.add(slots.get(i));
        }

        InjectionReport report = new InjectionReport(
            config.getUrlTemplate(), config.getConcurrency(), outcomes, startTime, Instant.now());
        logger.info("Injection run finished: " + report.getSignalledCount() + " signalled, " +
                    report.getFailedCount() + " failed out of " + total);
        notifySafely(() -> listener.onRunComplete(report));
        return report;
    }

    /**
     * Build the request URL for one payload.
     */
    public static String buildUrl(String urlTemplate, String payloadValue) {
        return urlTemplate + percentEncode(payloadValue);
    }

    /**
     * UTF-8 percent-encoding; unlike form encoding, a space becomes {@code %20}.
     */
    static String percentEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private InjectionOutcome evaluate(Payload payload, InjectionConfig config) {
        ProbeRequest request = ProbeRequest.builder()
            .url(buildUrl(config.getUrlTemplate(), payload.value()))
            .method(HttpMethod.GET)
            .headers(config.getHeaders())
            .persistCookies(!config.isIsolateCookies())
            .build();

        ProbeResult result;
        long start = System.nanoTime();
        try {
            ProbeResponse response = httpClient.execute(request);
            double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
            result = ProbeResult.from(request, response, elapsedMs);
        } catch (RuntimeException e) {
            double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
            logger.log(Level.FINE, "Client threw for payload " + payload, e);
            result = ProbeResult.failed(request,
                request.getMethod() + " " + request.getUrl() + " failed - " + e, elapsedMs);
        }

        if (result.isFailed()) {
            logger.fine("Payload " + payload + " failed: " + result.getError().orElse(""));
            return new InjectionOutcome(payload, result, null, List.of());
        }

        InjectionSignal signal = InjectionSignal.detect(result, config.getDelayThresholdMs()).orElse(null);
        List<Finding> findings = classifier.classify(result.getResponse().get());
        return new InjectionOutcome(payload, result, signal, findings);
    }

    private void awaitAll(List<Future<?>> futures, List<Payload> payloads, InjectionConfig config,
                          AtomicReferenceArray<InjectionOutcome> slots) {
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warning("Injection run interrupted, cancelling remaining payloads");
                futures.forEach(f -> f.cancel(true));
                fillMissing(slots, payloads, config, "Interrupted before completion");
                return;
            } catch (ExecutionException e) {
                logger.log(Level.WARNING, "Payload evaluation failed unexpectedly: " + payloads.get(i), e.getCause());
                slots.compareAndSet(i, null, failedOutcome(payloads.get(i), config,
                    "Evaluation failed - " + e.getCause()));
            }
        }
    }

    private void fillMissing(AtomicReferenceArray<InjectionOutcome> slots, List<Payload> payloads,
                             InjectionConfig config, String reason) {
        for (int i = 0; i < slots.length(); i++) {
            slots.compareAndSet(i, null, failedOutcome(payloads.get(i), config, reason));
        }
    }

    private static InjectionOutcome failedOutcome(Payload payload, InjectionConfig config, String reason) {
        ProbeRequest request = ProbeRequest.builder()
            .url(buildUrl(config.getUrlTemplate(), payload.value()))
            .method(HttpMethod.GET)
            .build();
        return new InjectionOutcome(payload,
            ProbeResult.failed(request, "GET " + request.getUrl() + " - " + reason, 0.0), null, List.of());
    }

    private static void notifySafely(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Progress listener failed: " + e.getMessage(), e);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "injection-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
