package com.cronhook.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Posts a job's payload body to its url on a bounded worker pool.
 * <p>
 * Each firing gets exactly one attempt. The timeout bounds the whole call,
 * including reading the response body, and redirects are not followed.
 * Firings that find every worker busy wait in a bounded queue; when the queue
 * is full the firing is recorded as failed. Failures are logged, counted in
 * {@link Metrics} and reported to listeners; they never reach the trigger that
 * fired the job.
 */
public class WebhookDispatcher implements JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(WebhookDispatcher.class);
    static final String JOB_ID_HEADER = "X-Cronhook-Job-Id";

    private final HttpClient client;
    private final Duration timeout;
    private final ThreadPoolExecutor workers;
    private final ObjectMapper mapper = Json.newMapper();
    private final List<DispatchListener> listeners = new CopyOnWriteArrayList<>();

    public WebhookDispatcher() {
        this(Duration.ofSeconds(Config.getInt("DISPATCH_TIMEOUT_SECONDS", 10)),
             Config.getInt("MAX_CONCURRENT_DISPATCHES", 16));
    }

    public WebhookDispatcher(Duration timeout, int maxConcurrent) {
        this(timeout, maxConcurrent, Config.getInt("MAX_QUEUED_DISPATCHES", 64));
    }

    public WebhookDispatcher(Duration timeout, int maxConcurrent, int maxQueued) {
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        int threads = Math.max(1, maxConcurrent);
        this.workers = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, maxQueued)), daemonThreads("cronhook-dispatch-"));
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** Register a listener for call outcomes. */
    public void addListener(DispatchListener l) {
        listeners.add(l);
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public void dispatch(Job job) {
        if (!job.hasTarget()) {
            log.info("Job {} ({}) fired with no webhook url", job.id(), job.name());
            return;
        }
        try {
            workers.execute(() -> send(job));
        } catch (RejectedExecutionException e) {
            if (workers.isShutdown()) {
                log.debug("Dispatcher is shut down, dropping firing of job {}", job.id());
                return;
            }
            record(new DispatchOutcome(job.id(), job.payload().url(), -1, false,
                    "dispatch queue full (" + workers.getQueue().size() + " waiting)", 0));
        }
    }

    private void send(Job job) {
        String url = job.payload().url();
        long start = System.currentTimeMillis();
        DispatchOutcome outcome;
        try {
            HttpRequest.BodyPublisher body = job.payload().body() == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(job.payload().body()));
            HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header(JOB_ID_HEADER, job.id())
                    .POST(body)
                    .build();
            outcome = await(job, client.sendAsync(request, HttpResponse.BodyHandlers.discarding()), start);
        } catch (Exception e) {
            outcome = new DispatchOutcome(job.id(), url, -1, false, describe(e), System.currentTimeMillis() - start);
        }
        record(outcome);
    }

    private DispatchOutcome await(Job job, CompletableFuture<HttpResponse<Void>> call, long start) {
        String url = job.payload().url();
        String error;
        try {
            int status = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS).statusCode();
            boolean ok = status >= 200 && status < 300;
            return new DispatchOutcome(job.id(), url, status, ok, ok ? null : "HTTP " + status,
                    System.currentTimeMillis() - start);
        } catch (TimeoutException e) {
            call.cancel(true);
            error = "timed out after " + timeout.toMillis() + " ms";
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            error = "interrupted";
        } catch (ExecutionException e) {
            error = describe(e.getCause() == null ? e : e.getCause());
        }
        return new DispatchOutcome(job.id(), url, -1, false, error, System.currentTimeMillis() - start);
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
    }

    private void record(DispatchOutcome outcome) {
        Metrics metrics = Metrics.getInstance();
        metrics.recordDuration(outcome.durationMillis());
        if (outcome.success()) {
            metrics.recordSuccess();
            log.info("Webhook for job {} sent to {}: {} in {} ms",
                    outcome.jobId(), outcome.url(), outcome.statusCode(), outcome.durationMillis());
        } else {
            metrics.recordFailure();
            log.warn("Webhook for job {} to {} failed: {}", outcome.jobId(), outcome.url(), outcome.error());
        }
        for (DispatchListener l : listeners) {
            try {
                l.dispatchFinished(outcome);
            } catch (Exception e) {
                log.warn("Dispatch listener {} failed", l, e);
            }
        }
    }

    @Override
    public void shutdown() {
        workers.shutdownNow();
    }
}
