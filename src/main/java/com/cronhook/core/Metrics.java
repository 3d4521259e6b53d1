package com.cronhook.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simple metrics registry that tracks firings and webhook calls and exposes them via JMX.
 */
public final class Metrics implements MetricsMBean {
    private static final Logger log = LoggerFactory.getLogger(Metrics.class);
    private static final Metrics INSTANCE = new Metrics();

    private final AtomicInteger firingCount = new AtomicInteger();
    private final AtomicInteger successCount = new AtomicInteger();
    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicLong totalDuration = new AtomicLong();
    private final AtomicInteger durationSamples = new AtomicInteger();

    private Metrics() {}

    /**
     * Returns the singleton metrics instance.
     */
    public static Metrics getInstance() {
        return INSTANCE;
    }

    /**
     * Registers the Metrics MBean with the platform MBean server if not already registered.
     */
    public static void init() {
        try {
            MBeanServer server = ManagementFactory.getPlatformMBeanServer();
            ObjectName name = new ObjectName("com.cronhook.core:type=Metrics");
            if (!server.isRegistered(name)) {
                server.registerMBean(INSTANCE, name);
            }
        } catch (Exception e) {
            log.warn("Could not register metrics MBean: {}", e.getMessage());
        }
    }

    /** Record a job firing. */
    public void recordFiring() {
        firingCount.incrementAndGet();
    }

    /** Record a webhook call that got a 2xx response. */
    public void recordSuccess() {
        successCount.incrementAndGet();
    }

    /** Record a webhook call that failed or got a non-2xx response. */
    public void recordFailure() {
        failureCount.incrementAndGet();
    }

    /** Record the duration of a webhook call in milliseconds. */
    public void recordDuration(long millis) {
        totalDuration.addAndGet(millis);
        durationSamples.incrementAndGet();
    }

    @Override
    public int getFiringCount() {
        return firingCount.get();
    }

    @Override
    public int getSuccessCount() {
        return successCount.get();
    }

    @Override
    public int getFailureCount() {
        return failureCount.get();
    }

    @Override
    public long getTotalDurationMillis() {
        return totalDuration.get();
    }

    @Override
    public double getAverageDurationMillis() {
        int samples = durationSamples.get();
        if (samples == 0) {
            return 0.0;
        }
        return totalDuration.get() / (double) samples;
    }

    /** Renders the counters in Prometheus text exposition format. */
    public String toPrometheus(int armedJobs) {
        StringBuilder sb = new StringBuilder();
        sb.append("# HELP cronhook_jobs_armed Number of jobs with a live trigger\n");
        sb.append("# TYPE cronhook_jobs_armed gauge\n");
        sb.append("cronhook_jobs_armed ").append(armedJobs).append('\n');
        sb.append("# HELP cronhook_firings_total Number of job firings\n");
        sb.append("# TYPE cronhook_firings_total counter\n");
        sb.append("cronhook_firings_total ").append(getFiringCount()).append('\n');
        sb.append("# HELP cronhook_dispatch_success_total Number of successful webhook calls\n");
        sb.append("# TYPE cronhook_dispatch_success_total counter\n");
        sb.append("cronhook_dispatch_success_total ").append(getSuccessCount()).append('\n');
        sb.append("# HELP cronhook_dispatch_failure_total Number of failed webhook calls\n");
        sb.append("# TYPE cronhook_dispatch_failure_total counter\n");
        sb.append("cronhook_dispatch_failure_total ").append(getFailureCount()).append('\n');
        sb.append("# HELP cronhook_dispatch_duration_millis_total Total time spent in webhook calls in milliseconds\n");
        sb.append("# TYPE cronhook_dispatch_duration_millis_total counter\n");
        sb.append("cronhook_dispatch_duration_millis_total ").append(getTotalDurationMillis()).append('\n');
        sb.append("# HELP cronhook_dispatch_duration_millis_avg Average webhook call time in milliseconds\n");
        sb.append("# TYPE cronhook_dispatch_duration_millis_avg gauge\n");
        sb.append("cronhook_dispatch_duration_millis_avg ").append(getAverageDurationMillis()).append('\n');
        return sb.toString();
    }

    static void reset() {
        INSTANCE.firingCount.set(0);
        INSTANCE.successCount.set(0);
        INSTANCE.failureCount.set(0);
        INSTANCE.totalDuration.set(0);
        INSTANCE.durationSamples.set(0);
    }
}
