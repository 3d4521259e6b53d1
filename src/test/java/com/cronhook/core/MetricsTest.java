package com.cronhook.core;

import org.junit.jupiter.api.Test;

import javax.management.ObjectName;
import java.lang.management.ManagementFactory;

import static org.junit.jupiter.api.Assertions.*;

public class MetricsTest {

    @Test
    public void testPrometheusText() {
        Metrics.reset();
        Metrics m = Metrics.getInstance();
        m.recordFiring();
        m.recordFiring();
        m.recordSuccess();
        m.recordFailure();
        m.recordDuration(100);
        m.recordDuration(300);

        String text = m.toPrometheus(3);
        assertTrue(text.contains("cronhook_jobs_armed 3"));
        assertTrue(text.contains("cronhook_firings_total 2"));
        assertTrue(text.contains("cronhook_dispatch_success_total 1"));
        assertTrue(text.contains("cronhook_dispatch_failure_total 1"));
        assertTrue(text.contains("cronhook_dispatch_duration_millis_total 400"));
        assertTrue(text.contains("cronhook_dispatch_duration_millis_avg 200.0"));
    }

    @Test
    public void testRegistersMBean() throws Exception {
        Metrics.init();
        Metrics.init();
        assertTrue(ManagementFactory.getPlatformMBeanServer()
                .isRegistered(new ObjectName("com.cronhook.core:type=Metrics")));
    }
}
