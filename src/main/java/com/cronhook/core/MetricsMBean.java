package com.cronhook.core;

/**
 * JMX MBean interface exposing firing and webhook call metrics.
 */
public interface MetricsMBean {
    int getFiringCount();
    int getSuccessCount();
    int getFailureCount();
    long getTotalDurationMillis();
    double getAverageDurationMillis();
}
