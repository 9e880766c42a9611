package com.ryuqq.conductor.core.spi.metrics;

import java.time.Duration;
import java.util.Map;

/**
 * Metrics backend SPI.
 *
 * <p>Tags are plain string maps; the backend decides how to render them. Implementations
 * must be thread-safe.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MetricsSink {

    /**
     * Increments a counter by one.
     *
     * @param name metric name
     * @param tags tags
     */
    void increment(String name, Map<String, String> tags);

    /**
     * Sets a gauge to an absolute value.
     *
     * @param name metric name
     * @param tags tags
     * @param value gauge value
     */
    void setGauge(String name, Map<String, String> tags, double value);

    /**
     * Adds a delta (possibly negative) to a gauge.
     *
     * @param name metric name
     * @param tags tags
     * @param delta delta
     */
    void adjustGauge(String name, Map<String, String> tags, double delta);

    /**
     * Records a duration in a timer/histogram.
     *
     * @param name metric name
     * @param tags tags
     * @param duration measured duration
     */
    void recordDuration(String name, Map<String, String> tags, Duration duration);

    /**
     * Sink that records nothing.
     *
     * @return a no-op sink
     */
    static MetricsSink noop() {
        return new MetricsSink() {
            @Override
            public void increment(String name, Map<String, String> tags) {
            }

            @Override
            public void setGauge(String name, Map<String, String> tags, double value) {
            }

            @Override
            public void adjustGauge(String name, Map<String, String> tags, double delta) {
            }

            @Override
            public void recordDuration(String name, Map<String, String> tags, Duration duration) {
            }
        };
    }
}
