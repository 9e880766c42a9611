package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.spi.metrics.MetricsSink;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Micrometer 기반 {@link MetricsSink}.
 *
 * <p>카운터와 타이머는 {@link MeterRegistry}가 이름+태그 단위로 캐시합니다.
 * 게이지는 이름+태그별 {@link AtomicReference} 값을 처음 사용할 때 등록하고,
 * 이후에는 값만 갱신합니다.</p>
 *
 * <pre>
 * MetricsSink sink = new MicrometerMetricsSink(new SimpleMeterRegistry());
 * sink.increment("orchestra.actions", Map.of("domain", "finance", "action", "pay", "status", "success"));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MicrometerMetricsSink implements MetricsSink {

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<GaugeKey, AtomicReference<Double>> gauges = new ConcurrentHashMap<>();

    /**
     * MicrometerMetricsSink 생성.
     *
     * @param meterRegistry Micrometer 레지스트리
     * @throws IllegalArgumentException meterRegistry가 null인 경우
     */
    public MicrometerMetricsSink(MeterRegistry meterRegistry) {
        if (meterRegistry == null) {
            throw new IllegalArgumentException("meterRegistry cannot be null");
        }
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void increment(String name, Map<String, String> tags) {
        meterRegistry.counter(name, toTags(tags)).increment();
    }

    @Override
    public void setGauge(String name, Map<String, String> tags, double value) {
        gauge(name, tags).set(value);
    }

    @Override
    public void adjustGauge(String name, Map<String, String> tags, double delta) {
        gauge(name, tags).updateAndGet(current -> current + delta);
    }

    @Override
    public void recordDuration(String name, Map<String, String> tags, Duration duration) {
        meterRegistry.timer(name, toTags(tags)).record(duration);
    }

    private AtomicReference<Double> gauge(String name, Map<String, String> tags) {
        Tags meterTags = toTags(tags);
        return gauges.computeIfAbsent(new GaugeKey(name, meterTags), key -> {
            AtomicReference<Double> value = new AtomicReference<>(0.0);
            Gauge.builder(name, value, AtomicReference::get)
                .tags(meterTags)
                .register(meterRegistry);
            return value;
        });
    }

    private static Tags toTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Tags.empty();
        }
        return Tags.of(tags.entrySet().stream()
            .map(entry -> Tag.of(entry.getKey(), entry.getValue() == null ? "none" : entry.getValue()))
            .toList());
    }

    private record GaugeKey(String name, Tags tags) {
    }
}
