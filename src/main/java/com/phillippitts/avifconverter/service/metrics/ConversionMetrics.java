package com.phillippitts.avifconverter.service.metrics;

import com.phillippitts.avifconverter.domain.ErrorKind;
import com.phillippitts.avifconverter.domain.StageResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for conversions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Conversion latency per input format</li>
 *   <li>Stage latency and peak resident memory per stage</li>
 *   <li>Success/failure counts per format and error kind</li>
 *   <li>Low-memory warnings</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class ConversionMetrics {

    private static final String METRIC_PREFIX = "avifconverter.conversion";

    private final MeterRegistry registry;

    public ConversionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records end-to-end conversion latency.
     *
     * @param format input format tag (jpeg, heic)
     * @param durationMs duration in milliseconds
     */
    public void recordLatency(String format, long durationMs) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to convert one image")
                .tag("format", format)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Records duration and sampled peak memory of one stage run.
     */
    public void recordStage(StageResult result) {
        Timer.builder(METRIC_PREFIX + ".stage.latency")
                .description("Time taken by one pipeline stage")
                .tag("stage", result.stageName())
                .register(registry)
                .record(result.durationMs(), TimeUnit.MILLISECONDS);
        if (result.peakMemoryBytes() > 0) {
            DistributionSummary.builder(METRIC_PREFIX + ".stage.peak.memory")
                    .description("Peak resident memory sampled during a stage")
                    .baseUnit("bytes")
                    .tag("stage", result.stageName())
                    .register(registry)
                    .record(result.peakMemoryBytes());
        }
    }

    public void incrementSuccess(String format) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful conversions")
                .tag("format", format)
                .register(registry)
                .increment();
    }

    /**
     * @param format input format tag, or "unknown" when the tag was rejected
     * @param kind   classified error kind
     */
    public void incrementFailure(String format, ErrorKind kind) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed conversions")
                .tag("format", format)
                .tag("kind", kind.tag())
                .register(registry)
                .increment();
    }

    public void incrementLowMemory() {
        Counter.builder(METRIC_PREFIX + ".low.memory")
                .description("Conversions that observed available memory below the warning bound")
                .register(registry)
                .increment();
    }
}
