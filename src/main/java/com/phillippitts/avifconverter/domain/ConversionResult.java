package com.phillippitts.avifconverter.domain;

import java.util.List;
import java.util.Objects;

/**
 * Successful conversion: AVIF bytes plus the telemetry gathered on the way.
 *
 * @param format          input format that was converted
 * @param output          AVIF bytes
 * @param inputSize       size of the input in bytes
 * @param stages          per-stage results, in execution order
 * @param memoryAtStart   snapshot before the first stage
 * @param memoryAtEnd     snapshot after the last stage
 * @param totalDurationMs wall-clock duration of the whole conversion
 * @param warnings        non-fatal annotations (e.g. low memory)
 */
public record ConversionResult(
        ImageFormat format,
        byte[] output,
        long inputSize,
        List<StageResult> stages,
        MemorySnapshot memoryAtStart,
        MemorySnapshot memoryAtEnd,
        long totalDurationMs,
        List<String> warnings
) {
    public static final String OUTPUT_MIME_TYPE = "image/avif";

    public ConversionResult {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(output, "output");
        stages = stages == null ? List.of() : List.copyOf(stages);
        Objects.requireNonNull(memoryAtStart, "memoryAtStart");
        Objects.requireNonNull(memoryAtEnd, "memoryAtEnd");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public long outputSize() {
        return output.length;
    }

    /**
     * {@code 1 - output/input}; 0 for an empty input.
     */
    public double compressionRatio() {
        if (inputSize <= 0) {
            return 0.0;
        }
        return 1.0 - (double) output.length / inputSize;
    }

    /** Highest resident size sampled across all stages. */
    public long peakMemoryBytes() {
        long peak = 0;
        for (StageResult stage : stages) {
            peak = Math.max(peak, stage.peakMemoryBytes());
        }
        return peak;
    }

    public String mimeType() {
        return OUTPUT_MIME_TYPE;
    }
}
