package com.phillippitts.avifconverter.presentation.dto;

import com.phillippitts.avifconverter.domain.ConversionResult;
import com.phillippitts.avifconverter.domain.MemorySnapshot;
import com.phillippitts.avifconverter.domain.StageResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Base64;
import java.util.List;

/**
 * JSON body of a successful {@code POST /convert}.
 *
 * @param success always true; failures are rendered by the exception handler
 * @param metrics memory and timing telemetry of the conversion
 * @param data    the encoded image
 * @param warnings non-fatal observations (e.g. low memory), omitted when empty
 */
public record ConversionResponse(boolean success, Metrics metrics, Data data,
                                 @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> warnings) {

    static final String FULL_VARIANT = "full";

    public static ConversionResponse from(ConversionResult result, String outputFilename) {
        Metrics metrics = new Metrics(
                Memory.of(result.memoryAtStart()),
                Memory.of(result.memoryAtEnd()),
                roundMb(result.peakMemoryBytes()),
                result.totalDurationMs(),
                result.compressionRatio(),
                result.stages().stream().map(Stage::of).toList());
        Image fullSize = new Image(outputFilename,
                Base64.getEncoder().encodeToString(result.output()),
                result.outputSize(),
                result.mimeType(),
                FULL_VARIANT);
        return new ConversionResponse(true, metrics, new Data(fullSize), result.warnings());
    }

    public record Metrics(Memory memoryBefore, Memory memoryAfter, double peakMemoryMb,
                          long conversionTimeMs, double compressionRatio, List<Stage> stages) {}

    public record Memory(double rssMb, double vmsMb, double percent) {
        static Memory of(MemorySnapshot snapshot) {
            return new Memory(round(snapshot.residentMb()), round(snapshot.virtualMb()),
                    round(snapshot.processPercent()));
        }
    }

    public record Stage(String name, int exitCode, long durationMs, double peakMemoryMb) {
        static Stage of(StageResult result) {
            return new Stage(result.stageName(), result.exitCode(), result.durationMs(),
                    round(result.peakMemoryMb()));
        }
    }

    public record Data(Image fullSize) {}

    public record Image(String filename, String content, long size, String mimetype, String variant) {}

    private static double roundMb(long bytes) {
        return round(bytes / (1024.0 * 1024.0));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
