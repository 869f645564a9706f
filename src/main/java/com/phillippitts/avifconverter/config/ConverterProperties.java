package com.phillippitts.avifconverter.config;

import com.phillippitts.avifconverter.service.pipeline.HeicDecodeStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the conversion pipeline.
 * Binds to properties prefixed with "converter".
 *
 * <p>Example application.properties:
 * <pre>
 * converter.scratch-root=/var/tmp/avif-converter
 * converter.avifenc-path=/usr/bin/avifenc
 * converter.heif-dec-path=/usr/bin/heif-dec
 * converter.ffmpeg-path=ffmpeg
 * converter.heic-decode-strategy=HEIF_DEC
 * converter.sample-interval-ms=100
 * converter.low-memory-threshold-mb=100
 * converter.tool-probe-timeout-seconds=5
 * converter.stage-timeout-seconds=0
 * converter.max-stdout-bytes=1048576
 * </pre>
 *
 * <p>Only executable locations are configurable. Argument templates of each stage are fixed.
 *
 * @param scratchRoot directory under which per-request scratch areas are created
 * @param avifencPath avifenc executable (bare name resolved through PATH, or a path)
 * @param heifDecPath libheif decoder executable
 * @param ffmpegPath ffmpeg executable, used by the {@link HeicDecodeStrategy#FFMPEG} strategy
 * @param heicDecodeStrategy which decoder turns HEIC into the JPEG bridge image
 * @param sampleIntervalMs memory sampling interval while a stage runs
 * @param lowMemoryThresholdMb available system memory below this value adds a warning
 * @param toolProbeTimeoutSeconds upper bound for a single tool availability probe
 * @param stageTimeoutSeconds per-stage wall-clock limit; 0 disables it
 * @param maxStdoutBytes maximum stdout accumulation per stage
 */
@ConfigurationProperties(prefix = "converter")
@Validated
public record ConverterProperties(
        @NotBlank(message = "Scratch root must not be blank")
        String scratchRoot,

        @NotBlank(message = "avifenc path must not be blank")
        @DefaultValue("avifenc") String avifencPath,

        @NotBlank(message = "heif-dec path must not be blank")
        @DefaultValue("heif-dec") String heifDecPath,

        @NotBlank(message = "ffmpeg path must not be blank")
        @DefaultValue("ffmpeg") String ffmpegPath,

        @NotNull(message = "HEIC decode strategy must be set")
        @DefaultValue("HEIF_DEC") HeicDecodeStrategy heicDecodeStrategy,

        @Positive(message = "Sample interval must be positive")
        @DefaultValue("100") long sampleIntervalMs,

        @Positive(message = "Low memory threshold must be positive")
        @DefaultValue("100") long lowMemoryThresholdMb,

        @Positive(message = "Tool probe timeout must be positive")
        @DefaultValue("5") int toolProbeTimeoutSeconds,

        @Min(value = 0, message = "Stage timeout must not be negative")
        @DefaultValue("0") int stageTimeoutSeconds,

        @Positive(message = "Max stdout bytes must be positive")
        @DefaultValue("1048576") int maxStdoutBytes
) {
    /**
     * Standard values, scratch areas under the JVM temp directory.
     */
    public static ConverterProperties defaults() {
        return new ConverterProperties(System.getProperty("java.io.tmpdir") + "/avif-converter",
                "avifenc", "heif-dec", "ffmpeg", HeicDecodeStrategy.HEIF_DEC,
                100, 100, 5, 0, 1048576);
    }

    /**
     * Copy with a different scratch root.
     */
    public ConverterProperties withScratchRoot(String root) {
        return new ConverterProperties(root, avifencPath, heifDecPath, ffmpegPath, heicDecodeStrategy,
                sampleIntervalMs, lowMemoryThresholdMb, toolProbeTimeoutSeconds, stageTimeoutSeconds,
                maxStdoutBytes);
    }

    /**
     * Returns the executable configured for the given logical tool name, or the name itself
     * when no path is configured for it.
     *
     * @param toolName logical tool name ("avifenc", "heif-dec", "ffmpeg")
     * @return configured executable path
     */
    public String executableFor(String toolName) {
        return switch (toolName) {
            case "avifenc" -> avifencPath;
            case "heif-dec" -> heifDecPath;
            case "ffmpeg" -> ffmpegPath;
            default -> toolName;
        };
    }
}
