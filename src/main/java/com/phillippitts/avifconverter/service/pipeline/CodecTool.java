package com.phillippitts.avifconverter.service.pipeline;

import java.util.Optional;

/**
 * External executables the pipeline knows how to drive, with the argument each one accepts as a
 * cheap "are you there" probe.
 */
public enum CodecTool {

    AVIFENC("avifenc", "--version"),
    HEIF_DEC("heif-dec", "--version"),
    FFMPEG("ffmpeg", "-version");

    private final String toolName;
    private final String probeArgument;

    CodecTool(String toolName, String probeArgument) {
        this.toolName = toolName;
        this.probeArgument = probeArgument;
    }

    public String toolName() {
        return toolName;
    }

    public String probeArgument() {
        return probeArgument;
    }

    public static Optional<CodecTool> fromName(String toolName) {
        for (CodecTool tool : values()) {
            if (tool.toolName.equals(toolName)) {
                return Optional.of(tool);
            }
        }
        return Optional.empty();
    }
}
