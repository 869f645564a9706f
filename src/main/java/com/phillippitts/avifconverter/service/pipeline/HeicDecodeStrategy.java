package com.phillippitts.avifconverter.service.pipeline;

import com.phillippitts.avifconverter.config.ConverterProperties;
import com.phillippitts.avifconverter.domain.ArtifactRole;
import com.phillippitts.avifconverter.domain.StageSpec;

import java.util.List;

import static com.phillippitts.avifconverter.domain.StageSpec.INPUT_PLACEHOLDER;
import static com.phillippitts.avifconverter.domain.StageSpec.OUTPUT_PLACEHOLDER;

/**
 * Interchangeable ways of decoding HEIC into the JPEG bridge image.
 *
 * <p>Every strategy honours the same contract: it reads {@link ArtifactRole#INPUT} and writes a
 * JPEG to {@link ArtifactRole#BRIDGE}, so the encode stage is identical whichever one is chosen.
 */
public enum HeicDecodeStrategy {

    /** libheif's still-image decoder. */
    HEIF_DEC(CodecTool.HEIF_DEC,
            List.of("-q", "92", INPUT_PLACEHOLDER, OUTPUT_PLACEHOLDER)),

    /** ffmpeg transcoder, first frame only (HEIC burst/live photos carry several). */
    FFMPEG(CodecTool.FFMPEG,
            List.of("-hide_banner", "-loglevel", "error", "-nostdin", "-y",
                    "-i", INPUT_PLACEHOLDER, "-frames:v", "1", "-q:v", "2", OUTPUT_PLACEHOLDER));

    private final CodecTool tool;
    private final List<String> argTemplate;

    HeicDecodeStrategy(CodecTool tool, List<String> argTemplate) {
        this.tool = tool;
        this.argTemplate = argTemplate;
    }

    public CodecTool tool() {
        return tool;
    }

    /**
     * Builds the decode stage for this strategy.
     *
     * @param properties supplies the executable location
     * @return stage reading INPUT and writing BRIDGE
     */
    public StageSpec decodeStage(ConverterProperties properties) {
        return new StageSpec(PipelineTopologySelector.DECODE_STAGE, tool.toolName(),
                properties.executableFor(tool.toolName()), argTemplate,
                ArtifactRole.INPUT, ArtifactRole.BRIDGE);
    }
}
