package com.phillippitts.avifconverter.service.pipeline;

import com.phillippitts.avifconverter.config.ConverterProperties;
import com.phillippitts.avifconverter.domain.ArtifactRole;
import com.phillippitts.avifconverter.domain.ImageFormat;
import com.phillippitts.avifconverter.domain.PipelinePlan;
import com.phillippitts.avifconverter.domain.StageSpec;
import com.phillippitts.avifconverter.exception.UnsupportedFormatException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.phillippitts.avifconverter.domain.StageSpec.INPUT_PLACEHOLDER;
import static com.phillippitts.avifconverter.domain.StageSpec.OUTPUT_PLACEHOLDER;

/**
 * Decides which stages a request runs, from its format alone.
 *
 * <ul>
 *   <li>{@code jpeg}: {@code encode} (JPEG to AVIF)</li>
 *   <li>{@code heic}: {@code decode} (HEIC to JPEG bridge, via the configured
 *       {@link HeicDecodeStrategy}) then {@code encode} (bridge to AVIF)</li>
 * </ul>
 *
 * <p>Plans are built once at startup and shared; they hold no per-request state. Both
 * topologies run the same encode command; only the artifact it reads differs.
 */
@Component
public class PipelineTopologySelector {

    public static final String DECODE_STAGE = "decode";
    public static final String ENCODE_STAGE = "encode";

    private final Map<ImageFormat, PipelinePlan> plans;
    private final HeicDecodeStrategy heicStrategy;

    @Autowired
    public PipelineTopologySelector(ConverterProperties properties) {
        this(properties, properties.heicDecodeStrategy());
    }

    public PipelineTopologySelector(ConverterProperties properties, HeicDecodeStrategy heicStrategy) {
        Objects.requireNonNull(properties, "properties");
        this.heicStrategy = Objects.requireNonNull(heicStrategy, "heicStrategy");

        StageSpec encodeFromInput = encodeStage(properties, ArtifactRole.INPUT);
        StageSpec encodeFromBridge = encodeStage(properties, ArtifactRole.BRIDGE);

        Map<ImageFormat, PipelinePlan> table = new EnumMap<>(ImageFormat.class);
        table.put(ImageFormat.JPEG, new PipelinePlan(ImageFormat.JPEG, List.of(encodeFromInput)));
        table.put(ImageFormat.HEIC, new PipelinePlan(ImageFormat.HEIC,
                List.of(heicStrategy.decodeStage(properties), encodeFromBridge)));
        this.plans = Map.copyOf(table);
    }

    /**
     * @param format validated input format
     * @return the plan for that format
     */
    public PipelinePlan plan(ImageFormat format) {
        return plans.get(Objects.requireNonNull(format, "format"));
    }

    /**
     * @param formatTag declared tag
     * @return the plan for that tag
     * @throws UnsupportedFormatException if the tag is not a supported format
     */
    public PipelinePlan plan(String formatTag) {
        ImageFormat format = ImageFormat.fromTag(formatTag)
                .orElseThrow(() -> new UnsupportedFormatException(formatTag));
        return plan(format);
    }

    public HeicDecodeStrategy heicStrategy() {
        return heicStrategy;
    }

    /**
     * Logical names of every tool some plan needs, in first-use order.
     */
    public Set<String> requiredTools() {
        Set<String> tools = new LinkedHashSet<>();
        for (ImageFormat format : ImageFormat.values()) {
            for (StageSpec stage : plans.get(format).stages()) {
                tools.add(stage.tool());
            }
        }
        return tools;
    }

    private static StageSpec encodeStage(ConverterProperties properties, ArtifactRole source) {
        String tool = CodecTool.AVIFENC.toolName();
        return new StageSpec(ENCODE_STAGE, tool, properties.executableFor(tool),
                List.of(INPUT_PLACEHOLDER, OUTPUT_PLACEHOLDER), source, ArtifactRole.OUTPUT);
    }
}
