package com.phillippitts.avifconverter.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered list of stages for one request.
 *
 * <p>The first stage reads {@link ArtifactRole#INPUT}, each following stage reads what its
 * predecessor wrote, and the last stage writes {@link ArtifactRole#OUTPUT}.
 */
public record PipelinePlan(ImageFormat format, List<StageSpec> stages) {

    public PipelinePlan {
        Objects.requireNonNull(format, "format");
        stages = List.copyOf(Objects.requireNonNull(stages, "stages"));
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("A pipeline needs at least one stage");
        }
        if (stages.get(0).inputRole() != ArtifactRole.INPUT) {
            throw new IllegalArgumentException("First stage must read the input artifact");
        }
        for (int i = 1; i < stages.size(); i++) {
            if (stages.get(i).inputRole() != stages.get(i - 1).outputRole()) {
                throw new IllegalArgumentException("Stage " + stages.get(i).name()
                        + " does not consume the output of " + stages.get(i - 1).name());
            }
        }
        if (stages.get(stages.size() - 1).outputRole() != ArtifactRole.OUTPUT) {
            throw new IllegalArgumentException("Last stage must write the output artifact");
        }
    }

    public int size() {
        return stages.size();
    }

    public StageSpec stage(int index) {
        return stages.get(index);
    }
}
