package com.phillippitts.avifconverter.service.health;

import com.phillippitts.avifconverter.domain.MemorySnapshot;
import com.phillippitts.avifconverter.service.instrumentation.ResourceInstrumentation;
import com.phillippitts.avifconverter.service.orchestration.ConversionOrchestrator;
import com.phillippitts.avifconverter.service.pipeline.PipelineTopologySelector;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the external codec tools.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: every tool the configured pipelines need answers its version probe</li>
 *   <li>DOWN: at least one required tool is missing or broken</li>
 * </ul>
 * Host memory figures are attached as details in both cases.
 *
 * <p>Exposed via /actuator/health as {@code converterTools}.
 */
@Component("converterTools")
public class ConverterToolsHealthIndicator implements HealthIndicator {

    private static final String READY = "available";
    private static final String MISSING = "missing";

    private final ConversionOrchestrator orchestrator;
    private final PipelineTopologySelector topologySelector;
    private final ResourceInstrumentation instrumentation;

    public ConverterToolsHealthIndicator(ConversionOrchestrator orchestrator,
                                         PipelineTopologySelector topologySelector,
                                         ResourceInstrumentation instrumentation) {
        this.orchestrator = orchestrator;
        this.topologySelector = topologySelector;
        this.instrumentation = instrumentation;
    }

    @Override
    public Health health() {
        Map<String, String> tools = new LinkedHashMap<>();
        boolean allAvailable = true;
        for (String tool : topologySelector.requiredTools()) {
            boolean available = orchestrator.toolAvailable(tool);
            allAvailable &= available;
            tools.put(tool, available ? READY : MISSING);
        }

        Health.Builder builder = allAvailable ? Health.up() : Health.down();
        builder.withDetail("tools", tools)
                .withDetail("heicDecoder", topologySelector.heicStrategy().name().toLowerCase());

        MemorySnapshot memory = instrumentation.snapshot();
        builder.withDetail("memory", memoryDetails(memory));
        if (instrumentation.isLowMemory(memory)) {
            builder.withDetail("warning", "Low system memory");
        }
        return builder.build();
    }

    private static Map<String, Object> memoryDetails(MemorySnapshot memory) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("rssMb", round(memory.residentMb()));
        details.put("systemAvailableMb", round(memory.systemAvailableMb()));
        details.put("systemPercentUsed", round(memory.systemPercentUsed()));
        memory.memoryLimit().ifPresent(limit -> details.put("limitBytes", limit));
        return details;
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
