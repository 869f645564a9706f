package com.phillippitts.avifconverter.service.orchestration;

import com.phillippitts.avifconverter.domain.ArtifactRole;
import com.phillippitts.avifconverter.domain.ConversionFailure;
import com.phillippitts.avifconverter.domain.ConversionOutcome;
import com.phillippitts.avifconverter.domain.ConversionRequest;
import com.phillippitts.avifconverter.domain.ConversionResult;
import com.phillippitts.avifconverter.domain.ImageFormat;
import com.phillippitts.avifconverter.domain.MemorySnapshot;
import com.phillippitts.avifconverter.domain.PipelinePlan;
import com.phillippitts.avifconverter.domain.StageResult;
import com.phillippitts.avifconverter.domain.StageSpec;
import com.phillippitts.avifconverter.exception.StageExecutionException;
import com.phillippitts.avifconverter.exception.UnsupportedFormatException;
import com.phillippitts.avifconverter.service.errors.ErrorClassifier;
import com.phillippitts.avifconverter.service.instrumentation.ResourceInstrumentation;
import com.phillippitts.avifconverter.service.metrics.ConversionMetrics;
import com.phillippitts.avifconverter.service.pipeline.PipelineTopologySelector;
import com.phillippitts.avifconverter.service.process.ProcessConstants;
import com.phillippitts.avifconverter.service.process.ProcessExecutor;
import com.phillippitts.avifconverter.service.process.ToolAvailabilityChecker;
import com.phillippitts.avifconverter.service.staging.ScratchArea;
import com.phillippitts.avifconverter.service.staging.StagingAreaManager;
import com.phillippitts.avifconverter.util.LogSanitizer;
import com.phillippitts.avifconverter.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Default {@link ConversionOrchestrator}: stage the input, run the planned stages in order,
 * collect the AVIF, release the scratch area.
 *
 * <p><b>Flow:</b>
 * <ol>
 *   <li>Validate the format tag; an unknown tag fails with INPUT_ERROR before any filesystem
 *       or process activity.</li>
 *   <li>Acquire a scratch area and write the input artifact.</li>
 *   <li>Run each stage monitored; the first non-successful stage ends the conversion with a
 *       classified failure. A stage that exits 0 without writing its artifact is an IO_ERROR.</li>
 *   <li>Read the output, compute size and compression ratio, assemble telemetry.</li>
 * </ol>
 * The scratch area is released exactly once in a {@code finally} block, after the outcome has
 * been classified.
 *
 * <p><b>Cancellation:</b> interrupting the calling thread kills the running stage (see
 * {@link ProcessExecutor}) and stops the pipeline before the next stage; cleanup is the same as
 * for a failed stage.
 *
 * <p><b>Privacy:</b> the uploaded filename is sanitized before it reaches a log line and never
 * used to build a path.
 */
@Service
public class DefaultConversionOrchestrator implements ConversionOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultConversionOrchestrator.class);
    private static final String UNKNOWN_FORMAT = "unknown";

    private final PipelineTopologySelector topologySelector;
    private final StagingAreaManager stagingAreaManager;
    private final ProcessExecutor processExecutor;
    private final ResourceInstrumentation instrumentation;
    private final ErrorClassifier errorClassifier;
    private final ConversionMetrics metrics;
    private final ToolAvailabilityChecker toolChecker;

    public DefaultConversionOrchestrator(PipelineTopologySelector topologySelector,
                                         StagingAreaManager stagingAreaManager,
                                         ProcessExecutor processExecutor,
                                         ResourceInstrumentation instrumentation,
                                         ErrorClassifier errorClassifier,
                                         ConversionMetrics metrics,
                                         ToolAvailabilityChecker toolChecker) {
        this.topologySelector = Objects.requireNonNull(topologySelector, "topologySelector");
        this.stagingAreaManager = Objects.requireNonNull(stagingAreaManager, "stagingAreaManager");
        this.processExecutor = Objects.requireNonNull(processExecutor, "processExecutor");
        this.instrumentation = Objects.requireNonNull(instrumentation, "instrumentation");
        this.errorClassifier = Objects.requireNonNull(errorClassifier, "errorClassifier");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.toolChecker = Objects.requireNonNull(toolChecker, "toolChecker");
    }

    @Override
    public ConversionOutcome convert(ConversionRequest request) {
        Objects.requireNonNull(request, "request");
        String displayName = LogSanitizer.filename(request.filename());
        ConversionStateMachine state = new ConversionStateMachine();

        Optional<ImageFormat> maybeFormat = ImageFormat.fromTag(request.formatTag());
        if (maybeFormat.isEmpty()) {
            ConversionFailure failure = errorClassifier.classify(
                    new UnsupportedFormatException(request.formatTag()), null);
            return fail(state, UNKNOWN_FORMAT, displayName, failure, List.of());
        }
        ImageFormat format = maybeFormat.get();
        PipelinePlan plan = topologySelector.plan(format);
        long inputSize = request.size();

        long startTime = System.nanoTime();
        MemorySnapshot memoryAtStart = instrumentation.snapshot();
        List<String> warnings = new ArrayList<>();
        noteLowMemory(memoryAtStart, "start", warnings);
        LOG.info("Converting {} ({} bytes, format={}, stages={}, rssMb={})",
                displayName, inputSize, format.tag(), plan.size(), memoryAtStart.residentMb());

        List<StageResult> stageResults = new ArrayList<>(plan.size());
        ScratchArea area = null;
        String currentStage = null;
        try {
            area = stagingAreaManager.acquire(format);
            stagingAreaManager.writeInput(area, request.data());
            state.staged();

            for (int i = 0; i < plan.size(); i++) {
                StageSpec stage = plan.stage(i);
                currentStage = stage.name();
                if (Thread.currentThread().isInterrupted()) {
                    throw new StageExecutionException("Conversion cancelled before stage start",
                            stage.name(), ProcessConstants.NO_EXIT_CODE);
                }
                state.runningStage(i);

                List<String> command = stage.command(
                        area.pathFor(stage.inputRole()).toString(),
                        area.pathFor(stage.outputRole()).toString());
                StageResult result = processExecutor.runMonitored(stage, command, area.directory());
                stageResults.add(result);
                metrics.recordStage(result);
                noteLowMemory(result.after(), stage.name(), warnings);

                if (!result.succeeded()) {
                    return fail(state, format.tag(), displayName, errorClassifier.classify(result), warnings);
                }
                stagingAreaManager.requireArtifact(area, stage.outputRole(), stage.name());
                LOG.info("Stage {} of {} done: {}", i + 1, plan.size(), result.summary());
            }

            String lastStage = plan.stage(plan.size() - 1).name();
            byte[] output = stagingAreaManager.readArtifact(area, ArtifactRole.OUTPUT, lastStage);
            currentStage = null;
            MemorySnapshot memoryAtEnd = instrumentation.snapshot();
            state.completed(plan.size());

            long totalMs = TimeUtils.elapsedMillis(startTime);
            ConversionResult result = new ConversionResult(format, output, inputSize, stageResults,
                    memoryAtStart, memoryAtEnd, totalMs, warnings);
            metrics.recordLatency(format.tag(), totalMs);
            metrics.incrementSuccess(format.tag());
            LOG.info("Converted {} in {}: {} -> {} bytes (ratio={}, peakBytes={}, rssDeltaMb={})",
                    displayName, TimeUtils.formatSeconds(totalMs), inputSize, result.outputSize(),
                    String.format("%.3f", result.compressionRatio()), result.peakMemoryBytes(),
                    memoryAtEnd.since(memoryAtStart).residentMb());
            return ConversionOutcome.success(result);
        } catch (RuntimeException e) {
            ConversionFailure failure = errorClassifier.classify(e, currentStage);
            LOG.debug("Conversion of {} aborted in state {}", displayName, state, e);
            return fail(state, format.tag(), displayName, failure, warnings);
        } finally {
            stagingAreaManager.release(area);
        }
    }

    @Override
    public boolean toolAvailable(String toolName) {
        return toolChecker.isAvailable(toolName);
    }

    private ConversionOutcome fail(ConversionStateMachine state, String format, String displayName,
                                   ConversionFailure failure, List<String> warnings) {
        if (!state.state().isTerminal()) {
            state.failed();
        }
        metrics.incrementFailure(format, failure.kind());
        if (failure.kind().isClientError()) {
            LOG.warn("Rejected {}: {}", displayName, failure.diagnostic());
        } else {
            LOG.error("Conversion of {} failed: {}", displayName, failure.diagnostic());
        }
        return ConversionOutcome.failure(failure.withWarnings(warnings));
    }

    private void noteLowMemory(MemorySnapshot snapshot, String point, List<String> warnings) {
        if (snapshot != null && instrumentation.isLowMemory(snapshot)) {
            String warning = "Low system memory at " + point + ": " + snapshot.systemAvailableMb() + "MB available";
            warnings.add(warning);
            metrics.incrementLowMemory();
            LOG.warn(warning);
        }
    }
}
