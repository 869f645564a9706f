package com.phillippitts.avifconverter.service.orchestration;

import com.phillippitts.avifconverter.config.ConverterProperties;
import com.phillippitts.avifconverter.domain.ConversionFailure;
import com.phillippitts.avifconverter.domain.ConversionOutcome;
import com.phillippitts.avifconverter.domain.ConversionResult;
import com.phillippitts.avifconverter.domain.ErrorKind;
import com.phillippitts.avifconverter.domain.ImageFormat;
import com.phillippitts.avifconverter.domain.StageResult;
import com.phillippitts.avifconverter.service.errors.ErrorClassifier;
import com.phillippitts.avifconverter.service.metrics.ConversionMetrics;
import com.phillippitts.avifconverter.service.pipeline.HeicDecodeStrategy;
import com.phillippitts.avifconverter.service.pipeline.PipelineTopologySelector;
import com.phillippitts.avifconverter.service.process.ProcessExecutor;
import com.phillippitts.avifconverter.service.process.ToolAvailabilityChecker;
import com.phillippitts.avifconverter.service.staging.StagingAreaManager;
import com.phillippitts.avifconverter.testutil.FakeProcess.Behavior;
import com.phillippitts.avifconverter.testutil.FakeResourceInstrumentation;
import com.phillippitts.avifconverter.testutil.ScriptedProcessFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static com.phillippitts.avifconverter.testutil.FakeResourceInstrumentation.MB;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class DefaultConversionOrchestratorTest {

    private static final byte[] AVIF_BYTES = avif(300);

    @TempDir
    Path tmp;

    private Path scratchRoot;
    private ScriptedProcessFactory factory;
    private FakeResourceInstrumentation instrumentation;
    private MeterRegistry registry;
    private StagingAreaManager staging;
    private ErrorClassifier classifier;

    @BeforeEach
    void setUp() {
        scratchRoot = tmp.resolve("scratch");
        factory = new ScriptedProcessFactory();
        instrumentation = new FakeResourceInstrumentation();
        registry = new SimpleMeterRegistry();
        staging = spy(new StagingAreaManager(scratchRoot));
        classifier = spy(new ErrorClassifier());
    }

    private DefaultConversionOrchestrator orchestrator(HeicDecodeStrategy strategy) {
        return orchestrator(strategy, new ConversionMetrics(registry));
    }

    private DefaultConversionOrchestrator orchestrator(HeicDecodeStrategy strategy, ConversionMetrics metrics) {
        ConverterProperties properties = ConverterProperties.defaults().withScratchRoot(scratchRoot.toString());
        return new DefaultConversionOrchestrator(
                new PipelineTopologySelector(properties, strategy),
                staging,
                new ProcessExecutor(factory, instrumentation, properties),
                instrumentation,
                classifier,
                metrics,
                new ToolAvailabilityChecker(factory, properties));
    }

    private DefaultConversionOrchestrator orchestrator() {
        return orchestrator(HeicDecodeStrategy.HEIF_DEC);
    }

    @Test
    void jpegConvertsInOneStage() {
        factory.on("avifenc", ScriptedProcessFactory.writesOutput(AVIF_BYTES));
        byte[] input = jpeg(1000);

        ConversionOutcome outcome = orchestrator().convert(input, "jpeg", "holiday.jpg");

        assertThat(outcome.isSuccess()).isTrue();
        ConversionResult result = outcome.result();
        assertThat(result.format()).isEqualTo(ImageFormat.JPEG);
        assertThat(result.output()).containsExactly(AVIF_BYTES);
        assertThat(result.mimeType()).isEqualTo("image/avif");
        assertThat(result.inputSize()).isEqualTo(1000);
        assertThat(result.outputSize()).isEqualTo(300);
        assertThat(result.compressionRatio()).isCloseTo(0.7, within(1e-9));
        assertThat(result.stages()).extracting(StageResult::stageName).containsExactly("encode");
        assertThat(result.memoryAtStart()).isNotNull();
        assertThat(result.memoryAtEnd()).isNotNull();
        assertThat(factory.executables()).containsExactly("avifenc");
        assertThat(staging.activeAreas()).isEmpty();
        assertThat(registry.get("avifconverter.conversion.success").tag("format", "jpeg").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("avifconverter.conversion.latency").tag("format", "jpeg").timer().count())
                .isEqualTo(1L);
    }

    @Test
    void heicDecodesToBridgeBeforeEncoding() {
        factory.on("heif-dec", ScriptedProcessFactory.writesOutput(jpeg(800)))
                .on("avifenc", ScriptedProcessFactory.writesOutput(AVIF_BYTES));

        ConversionOutcome outcome = orchestrator().convert(heic(2000), "heic", "IMG_0001.HEIC");

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.result().stages()).extracting(StageResult::stageName)
                .containsExactly("decode", "encode");
        assertThat(factory.executables()).containsExactly("heif-dec", "avifenc");

        List<String> decode = factory.commands().get(0);
        List<String> encode = factory.commands().get(1);
        String bridge = decode.get(decode.size() - 1);
        assertThat(Path.of(bridge).getFileName()).hasToString("bridge.jpg");
        assertThat(encode.get(1)).isEqualTo(bridge);
        assertThat(Path.of(decode.get(decode.size() - 2)).getFileName()).hasToString("input.heic");
        assertThat(outcome.result().compressionRatio()).isCloseTo(0.85, within(1e-9));
        assertThat(staging.activeAreas()).isEmpty();
    }

    @Test
    void heicCanBeDecodedWithFfmpeg() {
        factory.on("ffmpeg", ScriptedProcessFactory.writesOutput(jpeg(800)))
                .on("avifenc", ScriptedProcessFactory.writesOutput(AVIF_BYTES));

        ConversionOutcome outcome = orchestrator(HeicDecodeStrategy.FFMPEG).convert(heic(2000), "heic", "a.heic");

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(factory.executables()).containsExactly("ffmpeg", "avifenc");
    }

    @Test
    void failingDecodeStopsPipelineWithStageFailure() {
        factory.on("heif-dec", ScriptedProcessFactory.exits(1, "Invalid input: No 'ftyp' box"))
                .on("avifenc", ScriptedProcessFactory.writesOutput(AVIF_BYTES));

        ConversionOutcome outcome = orchestrator().convert(heic(2000), "heic", "broken.heic");

        assertThat(outcome.isSuccess()).isFalse();
        ConversionFailure failure = outcome.failure();
        assertThat(failure.kind()).isEqualTo(ErrorKind.STAGE_FAILURE);
        assertThat(failure.stageName()).isEqualTo("decode");
        assertThat(failure.exitCode()).isEqualTo(1);
        assertThat(failure.stderrExcerpt()).contains("No 'ftyp' box");
        assertThat(factory.executables()).containsExactly("heif-dec");
        assertThat(staging.activeAreas()).isEmpty();
        assertThat(registry.get("avifconverter.conversion.failure")
                .tag("format", "heic").tag("kind", "stage-failure").counter().count()).isEqualTo(1.0);
    }

    @Test
    void emptyHeicFailsAtDecodeAndRemovesScratchArea() throws IOException {
        factory.on("heif-dec", rejectsEmptyInput(jpeg(800)))
                .on("avifenc", ScriptedProcessFactory.writesOutput(AVIF_BYTES));

        ConversionOutcome outcome = orchestrator().convert(new byte[0], "heic", "empty.heic");

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.failure().kind()).isIn(ErrorKind.STAGE_FAILURE, ErrorKind.IO_ERROR);
        assertThat(outcome.failure().stageName()).isEqualTo("decode");
        assertThat(factory.executables()).containsExactly("heif-dec");
        assertThat(staging.activeAreas()).isEmpty();
        try (Stream<Path> left = Files.list(scratchRoot)) {
            assertThat(left).isEmpty();
        }
    }

    @Test
    void emptyHeicDecodedToNothingIsIoErrorAtDecode() {
        factory.on("heif-dec", ScriptedProcessFactory.silentlyProducesNothing())
                .on("avifenc", ScriptedProcessFactory.writesOutput(AVIF_BYTES));

        ConversionOutcome outcome = orchestrator().convert(new byte[0], "heic", "empty.heic");

        assertThat(outcome.failure().kind()).isEqualTo(ErrorKind.IO_ERROR);
        assertThat(outcome.failure().stageName()).isEqualTo("decode");
        assertThat(staging.activeAreas()).isEmpty();
    }

    @Test
    void identicalInputsGiveIdenticalOutputLengths() {
        factory.on("avifenc", encodesToQuarterSize());
        DefaultConversionOrchestrator orchestrator = orchestrator();
        byte[] input = jpeg(1200);

        ConversionOutcome first = orchestrator.convert(input, "jpeg", "same.jpg");
        ConversionOutcome second = orchestrator.convert(input.clone(), "jpeg", "same.jpg");

        assertThat(first.isSuccess()).isTrue();
        assertThat(second.isSuccess()).isTrue();
        assertThat(second.result().outputSize()).isEqualTo(first.result().outputSize()).isEqualTo(300);
        assertThat(second.result().output()).containsExactly(first.result().output());
    }

    @Test
    void failureAfterCompletionIsReturnedNotThrown() {
        factory.on("avifenc", ScriptedProcessFactory.writesOutput(AVIF_BYTES));
        ConversionMetrics metrics = spy(new ConversionMetrics(registry));
        doThrow(new IllegalStateException("registry closed")).when(metrics).recordLatency(any(), anyLong());

        ConversionOutcome outcome = orchestrator(HeicDecodeStrategy.HEIF_DEC, metrics)
                .convert(jpeg(500), "jpeg", "a.jpg");

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.failure().kind()).isEqualTo(ErrorKind.STAGE_FAILURE);
        assertThat(outcome.failure().message()).contains("registry closed");
        assertThat(staging.activeAreas()).isEmpty();
    }

    @Test
    void missingDecoderIsEnvironmentErrorClassifiedBeforeCleanup() {
        factory.on("avifenc", ScriptedProcessFactory.writesOutput(AVIF_BYTES));

        ConversionOutcome outcome = orchestrator().convert(heic(2000), "heic", "photo.heic");

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.failure().kind()).isEqualTo(ErrorKind.ENVIRONMENT_ERROR);
        assertThat(outcome.failure().stageName()).isEqualTo("decode");
        assertThat(outcome.failure().message()).contains("heif-dec");

        InOrder order = inOrder(staging, classifier);
        order.verify(staging).acquire(ImageFormat.HEIC);
        order.verify(classifier).classify(any(Throwable.class), eq("decode"));
        order.verify(staging).release(any());
        verify(staging, times(1)).release(any());
        assertThat(staging.activeAreas()).isEmpty();
    }

    @Test
    void unsupportedTagFailsBeforeAnyFilesystemOrProcessActivity() {
        ConversionOutcome outcome = orchestrator().convert(new byte[]{(byte) 0x89, 'P', 'N', 'G'}, "png", "x.png");

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.failure().kind()).isEqualTo(ErrorKind.INPUT_ERROR);
        assertThat(factory.commands()).isEmpty();
        verify(staging, never()).acquire(any());
        assertThat(scratchRoot).doesNotExist();
        assertThat(registry.get("avifconverter.conversion.failure")
                .tag("format", "unknown").tag("kind", "input-error").counter().count()).isEqualTo(1.0);
    }

    @Test
    void formatTagIsCaseInsensitive() {
        factory.on("avifenc", ScriptedProcessFactory.writesOutput(AVIF_BYTES));

        assertThat(orchestrator().convert(jpeg(500), "JPEG", "a.jpg").isSuccess()).isTrue();
    }

    @Test
    void stageThatExitsZeroWithoutOutputIsIoError() {
        factory.on("avifenc", ScriptedProcessFactory.silentlyProducesNothing());

        ConversionOutcome outcome = orchestrator().convert(jpeg(500), "jpeg", "a.jpg");

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.failure().kind()).isEqualTo(ErrorKind.IO_ERROR);
        assertThat(outcome.failure().stageName()).isEqualTo("encode");
        assertThat(staging.activeAreas()).isEmpty();
    }

    @Test
    void unwritableScratchRootIsEnvironmentError() throws Exception {
        Path blocker = Files.writeString(tmp.resolve("file-not-dir"), "x");
        scratchRoot = blocker.resolve("scratch");
        staging = spy(new StagingAreaManager(scratchRoot));
        factory.on("avifenc", ScriptedProcessFactory.writesOutput(AVIF_BYTES));

        ConversionOutcome outcome = orchestrator().convert(jpeg(500), "jpeg", "a.jpg");

        assertThat(outcome.failure().kind()).isEqualTo(ErrorKind.ENVIRONMENT_ERROR);
        assertThat(factory.commands()).isEmpty();
    }

    @Test
    void lowMemoryAddsWarningWithoutFailing() {
        instrumentation.withAvailable(50 * MB);
        factory.on("avifenc", ScriptedProcessFactory.writesOutput(AVIF_BYTES));

        ConversionOutcome outcome = orchestrator().convert(jpeg(500), "jpeg", "a.jpg");

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.result().warnings()).isNotEmpty()
                .allSatisfy(w -> assertThat(w).contains("Low system memory"));
        assertThat(registry.get("avifconverter.conversion.low.memory").counter().count()).isPositive();
    }

    @Test
    void lowMemoryWarningsSurviveOnFailure() {
        instrumentation.withAvailable(50 * MB);
        factory.on("avifenc", ScriptedProcessFactory.exits(1, "out of memory"));

        ConversionOutcome outcome = orchestrator().convert(jpeg(500), "jpeg", "a.jpg");

        assertThat(outcome.failure().warnings()).isNotEmpty();
    }

    @Test
    void interruptCancelsRunningStageAndCleansUp() throws Exception {
        factory.on("heif-dec", ScriptedProcessFactory.hangs())
                .on("avifenc", ScriptedProcessFactory.writesOutput(AVIF_BYTES));
        DefaultConversionOrchestrator orchestrator = orchestrator();
        AtomicReference<ConversionOutcome> outcome = new AtomicReference<>();

        Thread caller = new Thread(() -> outcome.set(orchestrator.convert(heic(1000), "heic", "slow.heic")),
                "conversion-caller");
        caller.start();
        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(() -> !factory.startedProcesses().isEmpty());
        caller.interrupt();
        caller.join(5000);

        assertThat(caller.isAlive()).isFalse();
        assertThat(outcome.get().isSuccess()).isFalse();
        assertThat(outcome.get().failure().kind()).isEqualTo(ErrorKind.STAGE_FAILURE);
        assertThat(outcome.get().failure().stageName()).isEqualTo("decode");
        assertThat(factory.executables()).containsExactly("heif-dec");
        assertThat(factory.startedProcesses().get(0).wasDestroyCalled()).isTrue();
        assertThat(staging.activeAreas()).isEmpty();
    }

    @Test
    void concurrentConversionsUseIsolatedScratchAreas() throws Exception {
        // Fake encoder echoes its input into the output, so any cross-talk shows up as wrong bytes
        factory.on("avifenc", (cmd, wd) -> {
            byte[] in = Files.readAllBytes(Path.of(cmd.get(1)));
            Files.write(Path.of(cmd.get(2)), Arrays.copyOf(in, in.length / 2));
            return Behavior.runsFor(50);
        });
        DefaultConversionOrchestrator orchestrator = orchestrator();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<byte[]> inputs = new ArrayList<>();
            List<Future<ConversionOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                byte[] input = jpeg(400 + i * 10);
                input[input.length - 1] = (byte) i;
                inputs.add(input);
                futures.add(pool.submit(() -> orchestrator.convert(input, "jpeg", "img.jpg")));
            }
            for (int i = 0; i < futures.size(); i++) {
                ConversionOutcome outcome = futures.get(i).get(10, TimeUnit.SECONDS);
                assertThat(outcome.isSuccess()).isTrue();
                byte[] expected = Arrays.copyOf(inputs.get(i), inputs.get(i).length / 2);
                assertThat(outcome.result().output()).containsExactly(expected);
            }
        } finally {
            pool.shutdownNow();
        }

        List<String> outputPaths = factory.commands().stream().map(c -> c.get(2)).toList();
        assertThat(outputPaths).doesNotHaveDuplicates();
        assertThat(staging.activeAreas()).isEmpty();
    }

    @Test
    void toolAvailabilityDelegatesToProbe() {
        factory.on("avifenc", (cmd, wd) -> new Behavior("Version: 1.1.1", "", 0, 0));

        DefaultConversionOrchestrator orchestrator = orchestrator();

        assertThat(orchestrator.toolAvailable("avifenc")).isTrue();
        assertThat(orchestrator.toolAvailable("heif-dec")).isFalse();
    }

    private static ScriptedProcessFactory.Script rejectsEmptyInput(byte[] decoded) {
        return (command, wd) -> {
            Path input = Path.of(command.get(command.size() - 2));
            if (Files.size(input) == 0) {
                return Behavior.fails(1, "Invalid input: file is empty");
            }
            Files.write(Path.of(command.get(command.size() - 1)), decoded);
            return Behavior.succeeds();
        };
    }

    private static ScriptedProcessFactory.Script encodesToQuarterSize() {
        return (command, wd) -> {
            byte[] input = Files.readAllBytes(Path.of(command.get(command.size() - 2)));
            Files.write(Path.of(command.get(command.size() - 1)), avif(input.length / 4));
            return Behavior.succeeds();
        };
    }

    private static byte[] jpeg(int size) {
        byte[] data = new byte[size];
        data[0] = (byte) 0xFF;
        data[1] = (byte) 0xD8;
        for (int i = 2; i < size; i++) {
            data[i] = (byte) (i * 31);
        }
        return data;
    }

    private static byte[] heic(int size) {
        byte[] data = new byte[size];
        byte[] ftyp = {0, 0, 0, 24, 'f', 't', 'y', 'p', 'h', 'e', 'i', 'c'};
        System.arraycopy(ftyp, 0, data, 0, ftyp.length);
        return data;
    }

    private static byte[] avif(int size) {
        byte[] data = new byte[size];
        byte[] ftyp = {0, 0, 0, 28, 'f', 't', 'y', 'p', 'a', 'v', 'i', 'f'};
        System.arraycopy(ftyp, 0, data, 0, ftyp.length);
        return data;
    }
}
