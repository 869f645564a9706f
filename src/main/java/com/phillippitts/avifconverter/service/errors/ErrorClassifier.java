package com.phillippitts.avifconverter.service.errors;

import com.phillippitts.avifconverter.domain.ConversionFailure;
import com.phillippitts.avifconverter.domain.ErrorKind;
import com.phillippitts.avifconverter.domain.StageResult;
import com.phillippitts.avifconverter.exception.ArtifactIOException;
import com.phillippitts.avifconverter.exception.ScratchAreaException;
import com.phillippitts.avifconverter.exception.StageExecutionException;
import com.phillippitts.avifconverter.exception.ToolNotFoundException;
import com.phillippitts.avifconverter.exception.UnsupportedFormatException;
import com.phillippitts.avifconverter.service.process.ProcessConstants;
import com.phillippitts.avifconverter.util.LogSanitizer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;

/**
 * Turns failed stages and exceptions into a {@link ConversionFailure}.
 *
 * <p>Mapping:
 * <ul>
 *   <li>{@link UnsupportedFormatException} -> {@link ErrorKind#INPUT_ERROR}</li>
 *   <li>{@link ToolNotFoundException}, {@link ScratchAreaException} -> {@link ErrorKind#ENVIRONMENT_ERROR}</li>
 *   <li>{@link ArtifactIOException}, {@link IOException}, {@link UncheckedIOException} -> {@link ErrorKind#IO_ERROR}</li>
 *   <li>failed {@link StageResult}, {@link StageExecutionException}, anything else -> {@link ErrorKind#STAGE_FAILURE}</li>
 * </ul>
 *
 * <p>Never produces a success; unrecognised material becomes a stage failure with whatever
 * diagnostic text is available.
 */
@Component
public class ErrorClassifier {

    /**
     * Classifies a stage that ran but did not succeed.
     *
     * @param result failed stage result
     * @return stage failure carrying stage name, exit code and stderr excerpt
     * @throws IllegalArgumentException if the result is a success
     */
    public ConversionFailure classify(StageResult result) {
        Objects.requireNonNull(result, "result");
        if (result.succeeded()) {
            throw new IllegalArgumentException("Stage " + result.stageName() + " succeeded; nothing to classify");
        }
        String message = switch (result.termination()) {
            case TIMED_OUT -> "Stage '" + result.stageName() + "' timed out after " + result.durationMs() + "ms";
            case CANCELLED -> "Stage '" + result.stageName() + "' was cancelled";
            case EXITED -> "Stage '" + result.stageName() + "' exited with code " + result.exitCode();
        };
        return new ConversionFailure(ErrorKind.STAGE_FAILURE, message, result.stageName(),
                result.exitCode(), excerpt(result.stderr()), List.of());
    }

    /**
     * Classifies an exception raised while converting.
     *
     * @param error        the exception
     * @param currentStage stage running when it was raised, or null outside any stage
     * @return classified failure
     */
    public ConversionFailure classify(Throwable error, String currentStage) {
        Objects.requireNonNull(error, "error");
        if (error instanceof UnsupportedFormatException ufe) {
            return ConversionFailure.of(ErrorKind.INPUT_ERROR, ufe.getMessage());
        }
        if (error instanceof ToolNotFoundException tnf) {
            return new ConversionFailure(ErrorKind.ENVIRONMENT_ERROR, tnf.getMessage(), currentStage,
                    null, "", List.of());
        }
        if (error instanceof ScratchAreaException sae) {
            return ConversionFailure.of(ErrorKind.ENVIRONMENT_ERROR, sae.getMessage());
        }
        if (error instanceof ArtifactIOException aio) {
            String stage = aio.getStageName() != null ? aio.getStageName() : currentStage;
            return new ConversionFailure(ErrorKind.IO_ERROR, describe(aio), stage, null, "", List.of());
        }
        if (error instanceof IOException || error instanceof UncheckedIOException) {
            return new ConversionFailure(ErrorKind.IO_ERROR, describe(error), currentStage, null, "", List.of());
        }
        if (error instanceof StageExecutionException see) {
            String stage = see.getStageName() != null ? see.getStageName() : currentStage;
            return new ConversionFailure(ErrorKind.STAGE_FAILURE, see.getMessage(), stage,
                    see.getExitCode(), "", List.of());
        }
        return new ConversionFailure(ErrorKind.STAGE_FAILURE,
                "Unexpected failure: " + describe(error), currentStage, null, "", List.of());
    }

    /**
     * First {@link ProcessConstants#ERROR_SNIPPET_MAX_CHARS} characters of stderr, trimmed.
     */
    static String excerpt(String stderr) {
        return LogSanitizer.truncate(stderr == null ? "" : stderr.trim(), ProcessConstants.ERROR_SNIPPET_MAX_CHARS);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        Throwable cause = error.getCause();
        if (cause != null && cause.getMessage() != null && !message.contains(cause.getMessage())) {
            return message + ": " + cause.getMessage();
        }
        return message;
    }
}
