package com.phillippitts.avifconverter.service.orchestration;

import com.phillippitts.avifconverter.domain.ConversionOutcome;
import com.phillippitts.avifconverter.domain.ConversionRequest;

/**
 * Converts one JPEG or HEIC image to AVIF through external codec stages.
 *
 * <p>Implementations never throw for conversion problems: every failure (bad format, missing
 * tool, failing stage, artifact I/O) comes back as a classified {@link ConversionOutcome}. The
 * request's scratch area no longer exists once a call returns, whatever the outcome.
 *
 * <p>Thread Safety: implementations must support concurrent calls; requests share nothing but
 * read-only observations of the host.
 */
public interface ConversionOrchestrator {

    /**
     * Converts the request.
     *
     * @param request input bytes, declared format tag and display filename
     * @return success with AVIF bytes and telemetry, or a classified failure
     */
    ConversionOutcome convert(ConversionRequest request);

    /**
     * Convenience overload of {@link #convert(ConversionRequest)}.
     */
    default ConversionOutcome convert(byte[] data, String formatTag, String filename) {
        return convert(new ConversionRequest(data, formatTag, filename));
    }

    /**
     * Whether an external tool can be launched on this host, without running a conversion.
     *
     * @param toolName logical tool name (e.g. "avifenc")
     * @return true if the tool answered its version probe
     */
    boolean toolAvailable(String toolName);
}
