package com.phillippitts.avifconverter.domain;

import java.util.Objects;

/**
 * One conversion request as handed to the orchestrator.
 *
 * <p>The format tag is kept as the caller declared it; validation happens in the orchestrator so
 * that an unsupported tag yields a classified outcome rather than a construction failure.
 * The filename is for log lines only and never used to build a path.
 *
 * @param data       raw input bytes (must not be null; may be empty)
 * @param formatTag  declared format ("jpeg" or "heic"); may be anything, including null
 * @param filename   display name of the upload
 */
public record ConversionRequest(byte[] data, String formatTag, String filename) {

    public ConversionRequest {
        Objects.requireNonNull(data, "data");
        filename = filename == null ? "" : filename;
    }

    public int size() {
        return data.length;
    }

    @Override
    public String toString() {
        return "ConversionRequest[formatTag=" + formatTag + ", filename=" + filename
                + ", size=" + data.length + "]";
    }
}
