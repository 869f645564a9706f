package com.phillippitts.avifconverter.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of input formats the converter accepts.
 *
 * <p>The tag is the only thing that decides the pipeline topology. Anything that does not map
 * to one of these constants is rejected before a scratch area is allocated.
 */
public enum ImageFormat {

    JPEG("jpeg", "jpg", "image/jpeg"),
    HEIC("heic", "heic", "image/heic");

    private final String tag;
    private final String extension;
    private final String mimeType;

    ImageFormat(String tag, String extension, String mimeType) {
        this.tag = tag;
        this.extension = extension;
        this.mimeType = mimeType;
    }

    public String tag() {
        return tag;
    }

    /** File extension used for the staged input artifact. */
    public String extension() {
        return extension;
    }

    public String mimeType() {
        return mimeType;
    }

    /**
     * Resolves a declared format tag, case-insensitively.
     *
     * @param tag declared tag (may be null)
     * @return matching format, or empty if the tag is not supported
     */
    public static Optional<ImageFormat> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (ImageFormat format : values()) {
            if (format.tag.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves an upload's MIME type. {@code image/heif} is treated as HEIC. Generic types
     * ({@code application/octet-stream} or none) fall back to the filename extension.
     *
     * @param mimeType declared content type (may be null)
     * @param filename original filename (may be null)
     * @return matching format, or empty if neither hint identifies a supported format
     */
    public static Optional<ImageFormat> fromUpload(String mimeType, String filename) {
        String mime = mimeType == null ? "" : mimeType.trim().toLowerCase(Locale.ROOT);
        switch (mime) {
            case "image/jpeg", "image/jpg", "image/pjpeg":
                return Optional.of(JPEG);
            case "image/heic", "image/heif", "image/heic-sequence", "image/heif-sequence":
                return Optional.of(HEIC);
            case "", "application/octet-stream":
                return fromExtension(filename);
            default:
                return Optional.empty();
        }
    }

    private static Optional<ImageFormat> fromExtension(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".heic") || lower.endsWith(".heif")) {
            return Optional.of(HEIC);
        }
        if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
            return Optional.of(JPEG);
        }
        return Optional.empty();
    }
}
