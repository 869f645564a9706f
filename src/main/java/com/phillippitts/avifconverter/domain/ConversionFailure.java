package com.phillippitts.avifconverter.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Classified failure of a conversion.
 *
 * @param kind          error category
 * @param message       human readable description
 * @param stageName     stage that failed, null when no stage was involved
 * @param exitCode      exit code of the failed stage, null when not applicable
 * @param stderrExcerpt truncated stderr of the failed stage, empty when not applicable
 * @param warnings      annotations collected before the failure (e.g. low memory)
 */
public record ConversionFailure(
        ErrorKind kind,
        String message,
        String stageName,
        Integer exitCode,
        String stderrExcerpt,
        List<String> warnings
) {
    public ConversionFailure {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        stderrExcerpt = stderrExcerpt == null ? "" : stderrExcerpt;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ConversionFailure of(ErrorKind kind, String message) {
        return new ConversionFailure(kind, message, null, null, "", List.of());
    }

    public Optional<String> stage() {
        return Optional.ofNullable(stageName);
    }

    public ConversionFailure withWarnings(List<String> extra) {
        return new ConversionFailure(kind, message, stageName, exitCode, stderrExcerpt, extra);
    }

    /**
     * Full diagnostic line for logs (stage, exit code and stderr included).
     */
    public String diagnostic() {
        StringBuilder sb = new StringBuilder(kind.name()).append(": ").append(message);
        if (stageName != null) {
            sb.append(" (stage=").append(stageName);
            if (exitCode != null) {
                sb.append(", exitCode=").append(exitCode);
            }
            if (!stderrExcerpt.isEmpty()) {
                sb.append(", stderr=").append(stderrExcerpt);
            }
            sb.append(')');
        }
        return sb.toString();
    }
}
