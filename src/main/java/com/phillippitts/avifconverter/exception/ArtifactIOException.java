package com.phillippitts.avifconverter.exception;

import com.phillippitts.avifconverter.domain.ArtifactRole;

/**
 * Thrown when reading or writing a pipeline artifact fails independently of the external tool,
 * including a stage that exited successfully but left no output file behind.
 */
public class ArtifactIOException extends AvifConverterException {

    private final ArtifactRole role;
    private final String stageName;

    public ArtifactIOException(ArtifactRole role, String message) {
        this(role, null, message, null);
    }

    public ArtifactIOException(ArtifactRole role, String stageName, String message, Throwable cause) {
        super(message + " (artifact: " + role + ")", cause);
        this.role = role;
        this.stageName = stageName;
    }

    public ArtifactRole getRole() {
        return role;
    }

    /**
     * @return stage whose artifact was affected, or null when no stage was involved
     */
    public String getStageName() {
        return stageName;
    }
}
