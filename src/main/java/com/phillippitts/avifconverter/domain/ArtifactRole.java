package com.phillippitts.avifconverter.domain;

/**
 * Files a scratch area can hold. Every stage reads one role and writes another.
 */
public enum ArtifactRole {
    /** The uploaded bytes as written to disk. */
    INPUT,
    /** Decoded intermediate image shared between a decode and an encode stage (always JPEG). */
    BRIDGE,
    /** Final AVIF file. */
    OUTPUT
}
