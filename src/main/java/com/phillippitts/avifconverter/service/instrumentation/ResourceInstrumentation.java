package com.phillippitts.avifconverter.service.instrumentation;

import com.phillippitts.avifconverter.domain.MemorySnapshot;

import java.util.OptionalLong;

/**
 * Read-only memory observations of this process, its children and the host.
 *
 * <p>Implementations must be side-effect free and thread-safe: the same instance is sampled
 * concurrently by every in-flight conversion and by the health endpoint.
 */
public interface ResourceInstrumentation {

    /**
     * Takes a full snapshot of JVM and host memory.
     *
     * @return immutable snapshot, never null
     */
    MemorySnapshot snapshot();

    /**
     * Resident size of the JVM process only; cheaper than {@link #snapshot()}.
     *
     * @return resident bytes
     */
    long currentResidentBytes();

    /**
     * Resident size of an arbitrary process (typically a codec child).
     *
     * @param pid process id
     * @return resident bytes, or empty if the process is gone or the platform does not expose it
     */
    OptionalLong residentBytes(long pid);

    /**
     * Whether available system memory in the snapshot is below the configured low-memory bound.
     *
     * @param snapshot snapshot to evaluate
     * @return true when a low-memory warning should be attached
     */
    boolean isLowMemory(MemorySnapshot snapshot);
}
