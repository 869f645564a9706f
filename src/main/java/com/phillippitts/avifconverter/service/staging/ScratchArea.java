package com.phillippitts.avifconverter.service.staging;

import com.phillippitts.avifconverter.domain.ArtifactRole;
import com.phillippitts.avifconverter.domain.ImageFormat;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Private working directory of one conversion.
 *
 * <p>Artifact file names are fixed ({@code input.<ext>}, {@code bridge.jpg}, {@code output.avif})
 * and never derived from the uploaded filename. Closing the area releases it through the
 * manager that created it; release happens at most once no matter how often {@link #close()}
 * is called.
 */
public final class ScratchArea implements AutoCloseable {

    static final String BRIDGE_FILE = "bridge.jpg";
    static final String OUTPUT_FILE = "output.avif";

    private final String id;
    private final Path directory;
    private final ImageFormat inputFormat;
    private final StagingAreaManager owner;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ScratchArea(String id, Path directory, ImageFormat inputFormat, StagingAreaManager owner) {
        this.id = Objects.requireNonNull(id, "id");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.inputFormat = Objects.requireNonNull(inputFormat, "inputFormat");
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public String id() {
        return id;
    }

    public Path directory() {
        return directory;
    }

    /**
     * Absolute path of the file that plays the given role in this area.
     */
    public Path pathFor(ArtifactRole role) {
        return switch (role) {
            case INPUT -> directory.resolve("input." + inputFormat.extension());
            case BRIDGE -> directory.resolve(BRIDGE_FILE);
            case OUTPUT -> directory.resolve(OUTPUT_FILE);
        };
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Marks the area as released; true only for the first caller.
     */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public void close() {
        owner.release(this);
    }

    @Override
    public String toString() {
        return "ScratchArea[" + id + " -> " + directory + (isReleased() ? ", released" : "") + "]";
    }
}
