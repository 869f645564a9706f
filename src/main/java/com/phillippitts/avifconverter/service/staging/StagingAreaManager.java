package com.phillippitts.avifconverter.service.staging;

import com.phillippitts.avifconverter.config.ConverterProperties;
import com.phillippitts.avifconverter.domain.ArtifactRole;
import com.phillippitts.avifconverter.domain.ImageFormat;
import com.phillippitts.avifconverter.exception.ArtifactIOException;
import com.phillippitts.avifconverter.exception.ScratchAreaException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Allocates, fills and removes per-conversion scratch directories.
 *
 * <p>Every area is a fresh directory {@code <scratch-root>/conv-<uuid>} created with
 * {@link Files#createDirectory} so that two requests can never share one. Release deletes the
 * tree recursively and is idempotent; a failed delete is logged, never thrown, so it cannot mask
 * the outcome of the conversion that owned the area.
 *
 * <p><b>Thread Safety:</b> stateless apart from the configured root; safe for concurrent use.
 */
@Component
public class StagingAreaManager {

    private static final Logger LOG = LogManager.getLogger(StagingAreaManager.class);
    private static final String AREA_PREFIX = "conv-";

    private final Path root;

    @Autowired
    public StagingAreaManager(ConverterProperties properties) {
        this(Path.of(properties.scratchRoot()));
    }

    public StagingAreaManager(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    /**
     * Creates a uniquely named scratch directory.
     *
     * @param format format of the input that will be staged (decides the input file name)
     * @return the new area; the caller must release it (or close it)
     * @throws ScratchAreaException if the directory cannot be created; not retried
     */
    public ScratchArea acquire(ImageFormat format) {
        Objects.requireNonNull(format, "format");
        String id = UUID.randomUUID().toString();
        Path dir = root.resolve(AREA_PREFIX + id);
        try {
            Files.createDirectories(root);
            Files.createDirectory(dir);
        } catch (IOException | UnsupportedOperationException e) {
            LOG.error("Cannot create scratch area {}: {}", dir, e.toString());
            throw new ScratchAreaException(root.toString(), e);
        }
        LOG.debug("Acquired scratch area {}", dir);
        return new ScratchArea(id, dir, format, this);
    }

    /**
     * Writes the input bytes as the area's {@link ArtifactRole#INPUT} artifact.
     *
     * <p>Callers drop their reference to {@code data} right after this returns so the buffer
     * can be collected while the stages run.
     *
     * @return path of the written input file
     * @throws ArtifactIOException if the write fails
     */
    public Path writeInput(ScratchArea area, byte[] data) {
        Objects.requireNonNull(area, "area");
        Objects.requireNonNull(data, "data");
        Path input = area.pathFor(ArtifactRole.INPUT);
        try {
            Files.write(input, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new ArtifactIOException(ArtifactRole.INPUT, null, "Cannot write input artifact", e);
        }
        return input;
    }

    /**
     * Reads an artifact fully into memory.
     *
     * @param area    area holding the artifact
     * @param role    artifact to read
     * @param stage   stage that produced it (for diagnostics; may be null)
     * @return file contents
     * @throws ArtifactIOException if the file is missing, empty or unreadable
     */
    public byte[] readArtifact(ScratchArea area, ArtifactRole role, String stage) {
        Path file = area.pathFor(role);
        if (!Files.isRegularFile(file)) {
            throw new ArtifactIOException(role, stage, "Stage produced no " + role.name().toLowerCase()
                    + " artifact", null);
        }
        try {
            byte[] bytes = Files.readAllBytes(file);
            if (bytes.length == 0) {
                throw new ArtifactIOException(role, stage, "Stage produced an empty "
                        + role.name().toLowerCase() + " artifact", null);
            }
            return bytes;
        } catch (IOException e) {
            throw new ArtifactIOException(role, stage, "Cannot read artifact", e);
        }
    }

    /**
     * Checks that a stage left a non-empty artifact behind without reading it.
     *
     * @throws ArtifactIOException if the artifact is missing or empty
     */
    public void requireArtifact(ScratchArea area, ArtifactRole role, String stage) {
        Path file = area.pathFor(role);
        try {
            if (!Files.isRegularFile(file) || Files.size(file) == 0) {
                throw new ArtifactIOException(role, stage, "Stage produced no usable "
                        + role.name().toLowerCase() + " artifact", null);
            }
        } catch (IOException e) {
            throw new ArtifactIOException(role, stage, "Cannot stat artifact", e);
        }
    }

    /**
     * Removes the area and everything in it. Only the first call does any work.
     *
     * @param area area to release (may be null)
     * @return true if this call released the area
     */
    public boolean release(ScratchArea area) {
        if (area == null || !area.markReleased()) {
            return false;
        }
        Path dir = area.directory();
        try {
            deleteRecursively(dir);
            LOG.debug("Released scratch area {}", dir);
        } catch (IOException | UncheckedIOException e) {
            LOG.warn("Failed to remove scratch area {}: {}", dir, e.toString());
        }
        return true;
    }

    /**
     * Lists scratch directories currently present under the root, for diagnostics and tests.
     */
    public List<Path> activeAreas() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(root)) {
            return children.filter(p -> p.getFileName().toString().startsWith(AREA_PREFIX))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            LOG.warn("Cannot list scratch root {}: {}", root, e.toString());
            return List.of();
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(dir)) {
            entries = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path entry : entries) {
            try {
                Files.deleteIfExists(entry);
            } catch (DirectoryNotEmptyException e) {
                // a straggling child process wrote a late file; retry once
                deleteRecursively(entry);
            }
        }
    }
}
