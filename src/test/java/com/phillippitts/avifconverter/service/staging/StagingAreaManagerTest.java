package com.phillippitts.avifconverter.service.staging;

import com.phillippitts.avifconverter.domain.ArtifactRole;
import com.phillippitts.avifconverter.domain.ImageFormat;
import com.phillippitts.avifconverter.exception.ArtifactIOException;
import com.phillippitts.avifconverter.exception.ScratchAreaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StagingAreaManagerTest {

    @TempDir
    Path root;

    private StagingAreaManager manager;

    @BeforeEach
    void setUp() {
        manager = new StagingAreaManager(root.resolve("scratch"));
    }

    @Test
    void acquireCreatesUniqueDirectoriesUnderRoot() {
        Set<Path> dirs = new HashSet<>();
        for (int i = 0; i < 20; i++) {
            ScratchArea area = manager.acquire(ImageFormat.JPEG);
            assertThat(area.directory()).isDirectory();
            assertThat(area.directory().getParent()).isEqualTo(manager.root());
            dirs.add(area.directory());
        }
        assertThat(dirs).hasSize(20);
        assertThat(manager.activeAreas()).hasSize(20);
    }

    @Test
    void artifactPathsFollowRolesAndInputFormat() {
        ScratchArea heic = manager.acquire(ImageFormat.HEIC);
        ScratchArea jpeg = manager.acquire(ImageFormat.JPEG);

        assertThat(heic.pathFor(ArtifactRole.INPUT).getFileName()).hasToString("input.heic");
        assertThat(jpeg.pathFor(ArtifactRole.INPUT).getFileName()).hasToString("input.jpg");
        assertThat(heic.pathFor(ArtifactRole.BRIDGE).getFileName()).hasToString("bridge.jpg");
        assertThat(heic.pathFor(ArtifactRole.OUTPUT).getFileName()).hasToString("output.avif");
        assertThat(heic.pathFor(ArtifactRole.OUTPUT).getParent()).isEqualTo(heic.directory());
    }

    @Test
    void writeInputThenReadBack() {
        ScratchArea area = manager.acquire(ImageFormat.JPEG);
        byte[] data = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 1, 2, 3};

        Path written = manager.writeInput(area, data);

        assertThat(written).hasBinaryContent(data);
        assertThat(manager.readArtifact(area, ArtifactRole.INPUT, null)).containsExactly(data);
    }

    @Test
    void readingMissingArtifactIsArtifactIoError() {
        ScratchArea area = manager.acquire(ImageFormat.HEIC);

        assertThatThrownBy(() -> manager.readArtifact(area, ArtifactRole.OUTPUT, "encode"))
                .isInstanceOf(ArtifactIOException.class)
                .satisfies(e -> assertThat(((ArtifactIOException) e).getRole()).isEqualTo(ArtifactRole.OUTPUT));
    }

    @Test
    void emptyArtifactIsRejected() throws IOException {
        ScratchArea area = manager.acquire(ImageFormat.HEIC);
        Files.createFile(area.pathFor(ArtifactRole.BRIDGE));

        assertThatThrownBy(() -> manager.requireArtifact(area, ArtifactRole.BRIDGE, "decode"))
                .isInstanceOf(ArtifactIOException.class);
        assertThatThrownBy(() -> manager.readArtifact(area, ArtifactRole.BRIDGE, "decode"))
                .isInstanceOf(ArtifactIOException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void releaseRemovesDirectoryWithContentsExactlyOnce() throws IOException {
        ScratchArea area = manager.acquire(ImageFormat.HEIC);
        manager.writeInput(area, new byte[]{1, 2, 3});
        Files.write(area.pathFor(ArtifactRole.BRIDGE), new byte[]{4});
        Files.createDirectories(area.directory().resolve("nested"));
        Files.write(area.directory().resolve("nested/stray.tmp"), new byte[]{5});

        assertThat(manager.release(area)).isTrue();
        assertThat(area.directory()).doesNotExist();
        assertThat(area.isReleased()).isTrue();
        assertThat(manager.release(area)).isFalse();
        assertThat(manager.activeAreas()).isEmpty();
    }

    @Test
    void closeReleasesArea() {
        ScratchArea area = manager.acquire(ImageFormat.JPEG);
        Path dir = area.directory();

        try (ScratchArea a = area) {
            assertThat(a.directory()).isDirectory();
        }

        assertThat(dir).doesNotExist();
    }

    @Test
    void releaseOfNullIsNoop() {
        assertThat(manager.release(null)).isFalse();
    }

    @Test
    void unwritableRootFailsWithScratchAreaException() throws IOException {
        Path blocker = Files.writeString(root.resolve("not-a-dir"), "file");
        StagingAreaManager broken = new StagingAreaManager(blocker.resolve("scratch"));

        assertThatThrownBy(() -> broken.acquire(ImageFormat.JPEG))
                .isInstanceOf(ScratchAreaException.class);
    }
}
