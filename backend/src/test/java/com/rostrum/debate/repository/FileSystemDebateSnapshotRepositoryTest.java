package com.rostrum.debate.repository;

import com.rostrum.debate.config.DebateStoreProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileSystemDebateSnapshotRepositoryTest {

    @TempDir
    Path storeDirectory;

    private FileSystemDebateSnapshotRepository repository;

    @BeforeEach
    void setUp() {
        DebateStoreProperties properties = new DebateStoreProperties();
        properties.setDirectory(storeDirectory.toString());
        repository = new FileSystemDebateSnapshotRepository(properties);
    }

    @Test
    void writeReplacesSnapshotWithoutLeavingTemporaryFiles() throws Exception {
        repository.write("debate-1", "{\"version\":1}");
        repository.write("debate-1", "{\"version\":2}");

        assertEquals(Optional.of("{\"version\":2}"), repository.read("debate-1"));
        try (Stream<Path> files = Files.list(storeDirectory)) {
            assertEquals(List.of("debate-1.json"), files.map(path -> path.getFileName().toString()).toList());
        }
    }

    @Test
    void snapshotIsReadableByOwnerOnly() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));

        repository.write("debate-2", "{}");

        assertEquals("rw-------",
                PosixFilePermissions.toString(Files.getPosixFilePermissions(repository.snapshotPath("debate-2"))));
    }

    @Test
    void missingSnapshotReadsEmpty() {
        assertTrue(repository.read("debate-3").isEmpty());
        assertTrue(repository.listIds().isEmpty());
    }

    @Test
    void snapshotThatIsNotUtf8IsRejectedAsInvalid() throws Exception {
        Files.write(repository.snapshotPath("debate-5"), new byte[]{'{', (byte) 0xFF, (byte) 0xFE, '}'});

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> repository.read("debate-5"));

        assertEquals("Snapshot is not valid UTF-8 text", ex.getMessage());
        assertEquals(List.of("debate-5"), repository.listIds());
    }

    @Test
    void quarantineMovesSnapshotAsideWithReason() throws Exception {
        repository.write("debate-4", "{\"broken\":true}");

        repository.quarantine("debate-4", "Snapshot missing textual field 'status'");

        assertTrue(repository.read("debate-4").isEmpty());
        Path quarantine = storeDirectory.resolve("quarantine");
        try (Stream<Path> files = Files.list(quarantine)) {
            List<Path> quarantined = files.toList();
            assertEquals(2, quarantined.size());
            Path reason = quarantined.stream()
                    .filter(path -> path.getFileName().toString().endsWith(".reason.txt"))
                    .findFirst()
                    .orElseThrow();
            assertTrue(reason.getFileName().toString().startsWith("debate-4-"));
            assertEquals("Snapshot missing textual field 'status'", Files.readString(reason));
        }
    }

    @Test
    void archiveRemovesSnapshotFromActiveIds() throws Exception {
        repository.write("debate-b", "{}");
        repository.write("debate-a", "{}");
        assertEquals(List.of("debate-a", "debate-b"), repository.listIds());

        assertTrue(repository.archive("debate-a"));
        assertFalse(repository.archive("debate-a"));

        assertEquals(List.of("debate-b"), repository.listIds());
        assertTrue(Files.exists(storeDirectory.resolve("archive").resolve("debate-a.json")));
    }

    @Test
    void rejectsIdsThatEscapeTheStoreDirectory() {
        assertThrows(IllegalArgumentException.class, () -> repository.write("../outside", "{}"));
        assertThrows(IllegalArgumentException.class, () -> repository.write("a/b", "{}"));
        assertTrue(repository.read("../outside").isEmpty());
    }
}
