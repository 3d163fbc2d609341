package com.rostrum.debate.repository;

import com.rostrum.debate.config.DebateStoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps each snapshot at {@code <directory>/<id>.json}. Writes go to a temporary file in the same
 * directory that is then moved over the target, and snapshot files are readable by the owner only.
 */
@Repository
@ConditionalOnProperty(
        prefix = "rostrum.store",
        name = "mode",
        havingValue = "file",
        matchIfMissing = true
)
public class FileSystemDebateSnapshotRepository implements DebateSnapshotRepository {

    private static final Logger log = LoggerFactory.getLogger(FileSystemDebateSnapshotRepository.class);
    private static final String SNAPSHOT_SUFFIX = ".json";
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final Path directory;
    private final Path quarantineDirectory;
    private final Path archiveDirectory;

    public FileSystemDebateSnapshotRepository(DebateStoreProperties debateStoreProperties) {
        this.directory = Paths.get(debateStoreProperties.getDirectory()).toAbsolutePath().normalize();
        this.quarantineDirectory = directory.resolve(debateStoreProperties.getQuarantineDirectory());
        this.archiveDirectory = directory.resolve(debateStoreProperties.getArchiveDirectory());
    }

    @Override
    public void write(String debateId, String snapshotJson) {
        DebateSnapshotRepository.requireValidId(debateId);
        Path target = snapshotPath(debateId);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + debateId + "-", ".tmp");
            restrictToOwner(temp);
            Files.writeString(temp, snapshotJson, StandardCharsets.UTF_8);
            moveReplacing(temp, target);
            temp = null;
        } catch (IOException ex) {
            throw new UncheckedIOException("Could not write snapshot for debate " + debateId, ex);
        } finally {
            deleteQuietly(temp);
        }
    }

    @Override
    public Optional<String> read(String debateId) {
        if (!DebateSnapshotRepository.isValidId(debateId)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(snapshotPath(debateId), StandardCharsets.UTF_8));
        } catch (NoSuchFileException ex) {
            return Optional.empty();
        } catch (CharacterCodingException ex) {
            throw new IllegalArgumentException("Snapshot is not valid UTF-8 text", ex);
        } catch (IOException ex) {
            throw new UncheckedIOException("Could not read snapshot for debate " + debateId, ex);
        }
    }

    @Override
    public void quarantine(String debateId, String reason) {
        DebateSnapshotRepository.requireValidId(debateId);
        Path source = snapshotPath(debateId);
        String quarantineName = debateId + "-" + System.currentTimeMillis();
        try {
            Files.createDirectories(quarantineDirectory);
            if (Files.exists(source)) {
                moveReplacing(source, quarantineDirectory.resolve(quarantineName + SNAPSHOT_SUFFIX));
            }
            Files.writeString(
                    quarantineDirectory.resolve(quarantineName + ".reason.txt"),
                    reason == null ? "" : reason,
                    StandardCharsets.UTF_8
            );
        } catch (IOException ex) {
            throw new UncheckedIOException("Could not quarantine snapshot for debate " + debateId, ex);
        }
    }

    @Override
    public boolean archive(String debateId) {
        DebateSnapshotRepository.requireValidId(debateId);
        Path source = snapshotPath(debateId);
        if (!Files.exists(source)) {
            return false;
        }
        try {
            Files.createDirectories(archiveDirectory);
            moveReplacing(source, archiveDirectory.resolve(debateId + SNAPSHOT_SUFFIX));
            return true;
        } catch (IOException ex) {
            throw new UncheckedIOException("Could not archive snapshot for debate " + debateId, ex);
        }
    }

    @Override
    public List<String> listIds() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> snapshots = Files.newDirectoryStream(directory, "*" + SNAPSHOT_SUFFIX)) {
            for (Path snapshot : snapshots) {
                if (!Files.isRegularFile(snapshot)) {
                    continue;
                }
                String fileName = snapshot.getFileName().toString();
                String id = fileName.substring(0, fileName.length() - SNAPSHOT_SUFFIX.length());
                if (DebateSnapshotRepository.isValidId(id)) {
                    ids.add(id);
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Could not list snapshots in " + directory, ex);
        }
        ids.sort(String::compareTo);
        return ids;
    }

    Path snapshotPath(String debateId) {
        return directory.resolve(debateId + SNAPSHOT_SUFFIX);
    }

    private static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void restrictToOwner(Path path) throws IOException {
        PosixFileAttributeView view = Files.getFileAttributeView(path, PosixFileAttributeView.class);
        if (view != null) {
            view.setPermissions(OWNER_ONLY);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Could not remove temporary snapshot file {}", path, ex);
        }
    }
}
