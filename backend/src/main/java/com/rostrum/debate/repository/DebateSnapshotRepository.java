package com.rostrum.debate.repository;

import java.util.List;
import java.util.Optional;

/**
 * Storage for serialized debate snapshots, one document per debate id.
 */
public interface DebateSnapshotRepository {

    /**
     * Replaces the snapshot for {@code debateId} atomically; a reader sees either the old or the new document.
     *
     * @throws java.io.UncheckedIOException when the snapshot could not be stored
     */
    void write(String debateId, String snapshotJson);

    /**
     * @throws IllegalArgumentException when the stored bytes are not UTF-8 text
     * @throws java.io.UncheckedIOException when the snapshot exists but could not be read
     */
    Optional<String> read(String debateId);

    /**
     * Moves an unreadable snapshot aside together with the reason it was rejected.
     */
    void quarantine(String debateId, String reason);

    /**
     * Moves a finished debate's snapshot out of the active set.
     *
     * @return {@code false} when there was no active snapshot to archive
     */
    boolean archive(String debateId);

    /**
     * Ids of all active snapshots.
     */
    List<String> listIds();

    static boolean isValidId(String debateId) {
        return debateId != null && debateId.matches("[A-Za-z0-9_-]{1,128}");
    }

    static void requireValidId(String debateId) {
        if (!isValidId(debateId)) {
            throw new IllegalArgumentException("Invalid debate id: " + debateId);
        }
    }
}
