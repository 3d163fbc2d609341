package com.rostrum.debate.repository;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local snapshot storage for tests and ephemeral runs.
 */
@Repository
@ConditionalOnProperty(
        prefix = "rostrum.store",
        name = "mode",
        havingValue = "in_memory"
)
public class InMemoryDebateSnapshotRepository implements DebateSnapshotRepository {

    private final Map<String, String> snapshots = new ConcurrentHashMap<>();
    private final Map<String, String> quarantineReasons = new ConcurrentHashMap<>();
    private final Map<String, String> archived = new ConcurrentHashMap<>();

    @Override
    public void write(String debateId, String snapshotJson) {
        DebateSnapshotRepository.requireValidId(debateId);
        snapshots.put(debateId, snapshotJson);
    }

    @Override
    public Optional<String> read(String debateId) {
        if (!DebateSnapshotRepository.isValidId(debateId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshots.get(debateId));
    }

    @Override
    public void quarantine(String debateId, String reason) {
        snapshots.remove(debateId);
        quarantineReasons.put(debateId, reason == null ? "" : reason);
    }

    @Override
    public boolean archive(String debateId) {
        String snapshot = snapshots.remove(debateId);
        if (snapshot == null) {
            return false;
        }
        archived.put(debateId, snapshot);
        return true;
    }

    @Override
    public List<String> listIds() {
        List<String> ids = new ArrayList<>(snapshots.keySet());
        ids.sort(String::compareTo);
        return ids;
    }

    public Optional<String> quarantineReason(String debateId) {
        return Optional.ofNullable(quarantineReasons.get(debateId));
    }

    public boolean isArchived(String debateId) {
        return archived.containsKey(debateId);
    }
}
