package com.rostrum.debate.service;

import com.rostrum.debate.config.DebateStoreProperties;
import com.rostrum.debate.model.DebateConfig;
import com.rostrum.debate.model.DebateSession;
import com.rostrum.debate.model.DebateSnapshotJsonCodec;
import com.rostrum.debate.repository.DebateSnapshotRepository;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of live debates backed by durable snapshots.
 *
 * <p>Every session change is written through to the snapshot repository. A debate that is not in
 * memory is recovered from its snapshot on lookup; snapshots that fail validation are quarantined.
 * A fixed set of lock stripes, chosen by debate id, serializes registration, lookup, eviction and
 * snapshot writes for each debate. Unrelated debates may share a stripe.
 */
@Service
public class DebateSessionStore {

    static final int LOCK_STRIPES = 64;

    private static final Logger log = LoggerFactory.getLogger(DebateSessionStore.class);

    private final DebateSnapshotRepository debateSnapshotRepository;
    private final DebateOrchestratorFactory debateOrchestratorFactory;
    private final Retry writeRetry;
    private final Clock clock = Clock.systemUTC();

    private final Map<String, DebateOrchestrator> orchestrators = new ConcurrentHashMap<>();
    private final ReentrantLock[] lockStripes = new ReentrantLock[LOCK_STRIPES];
    private final DebateEventListener persistenceListener = this::persist;

    public DebateSessionStore(
            DebateSnapshotRepository debateSnapshotRepository,
            DebateOrchestratorFactory debateOrchestratorFactory,
            DebateStoreProperties debateStoreProperties
    ) {
        this.debateSnapshotRepository = debateSnapshotRepository;
        this.debateOrchestratorFactory = debateOrchestratorFactory;
        for (int i = 0; i < lockStripes.length; i++) {
            lockStripes[i] = new ReentrantLock();
        }

        DebateStoreProperties.Write write = debateStoreProperties.getWrite();
        this.writeRetry = Retry.of("debate-snapshot-write", RetryConfig.custom()
                .maxAttempts(Math.max(1, write.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Duration.ofMillis(Math.max(1L, write.getInitialBackoffMs())),
                        Math.max(1.0, write.getBackoffMultiplier())
                ))
                .retryExceptions(UncheckedIOException.class)
                .build());
        this.writeRetry.getEventPublisher().onRetry(event -> log.warn(
                "Retrying snapshot write ({} failed attempts): {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage()
        ));
    }

    /**
     * Registers a new pending debate and writes its first snapshot.
     *
     * @throws IllegalStateException when the first snapshot cannot be written; the debate is not registered
     */
    public DebateOrchestrator create(String topic, String background, DebateConfig config) {
        String debateId = UUID.randomUUID().toString();
        DebateSession session = DebateSession.create(debateId, topic, background, config, clock.instant());

        ReentrantLock lock = lockFor(debateId);
        lock.lock();
        try {
            DebateOrchestrator orchestrator = debateOrchestratorFactory.create(session);
            orchestrators.put(debateId, orchestrator);
            if (!persist(session)) {
                orchestrators.remove(debateId);
                throw new IllegalStateException("Debate store cannot register the new session " + debateId);
            }
            orchestrator.addListener(persistenceListener);
            log.info("Registered debate {} on '{}'", debateId, topic);
            return orchestrator;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the live orchestrator, recovering it from its snapshot when it is not in memory.
     * An interrupted debate resumes as soon as it is recovered.
     */
    public Optional<DebateOrchestrator> find(String debateId) {
        if (!DebateSnapshotRepository.isValidId(debateId)) {
            return Optional.empty();
        }
        DebateOrchestrator existing = orchestrators.get(debateId);
        if (existing != null) {
            return Optional.of(existing);
        }

        DebateOrchestrator recovered;
        DebateSession session;
        ReentrantLock lock = lockFor(debateId);
        lock.lock();
        try {
            existing = orchestrators.get(debateId);
            if (existing != null) {
                return Optional.of(existing);
            }
            Optional<DebateSession> restored = readSnapshot(debateId);
            if (restored.isEmpty()) {
                return Optional.empty();
            }
            session = restored.get();
            recovered = debateOrchestratorFactory.create(session);
            recovered.addListener(persistenceListener);
            orchestrators.put(debateId, recovered);
        } finally {
            lock.unlock();
        }

        log.info("Recovered debate {} in status {}", debateId, session.status().wireValue());
        recovered.restoreState(session);
        return Optional.of(recovered);
    }

    /**
     * Writes the session's snapshot, retrying transient failures.
     *
     * @return {@code false} when every attempt failed; the debate keeps running in memory
     */
    public boolean persist(DebateSession session) {
        String snapshotJson = DebateSnapshotJsonCodec.toJson(session);
        ReentrantLock lock = lockFor(session.id());
        lock.lock();
        try {
            writeRetry.executeSupplier(() -> {
                debateSnapshotRepository.write(session.id(), snapshotJson);
                return Boolean.TRUE;
            });
            return true;
        } catch (UncheckedIOException ex) {
            log.error("Snapshot write for debate {} failed after retries", session.id(), ex);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evicts completed and failed debates from memory and archives their snapshots. A debate whose
     * loop has not yet returned is left for the next pass so its final snapshot lands first.
     *
     * @return number of debates evicted
     */
    public int cleanupTerminalSessions() {
        int evicted = 0;
        for (String debateId : new ArrayList<>(orchestrators.keySet())) {
            ReentrantLock lock = lockFor(debateId);
            lock.lock();
            try {
                DebateOrchestrator orchestrator = orchestrators.get(debateId);
                if (orchestrator == null
                        || orchestrator.isRunning()
                        || !orchestrator.getSession().status().terminal()) {
                    continue;
                }
                orchestrators.remove(debateId);
                if (!debateSnapshotRepository.archive(debateId)) {
                    log.warn("Debate {} had no snapshot to archive", debateId);
                }
                evicted++;
            } catch (UncheckedIOException ex) {
                log.error("Could not archive snapshot for debate {}", debateId, ex);
            } finally {
                lock.unlock();
            }
        }
        if (evicted > 0) {
            log.info("Archived {} finished debates", evicted);
        }
        return evicted;
    }

    /**
     * Ids of every debate that has an active snapshot.
     */
    public List<String> storedIds() {
        return debateSnapshotRepository.listIds();
    }

    private Optional<DebateSession> readSnapshot(String debateId) {
        try {
            return debateSnapshotRepository.read(debateId)
                    .map(snapshotJson -> DebateSnapshotJsonCodec.fromJson(snapshotJson, debateId));
        } catch (IllegalArgumentException ex) {
            log.warn("Quarantining snapshot for debate {}: {}", debateId, ex.getMessage());
            try {
                debateSnapshotRepository.quarantine(debateId, ex.getMessage());
            } catch (UncheckedIOException quarantineFailure) {
                log.error("Could not quarantine snapshot for debate {}", debateId, quarantineFailure);
            }
            return Optional.empty();
        }
    }

    ReentrantLock lockFor(String debateId) {
        return lockStripes[Math.floorMod(debateId.hashCode(), lockStripes.length)];
    }
}
