package com.rostrum.debate.service;

import com.rostrum.debate.DebateTestFixtures;
import com.rostrum.debate.dto.DebateRequests;
import com.rostrum.debate.dto.DebateResponses;
import com.rostrum.debate.model.DebateConfig;
import com.rostrum.debate.model.DebateSession;
import com.rostrum.debate.model.DebateSide;
import com.rostrum.debate.model.DebateSnapshotJsonCodec;
import com.rostrum.debate.model.DebateStatus;
import com.rostrum.debate.repository.DebateSnapshotRepository;
import com.rostrum.debate.repository.InMemoryDebateSnapshotRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
        "rostrum.mock-provider=true",
        "rostrum.store.mode=in_memory",
        "rostrum.store.recover-on-startup=false",
        "rostrum.provider.min-request-interval-ms=1",
        "rostrum.provider.initial-backoff-ms=1",
        "rostrum.provider.max-backoff-ms=5",
        "rostrum.provider.attempt-timeout-ms=5000"
})
class DebateServiceIntegrationTest {

    private static final long COMPLETION_TIMEOUT_MS = 15_000;

    @Autowired
    private DebateService debateService;

    @Autowired
    private DebateSnapshotRepository debateSnapshotRepository;

    @Test
    void debateRunsToAVerdictWithMockBackend() throws Exception {
        DebateResponses.DebateCreated created = debateService.createDebate(new DebateRequests.CreateDebateRequest(
                "Public transit should be free at the point of use",
                "City budget debate",
                "pro-key",
                "con-key",
                judges(),
                1
        ));

        DebateResponses.DebateStatusView view = awaitTerminal(created.debateId());

        assertEquals(DebateStatus.COMPLETED, view.status());
        assertNull(view.errorMessage());
        assertEquals(2, view.messages().size());
        assertEquals(DebateSide.PRO, view.messages().get(0).side());
        assertTrue(view.messages().get(0).text().startsWith("In favour: "));
        assertEquals(DebateSide.CON, view.messages().get(1).side());
        assertTrue(view.messages().get(1).text().startsWith("Against: "));
        assertEquals(DebateConfig.PANEL_SIZE, view.judgeResults().size());
        assertTrue(view.judgeResults().stream().noneMatch(result -> result.degraded()));
        assertNotNull(view.finalScores());
        assertNotNull(view.progress().judging());

        DebateSession stored = awaitStoredTerminal(created.debateId());
        assertEquals(DebateStatus.COMPLETED, stored.status());
        assertEquals(view.finalScores(), stored.finalScores());
    }

    @Test
    void recoveryResumesAnInterruptedDebate() throws Exception {
        DebateSession interrupted = DebateTestFixtures.sessionWithTurns(
                "interrupted-debate", 2, 3, DebateStatus.IN_PROGRESS);
        debateSnapshotRepository.write(interrupted.id(), DebateSnapshotJsonCodec.toJson(interrupted));

        assertTrue(debateService.recoverStoredDebates() >= 1);

        DebateResponses.DebateStatusView view = awaitTerminal(interrupted.id());
        assertEquals(DebateStatus.COMPLETED, view.status());
        assertEquals(4, view.messages().size());
        assertEquals(interrupted.messages(), view.messages().subList(0, 3));
    }

    @Test
    void cleanupArchivesFinishedDebates() throws Exception {
        DebateResponses.DebateCreated created = debateService.createDebate(new DebateRequests.CreateDebateRequest(
                "Homework should be optional",
                null,
                "pro-key",
                "con-key",
                judges(),
                1
        ));
        awaitTerminal(created.debateId());

        long deadline = System.currentTimeMillis() + COMPLETION_TIMEOUT_MS;
        while (!((InMemoryDebateSnapshotRepository) debateSnapshotRepository).isArchived(created.debateId())
                && System.currentTimeMillis() < deadline) {
            debateService.cleanupTerminalDebates();
            Thread.sleep(20);
        }

        assertTrue(((InMemoryDebateSnapshotRepository) debateSnapshotRepository).isArchived(created.debateId()));
        assertFalse(debateSnapshotRepository.listIds().contains(created.debateId()));
    }

    private DebateResponses.DebateStatusView awaitTerminal(String debateId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + COMPLETION_TIMEOUT_MS;
        while (System.currentTimeMillis() < deadline) {
            DebateResponses.DebateStatusView view = debateService.getDebateStatus(debateId);
            if (view.status().terminal()) {
                return view;
            }
            Thread.sleep(20);
        }
        return fail("Debate " + debateId + " did not finish in time");
    }

    private DebateSession awaitStoredTerminal(String debateId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + COMPLETION_TIMEOUT_MS;
        while (System.currentTimeMillis() < deadline) {
            DebateSession stored = debateSnapshotRepository.read(debateId)
                    .map(DebateSnapshotJsonCodec::fromJson)
                    .orElseThrow();
            if (stored.status().terminal()) {
                return stored;
            }
            Thread.sleep(20);
        }
        return fail("Snapshot for debate " + debateId + " never reached a terminal status");
    }

    private static List<DebateRequests.JudgeEntry> judges() {
        List<DebateRequests.JudgeEntry> judges = new ArrayList<>();
        for (int i = 1; i <= DebateConfig.PANEL_SIZE; i++) {
            judges.add(new DebateRequests.JudgeEntry("Judge " + i, "judge-key-" + i));
        }
        return judges;
    }
}
