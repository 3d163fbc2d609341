package com.rostrum.debate.service;

import com.rostrum.debate.DebateTestFixtures;
import com.rostrum.debate.dto.DebateRequests;
import com.rostrum.debate.dto.DebateResponses;
import com.rostrum.debate.mapper.DebateResponseMapper;
import com.rostrum.debate.model.DebateConfig;
import com.rostrum.debate.model.DebateSession;
import com.rostrum.debate.model.DebateSide;
import com.rostrum.debate.model.DebateStatus;
import com.rostrum.debate.provider.TextGenerationClient;
import com.rostrum.debate.provider.TextGenerationResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DebateServiceTest {

    @Mock
    private DebateSessionStore debateSessionStore;

    private DebateService debateService;
    private final List<Runnable> deferredLoops = new ArrayList<>();

    @BeforeEach
    void setUp() {
        debateService = new DebateService(debateSessionStore, new DebateResponseMapper());
    }

    @Test
    void createDebateRegistersAndStartsTheDebate() {
        when(debateSessionStore.create(anyString(), anyString(), any(DebateConfig.class)))
                .thenAnswer(invocation -> deferredOrchestrator(DebateSession.create(
                        "debate-1",
                        invocation.getArgument(0),
                        invocation.getArgument(1),
                        invocation.getArgument(2),
                        DebateTestFixtures.NOW
                )));

        DebateResponses.DebateCreated created = debateService.createDebate(request(
                "  Remote work should be the default  ", null, "pro-key", judges(6), 2));

        assertEquals("debate-1", created.debateId());
        assertEquals(DebateStatus.IN_PROGRESS, created.status());
        assertEquals(1, deferredLoops.size());

        ArgumentCaptor<DebateConfig> config = ArgumentCaptor.forClass(DebateConfig.class);
        verify(debateSessionStore).create(eq("Remote work should be the default"), eq(""), config.capture());
        assertEquals("pro-key", config.getValue().pro().apiKey());
        assertEquals("Judge 6", config.getValue().judges().get(5).name());
        assertEquals(2, config.getValue().maxRounds());
    }

    @Test
    void createDebateRejectsWrongPanelSize() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> debateService.createDebate(request("Topic", "", "pro-key", judges(5), 2)));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertEquals("exactly 6 judges are required", ex.getReason());
        verify(debateSessionStore, never()).create(anyString(), anyString(), any());
    }

    @Test
    void createDebateRejectsMissingCredentialsAndRounds() {
        assertEquals(HttpStatus.BAD_REQUEST, assertThrows(ResponseStatusException.class,
                () -> debateService.createDebate(request("Topic", "", "  ", judges(6), 2))).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, assertThrows(ResponseStatusException.class,
                () -> debateService.createDebate(request("Topic", "", "pro-key", judges(6), 0))).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, assertThrows(ResponseStatusException.class,
                () -> debateService.createDebate(request("Topic", "", "pro-key", judges(6), null))).getStatusCode());

        List<DebateRequests.JudgeEntry> keyless = new ArrayList<>(judges(6));
        keyless.set(3, new DebateRequests.JudgeEntry("Judge 4", ""));
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> debateService.createDebate(request("Topic", "", "pro-key", keyless, 2)));
        assertEquals("judges[3].apiKey is required", ex.getReason());

        verify(debateSessionStore, never()).create(anyString(), anyString(), any());
    }

    @Test
    void createDebateReportsStoreFailureAsServerError() {
        when(debateSessionStore.create(anyString(), anyString(), any(DebateConfig.class)))
                .thenThrow(new IllegalStateException("Debate store cannot register the new session debate-2"));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> debateService.createDebate(request("Topic", "", "pro-key", judges(6), 1)));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, ex.getStatusCode());
        assertEquals("Debate store cannot register the new session debate-2", ex.getReason());
    }

    @Test
    void unknownDebateIsNotFound() {
        when(debateSessionStore.find("missing")).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> debateService.getDebateStatus("missing"));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
        assertEquals("Debate not found: missing", ex.getReason());
    }

    @Test
    void statusReflectsTheLiveSession() {
        DebateSession session = DebateTestFixtures.sessionWithTurns("debate-3", 2, 3, DebateStatus.IN_PROGRESS);
        DebateOrchestrator orchestrator = deferredOrchestrator(session);
        orchestrator.restoreState(session);
        when(debateSessionStore.find("debate-3")).thenReturn(Optional.of(orchestrator));

        DebateResponses.DebateStatusView view = debateService.getDebateStatus("debate-3");

        assertEquals(DebateStatus.IN_PROGRESS, view.status());
        assertEquals(3, view.messages().size());
        assertEquals(DebateSide.CON, view.progress().currentSpeaker());
        assertEquals(50.0, view.progress().percentage());
    }

    @Test
    void recoverStoredDebatesCountsRecoveredSessions() {
        DebateSession session = DebateTestFixtures.pendingSession("debate-a", 1);
        when(debateSessionStore.storedIds()).thenReturn(List.of("debate-a", "debate-b", "debate-c"));
        when(debateSessionStore.find("debate-a")).thenReturn(Optional.of(deferredOrchestrator(session)));
        when(debateSessionStore.find("debate-b")).thenReturn(Optional.empty());
        when(debateSessionStore.find("debate-c")).thenThrow(new IllegalStateException("unreadable"));

        assertEquals(1, debateService.recoverStoredDebates());
    }

    @Test
    void cleanupReportsArchivedCount() {
        when(debateSessionStore.cleanupTerminalSessions()).thenReturn(4);

        assertEquals(4, debateService.cleanupTerminalDebates().archived());
    }

    private DebateOrchestrator deferredOrchestrator(DebateSession session) {
        TextGenerationClient client = (request, listener) -> new TextGenerationResponse("unused", null);
        return new DebateOrchestrator(
                session,
                new DebateAgent(DebateSide.PRO, session.config().pro(), client),
                new DebateAgent(DebateSide.CON, session.config().con(), client),
                List.of(),
                new DebateScoreAggregator(),
                deferredLoops::add,
                Clock.fixed(DebateTestFixtures.NOW, ZoneOffset.UTC)
        );
    }

    private static DebateRequests.CreateDebateRequest request(
            String topic,
            String background,
            String proApiKey,
            List<DebateRequests.JudgeEntry> judges,
            Integer maxRounds
    ) {
        return new DebateRequests.CreateDebateRequest(topic, background, proApiKey, "con-key", judges, maxRounds);
    }

    private static List<DebateRequests.JudgeEntry> judges(int count) {
        List<DebateRequests.JudgeEntry> judges = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            judges.add(new DebateRequests.JudgeEntry("Judge " + i, "judge-key-" + i));
        }
        return judges;
    }
}
