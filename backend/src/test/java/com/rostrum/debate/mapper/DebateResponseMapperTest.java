package com.rostrum.debate.mapper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rostrum.debate.DebateTestFixtures;
import com.rostrum.debate.dto.DebateResponses;
import com.rostrum.debate.model.DebateProgress;
import com.rostrum.debate.model.DebateSession;
import com.rostrum.debate.model.DebateSide;
import com.rostrum.debate.model.DebateStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

class DebateResponseMapperTest {

    private final DebateResponseMapper mapper = new DebateResponseMapper();

    @Test
    void statusViewCarriesTranscriptAndProgress() {
        DebateSession session = DebateTestFixtures.sessionWithTurns("debate-1", 3, 2, DebateStatus.IN_PROGRESS);
        DebateProgress progress = DebateProgress.idle(1, 3, DebateSide.PRO);

        DebateResponses.DebateStatusView view = mapper.toStatusResponse(session, progress);

        assertEquals("debate-1", view.debateId());
        assertEquals(DebateStatus.IN_PROGRESS, view.status());
        assertEquals(3, view.maxRounds());
        assertEquals(List.of("Judge 1", "Judge 2", "Judge 3", "Judge 4", "Judge 5", "Judge 6"), view.judgeNames());
        assertEquals(session.messages(), view.messages());
        assertSame(progress, view.progress());
        assertEquals(session.updatedAt(), view.updatedAt());
    }

    @Test
    void serializedViewNeverExposesCredentials() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        DebateSession session = DebateTestFixtures.sessionWithTurns("debate-2", 1, 2, DebateStatus.JUDGING);

        String json = objectMapper.writeValueAsString(
                mapper.toStatusResponse(session, DebateProgress.idle(1, 1, DebateSide.PRO)));

        assertFalse(json.contains("apiKey"));
        assertFalse(json.contains("pro-key"));
        assertFalse(json.contains("con-key"));
        assertFalse(json.contains("judge-key-"));
    }

    @Test
    void createdResponseReportsCurrentStatus() {
        DebateResponses.DebateCreated created =
                mapper.toCreatedResponse(DebateTestFixtures.sessionWithTurns("debate-3", 1, 0, DebateStatus.IN_PROGRESS));

        assertEquals("debate-3", created.debateId());
        assertEquals(DebateStatus.IN_PROGRESS, created.status());
    }
}
