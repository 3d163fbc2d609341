package com.rostrum.debate.mapper;

import com.rostrum.debate.dto.DebateResponses;
import com.rostrum.debate.model.DebateProgress;
import com.rostrum.debate.model.DebateSession;
import com.rostrum.debate.model.JudgeCredential;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds client-facing views of a debate. Credentials never leave the service.
 */
@Component
public class DebateResponseMapper {

    public DebateResponses.DebateCreated toCreatedResponse(DebateSession session) {
        return new DebateResponses.DebateCreated(session.id(), session.status());
    }

    public DebateResponses.DebateStatusView toStatusResponse(DebateSession session, DebateProgress progress) {
        List<String> judgeNames = session.config().judges().stream()
                .map(JudgeCredential::name)
                .toList();
        return new DebateResponses.DebateStatusView(
                session.id(),
                session.topic(),
                session.background(),
                session.status(),
                session.config().maxRounds(),
                judgeNames,
                session.messages(),
                session.judgeResults(),
                session.winner(),
                session.finalScores(),
                session.errorMessage(),
                progress,
                session.createdAt(),
                session.updatedAt()
        );
    }
}
