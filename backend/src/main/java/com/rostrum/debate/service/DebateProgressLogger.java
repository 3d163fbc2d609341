package com.rostrum.debate.service;

import com.rostrum.debate.model.DebateProgress;
import com.rostrum.debate.model.DebateSession;
import com.rostrum.debate.model.DebateStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs debate outcomes; intermediate changes go to debug and streaming progress to trace.
 */
@Component
public class DebateProgressLogger implements DebateEventListener {

    private static final Logger log = LoggerFactory.getLogger(DebateProgressLogger.class);

    @Override
    public void onSessionChanged(DebateSession session) {
        if (session.status() == DebateStatus.ERROR) {
            log.error("Debate {} failed after {} turns: {}", session.id(), session.messages().size(),
                    session.errorMessage());
        } else if (session.status() == DebateStatus.COMPLETED) {
            log.info(
                    "Debate {} completed; winner={}",
                    session.id(),
                    session.winner() == null ? "tie" : session.winner().wireValue()
            );
        } else {
            log.debug("Debate {} is {} with {} turns", session.id(), session.status().wireValue(),
                    session.messages().size());
        }
    }

    @Override
    public void onProgress(String debateId, DebateProgress progress) {
        if (log.isTraceEnabled()) {
            log.trace(
                    "Debate {} round {}/{} speaker={} thinking={} judging={}",
                    debateId,
                    progress.currentRound(),
                    progress.totalRounds(),
                    progress.currentSpeaker(),
                    progress.thinking(),
                    progress.judging() == null ? null : progress.judging().phase()
            );
        }
    }
}
