package com.rostrum.debate.service;

import com.rostrum.debate.dto.DebateRequests;
import com.rostrum.debate.dto.DebateResponses;
import com.rostrum.debate.mapper.DebateResponseMapper;
import com.rostrum.debate.model.DebateConfig;
import com.rostrum.debate.model.JudgeCredential;
import com.rostrum.debate.model.ParticipantCredential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for creating debates, reading their status and clearing finished ones.
 */
@Service
public class DebateService {

    private static final Logger log = LoggerFactory.getLogger(DebateService.class);

    private final DebateSessionStore debateSessionStore;
    private final DebateResponseMapper debateResponseMapper;

    public DebateService(DebateSessionStore debateSessionStore, DebateResponseMapper debateResponseMapper) {
        this.debateSessionStore = debateSessionStore;
        this.debateResponseMapper = debateResponseMapper;
    }

    public DebateResponses.DebateCreated createDebate(DebateRequests.CreateDebateRequest request) {
        DebateConfig config = toConfig(request);
        String background = request.background() == null ? "" : request.background().trim();

        DebateOrchestrator orchestrator;
        try {
            orchestrator = debateSessionStore.create(request.topic().trim(), background, config);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex);
        }
        orchestrator.start();
        return debateResponseMapper.toCreatedResponse(orchestrator.getSession());
    }

    public DebateResponses.DebateStatusView getDebateStatus(String debateId) {
        DebateOrchestrator orchestrator = debateSessionStore.find(debateId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Debate not found: " + debateId
                ));
        return debateResponseMapper.toStatusResponse(orchestrator.getSession(), orchestrator.getProgress());
    }

    public DebateResponses.CleanupResult cleanupTerminalDebates() {
        return new DebateResponses.CleanupResult(debateSessionStore.cleanupTerminalSessions());
    }

    /**
     * Looks up every stored debate once so interrupted ones resume.
     *
     * @return number of debates that could be recovered
     */
    public int recoverStoredDebates() {
        int recovered = 0;
        for (String debateId : debateSessionStore.storedIds()) {
            try {
                if (debateSessionStore.find(debateId).isPresent()) {
                    recovered++;
                }
            } catch (RuntimeException ex) {
                log.error("Could not recover debate {}", debateId, ex);
            }
        }
        return recovered;
    }

    private static DebateConfig toConfig(DebateRequests.CreateDebateRequest request) {
        if (request == null) {
            throw badRequest("request body is required");
        }
        if (!StringUtils.hasText(request.topic())) {
            throw badRequest("topic is required");
        }
        if (!StringUtils.hasText(request.proApiKey())) {
            throw badRequest("proApiKey is required");
        }
        if (!StringUtils.hasText(request.conApiKey())) {
            throw badRequest("conApiKey is required");
        }
        if (request.judges() == null || request.judges().size() != DebateConfig.PANEL_SIZE) {
            throw badRequest("exactly " + DebateConfig.PANEL_SIZE + " judges are required");
        }
        if (request.maxRounds() == null
                || request.maxRounds() < DebateConfig.MIN_ROUNDS
                || request.maxRounds() > DebateConfig.MAX_ROUNDS) {
            throw badRequest("maxRounds must be between " + DebateConfig.MIN_ROUNDS + " and " + DebateConfig.MAX_ROUNDS);
        }

        List<JudgeCredential> judges = new ArrayList<>(DebateConfig.PANEL_SIZE);
        for (int i = 0; i < request.judges().size(); i++) {
            DebateRequests.JudgeEntry judge = request.judges().get(i);
            if (judge == null || !StringUtils.hasText(judge.name())) {
                throw badRequest("judges[" + i + "].name is required");
            }
            if (!StringUtils.hasText(judge.apiKey())) {
                throw badRequest("judges[" + i + "].apiKey is required");
            }
            judges.add(new JudgeCredential(judge.name().trim(), judge.apiKey().trim()));
        }

        return new DebateConfig(
                new ParticipantCredential(request.proApiKey().trim()),
                new ParticipantCredential(request.conApiKey().trim()),
                judges,
                request.maxRounds()
        );
    }

    private static ResponseStatusException badRequest(String detail) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, detail);
    }
}
