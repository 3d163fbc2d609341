package com.rostrum.debate.service;

import com.rostrum.debate.model.DebateConfig;
import com.rostrum.debate.model.DebateSession;
import com.rostrum.debate.model.DebateSide;
import com.rostrum.debate.model.JudgeCredential;
import com.rostrum.debate.provider.TextGenerationGateway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires an orchestrator for a session: one client per debater and per judge, the shared aggregator
 * and the debate loop executor.
 */
@Component
public class DebateOrchestratorFactory {

    private final TextGenerationGateway textGenerationGateway;
    private final DebateScoreAggregator debateScoreAggregator;
    private final DebateProgressLogger debateProgressLogger;
    private final Executor debateTaskExecutor;
    private final Clock clock = Clock.systemUTC();

    public DebateOrchestratorFactory(
            TextGenerationGateway textGenerationGateway,
            DebateScoreAggregator debateScoreAggregator,
            DebateProgressLogger debateProgressLogger,
            @Qualifier("debateTaskExecutor") Executor debateTaskExecutor
    ) {
        this.textGenerationGateway = textGenerationGateway;
        this.debateScoreAggregator = debateScoreAggregator;
        this.debateProgressLogger = debateProgressLogger;
        this.debateTaskExecutor = debateTaskExecutor;
    }

    public DebateOrchestrator create(DebateSession session) {
        DebateConfig config = session.config();
        String id = session.id();

        DebateAgent proAgent = new DebateAgent(
                DebateSide.PRO,
                config.pro(),
                textGenerationGateway.clientFor(id + ":pro")
        );
        DebateAgent conAgent = new DebateAgent(
                DebateSide.CON,
                config.con(),
                textGenerationGateway.clientFor(id + ":con")
        );
        List<DebateJudge> judges = new ArrayList<>(config.judges().size());
        for (int i = 0; i < config.judges().size(); i++) {
            JudgeCredential judge = config.judges().get(i);
            judges.add(new DebateJudge(judge, textGenerationGateway.clientFor(id + ":judge-" + (i + 1))));
        }

        DebateOrchestrator orchestrator = new DebateOrchestrator(
                session,
                proAgent,
                conAgent,
                judges,
                debateScoreAggregator,
                debateTaskExecutor,
                clock
        );
        orchestrator.addListener(debateProgressLogger);
        return orchestrator;
    }
}
