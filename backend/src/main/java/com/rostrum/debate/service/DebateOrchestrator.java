package com.rostrum.debate.service;

import com.rostrum.debate.model.CategoryAverages;
import com.rostrum.debate.model.DebateProgress;
import com.rostrum.debate.model.DebateSession;
import com.rostrum.debate.model.DebateSide;
import com.rostrum.debate.model.DebateStatus;
import com.rostrum.debate.model.DebateTurn;
import com.rostrum.debate.model.EliminatedScores;
import com.rostrum.debate.model.FinalScores;
import com.rostrum.debate.model.HighlightedScore;
import com.rostrum.debate.model.JudgeResult;
import com.rostrum.debate.model.JudgingProgress;
import com.rostrum.debate.model.ScoreCategory;
import com.rostrum.debate.model.ScoringPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one debate through its lifecycle: alternating rounds, panel judging and the final verdict.
 *
 * <p>The session and the live progress are immutable values swapped atomically, so readers on other
 * threads always observe a consistent state. Only one round loop runs per orchestrator at a time.
 */
public class DebateOrchestrator {

    static final String JUDGING_INTERRUPTED_MESSAGE =
            "Judging was interrupted by a restart; recreate the debate to judge it again";

    private static final Logger log = LoggerFactory.getLogger(DebateOrchestrator.class);

    private final DebateAgent proAgent;
    private final DebateAgent conAgent;
    private final List<DebateJudge> judges;
    private final DebateScoreAggregator debateScoreAggregator;
    private final Executor debateExecutor;
    private final Clock clock;
    private final List<DebateEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile DebateSession session;
    private volatile DebateProgress progress;

    public DebateOrchestrator(
            DebateSession session,
            DebateAgent proAgent,
            DebateAgent conAgent,
            List<DebateJudge> judges,
            DebateScoreAggregator debateScoreAggregator,
            Executor debateExecutor,
            Clock clock
    ) {
        this.session = Objects.requireNonNull(session, "session is required");
        this.proAgent = Objects.requireNonNull(proAgent, "proAgent is required");
        this.conAgent = Objects.requireNonNull(conAgent, "conAgent is required");
        this.judges = List.copyOf(Objects.requireNonNull(judges, "judges are required"));
        this.debateScoreAggregator = Objects.requireNonNull(debateScoreAggregator, "debateScoreAggregator is required");
        this.debateExecutor = Objects.requireNonNull(debateExecutor, "debateExecutor is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.progress = freshProgress(session);
    }

    public void addListener(DebateEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    public DebateSession getSession() {
        return session;
    }

    public DebateProgress getProgress() {
        return progress;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Moves a pending debate to {@code in_progress} and hands the round loop to the debate executor.
     * Returns immediately; later failures surface through the {@code error} status.
     *
     * @throws IllegalStateException when a loop is already active or the debate is not pending
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Debate " + session.id() + " is already running");
        }
        if (session.status() != DebateStatus.PENDING) {
            running.set(false);
            throw new IllegalStateException(
                    "Only pending debates can be started: " + session.id() + " is " + session.status().wireValue());
        }
        log.info("Starting debate {} on '{}' for {} rounds", session.id(), session.topic(),
                session.config().maxRounds());
        updateSession(session.withStatus(DebateStatus.IN_PROGRESS, now()));
        submitLoop();
    }

    /**
     * Replaces the in-memory state with a recovered snapshot and resumes the round loop when the
     * debate was interrupted mid-way. A debate interrupted while judging is closed as failed.
     */
    public void restoreState(DebateSession restored) {
        Objects.requireNonNull(restored, "restored session is required");
        if (running.get()) {
            throw new IllegalStateException("Cannot restore debate " + restored.id() + " while its loop is running");
        }
        session = restored;
        updateProgress(freshProgress(restored));

        if (restored.status() == DebateStatus.JUDGING) {
            log.warn("Debate {} was restored mid-judging; marking it failed", restored.id());
            updateSession(restored.withError(JUDGING_INTERRUPTED_MESSAGE, now()));
            return;
        }
        if (restored.status() == DebateStatus.IN_PROGRESS
                && restored.errorMessage() == null
                && running.compareAndSet(false, true)) {
            log.info(
                    "Resuming debate {} after {} of {} rounds",
                    restored.id(),
                    restored.completedRounds(),
                    restored.config().maxRounds()
            );
            submitLoop();
        }
    }

    /**
     * Plays one round: the pro speech followed by the con reply. A round that already holds its pro
     * speech only generates the con reply.
     */
    public void runRound() {
        if (session.messages().size() % 2 == 0) {
            speak(proAgent);
        }
        speak(conAgent);
        DebateSession current = session;
        updateProgress(DebateProgress.idle(current.completedRounds(), current.config().maxRounds(), DebateSide.PRO));
    }

    /**
     * Collects one verdict from every judge in panel order, aggregates them and completes the debate.
     */
    public void runJudging() {
        updateSession(session.withStatus(DebateStatus.JUDGING, now()));
        int totalJudges = judges.size();
        emitJudging(ScoringPhase.NOT_STARTED, 0, totalJudges, 0.0, null, null);

        List<JudgeResult> results = new ArrayList<>(totalJudges);
        for (int i = 0; i < totalJudges; i++) {
            DebateJudge judge = judges.get(i);
            emitJudging(ScoringPhase.JUDGE_THINKING, i + 1, totalJudges, 0.0, null, null);
            JudgeResult result = judge.evaluate(session);
            results.add(result);
            if (result.degraded()) {
                log.warn("Judge {} returned default scores for debate {}", judge.getName(), session.id());
            }
            emitJudging(ScoringPhase.REVEALING_SCORES, i + 1, totalJudges, 0.5,
                    new HighlightedScore(DebateSide.PRO, null, result.totalScore().pro()), null);
            emitJudging(ScoringPhase.REVEALING_SCORES, i + 1, totalJudges, 1.0,
                    new HighlightedScore(DebateSide.CON, null, result.totalScore().con()), null);
        }

        DebateScoreAggregator.Verdict verdict = debateScoreAggregator.aggregate(results);
        FinalScores finalScores = verdict.finalScores();
        ScoreCategory[] categories = ScoreCategory.values();
        int steps = categories.length * 2;
        int step = 0;
        for (ScoreCategory category : categories) {
            for (DebateSide side : DebateSide.values()) {
                step++;
                CategoryAverages averages = finalScores.categories().get(side);
                emitJudging(ScoringPhase.CALCULATING_FINAL, totalJudges, totalJudges, (double) step / steps,
                        new HighlightedScore(side, category, averages.get(category)),
                        finalScores.eliminated().get(side));
            }
        }

        DebateSide winner = verdict.winner();
        DebateSide shownSide = winner == null ? DebateSide.PRO : winner;
        emitJudging(ScoringPhase.SHOWING_WINNER, totalJudges, totalJudges, 1.0,
                new HighlightedScore(shownSide, null, finalScores.total().get(shownSide)),
                finalScores.eliminated().get(shownSide));

        updateSession(session.withVerdict(results, finalScores, winner, now()));
        emitJudging(ScoringPhase.COMPLETED, totalJudges, totalJudges, 1.0, null, null);
    }

    private void submitLoop() {
        try {
            debateExecutor.execute(this::runLoop);
        } catch (RuntimeException ex) {
            running.set(false);
            fail(ex);
        }
    }

    void runLoop() {
        try {
            int maxRounds = session.config().maxRounds();
            while (session.status() == DebateStatus.IN_PROGRESS && session.completedRounds() < maxRounds) {
                runRound();
            }
            if (session.status() == DebateStatus.IN_PROGRESS) {
                runJudging();
            }
        } catch (RuntimeException ex) {
            if (Thread.currentThread().isInterrupted() || causedByInterrupt(ex)) {
                suspend();
            } else {
                fail(ex);
            }
        } finally {
            running.set(false);
        }
    }

    private void speak(DebateAgent agent) {
        DebateSide side = agent.getSide();
        updateProgress(progress.speaking(side, true, ""));
        String text = agent.respond(session, partial -> updateProgress(progress.speaking(side, false, partial)));
        Instant now = now();
        updateSession(session.withTurn(new DebateTurn(side, text, now), now));
        updateProgress(progress.speaking(side, false, text));
    }

    /**
     * Leaves the debate resumable after its loop thread was interrupted, typically by executor shutdown.
     * Recorded turns stay as they are; an unfinished panel is reopened so recovery runs it again.
     */
    private void suspend() {
        boolean interrupted = Thread.interrupted();
        try {
            log.info("Debate {} loop interrupted after {} turns; leaving it for recovery",
                    session.id(), session.messages().size());
            if (session.status() == DebateStatus.JUDGING) {
                updateSession(session.withStatus(DebateStatus.IN_PROGRESS, now()));
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static boolean causedByInterrupt(Throwable failure) {
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (current instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    private void fail(RuntimeException ex) {
        String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        log.error("Debate {} failed: {}", session.id(), message, ex);
        updateSession(session.withError(message, now()));
    }

    private void emitJudging(
            ScoringPhase phase,
            int currentJudge,
            int totalJudges,
            double revealProgress,
            HighlightedScore highlightedScore,
            EliminatedScores eliminatedScores
    ) {
        updateProgress(progress.withJudging(new JudgingProgress(
                phase,
                currentJudge,
                totalJudges,
                revealProgress,
                highlightedScore,
                eliminatedScores
        )));
    }

    private void updateSession(DebateSession next) {
        session = next;
        for (DebateEventListener listener : listeners) {
            try {
                listener.onSessionChanged(next);
            } catch (RuntimeException ex) {
                log.warn("Debate listener {} failed on session change for {}", listener, next.id(), ex);
            }
        }
    }

    private void updateProgress(DebateProgress next) {
        progress = next;
        String debateId = session.id();
        for (DebateEventListener listener : listeners) {
            try {
                listener.onProgress(debateId, next);
            } catch (RuntimeException ex) {
                log.warn("Debate listener {} failed on progress for {}", listener, debateId, ex);
            }
        }
    }

    private static DebateProgress freshProgress(DebateSession session) {
        return DebateProgress.idle(session.completedRounds(), session.config().maxRounds(), session.nextSide());
    }

    private Instant now() {
        return clock.instant();
    }
}
