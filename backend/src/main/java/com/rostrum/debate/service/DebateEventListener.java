package com.rostrum.debate.service;

import com.rostrum.debate.model.DebateProgress;
import com.rostrum.debate.model.DebateSession;

/**
 * Observer of a running debate. Callbacks run synchronously on the debate's own thread.
 */
public interface DebateEventListener {

    /**
     * Called after every durable change to the session.
     */
    void onSessionChanged(DebateSession session);

    default void onProgress(String debateId, DebateProgress progress) {
    }
}
