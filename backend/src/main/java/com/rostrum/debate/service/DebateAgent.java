package com.rostrum.debate.service;

import com.rostrum.debate.model.DebateSession;
import com.rostrum.debate.model.DebateSide;
import com.rostrum.debate.model.ParticipantCredential;
import com.rostrum.debate.provider.TextGenerationClient;
import com.rostrum.debate.provider.TextGenerationRequest;
import com.rostrum.debate.provider.TextGenerationResponse;
import com.rostrum.debate.provider.TextGenerationRole;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * One debater. Builds its speech prompt from the full transcript so far and keeps the backend
 * conversation going across its turns.
 */
public class DebateAgent {

    private final DebateSide side;
    private final ParticipantCredential credential;
    private final TextGenerationClient client;
    private volatile String conversationId;

    public DebateAgent(DebateSide side, ParticipantCredential credential, TextGenerationClient client) {
        this.side = Objects.requireNonNull(side, "side is required");
        this.credential = Objects.requireNonNull(credential, "credential is required");
        this.client = Objects.requireNonNull(client, "client is required");
    }

    /**
     * Generates this side's next speech.
     *
     * @param chunkListener receives the speech accumulated so far while it streams
     */
    public String respond(DebateSession session, Consumer<String> chunkListener) {
        TextGenerationResponse response = client.generate(
                new TextGenerationRequest(
                        TextGenerationRole.forSide(side),
                        credential.apiKey(),
                        buildPrompt(session),
                        conversationId
                ),
                chunkListener
        );
        if (response.conversationId() != null) {
            conversationId = response.conversationId();
        }
        return response.text().trim();
    }

    String buildPrompt(DebateSession session) {
        String stance = side == DebateSide.PRO
                ? "You argue IN FAVOUR of the motion."
                : "You argue AGAINST the motion.";
        return "You are the " + side.wireValue() + " speaker in a formal debate.\n"
                + "Motion: " + session.topic() + "\n"
                + "Background: " + DebatePromptFormatter.background(session.background()) + "\n"
                + stance + "\n"
                + "Keep the argument logical and well supported, answer the strongest points your opponent has made, "
                + "stay courteous and keep the speech under 200 words.\n\n"
                + "Debate so far:\n"
                + DebatePromptFormatter.transcript(session.messages()) + "\n\n"
                + "Give your next speech now.";
    }

    public DebateSide getSide() {
        return side;
    }
}
