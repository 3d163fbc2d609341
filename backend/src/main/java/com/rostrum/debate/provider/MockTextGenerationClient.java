package com.rostrum.debate.provider;

import com.rostrum.debate.config.TextGenerationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Deterministic mock backend used for reproducible local runs and tests. Debater turns are assembled
 * from fixed phrases and judge evaluations follow the scoring layout judges are asked to use.
 */
@Component
@RequiredArgsConstructor
public class MockTextGenerationClient implements TextGenerationClient {

    private static final List<String> OPENINGS = List.of(
            "Let me start from first principles.",
            "The strongest reading of this motion is simple.",
            "My opponent skips over a crucial point.",
            "Consider what actually happens in practice.",
            "The evidence points in one clear direction."
    );
    private static final List<String> ARGUMENTS = List.of(
            "Incentives shape behaviour far more than stated intentions do.",
            "Historical precedent shows the costs arrive long before the benefits.",
            "Every credible study of the question reaches a consistent conclusion.",
            "The burden of proof rests with whoever asks us to change course.",
            "Second-order effects matter as much as the headline outcome.",
            "A policy that cannot be enforced is only a statement of hope."
    );
    private static final List<String> CLOSINGS = List.of(
            "That is why this side should carry the debate.",
            "Weigh the arguments on their merits and the answer follows.",
            "Nothing said so far has overturned that conclusion.",
            "The case stands, and it stands on solid ground."
    );

    private final TextGenerationProperties textGenerationProperties;

    @Override
    public TextGenerationResponse generate(TextGenerationRequest request, Consumer<String> chunkListener) {
        String text = request.role() == TextGenerationRole.JUDGE
                ? judgeEvaluation(request)
                : debaterTurn(request);
        stream(text, chunkListener);
        return new TextGenerationResponse(text, resolveConversationId(request));
    }

    private String debaterTurn(TextGenerationRequest request) {
        String side = request.role() == TextGenerationRole.PRO ? "In favour" : "Against";
        return side
                + ": "
                + OPENINGS.get(stableIndex(seed(request, "opening"), OPENINGS.size()))
                + " "
                + ARGUMENTS.get(stableIndex(seed(request, "argument.1"), ARGUMENTS.size()))
                + " "
                + ARGUMENTS.get(stableIndex(seed(request, "argument.2"), ARGUMENTS.size()))
                + " "
                + CLOSINGS.get(stableIndex(seed(request, "closing"), CLOSINGS.size()));
    }

    private String judgeEvaluation(TextGenerationRequest request) {
        int proLogic = scoreFor(request, "pro.logic");
        int proEvidence = scoreFor(request, "pro.evidence");
        int proRebuttal = scoreFor(request, "pro.rebuttal");
        int proExpression = scoreFor(request, "pro.expression");
        int conLogic = scoreFor(request, "con.logic");
        int conEvidence = scoreFor(request, "con.evidence");
        int conRebuttal = scoreFor(request, "con.rebuttal");
        int conExpression = scoreFor(request, "con.expression");

        double proTotal = 0.3 * proLogic + 0.3 * proEvidence + 0.2 * proRebuttal + 0.2 * proExpression;
        double conTotal = 0.3 * conLogic + 0.3 * conEvidence + 0.2 * conRebuttal + 0.2 * conExpression;
        String recommended = proTotal >= conTotal ? "pro" : "con";

        return "PRO SCORES\n"
                + "Logic: " + proLogic + "\n"
                + "Evidence: " + proEvidence + "\n"
                + "Rebuttal: " + proRebuttal + "\n"
                + "Expression: " + proExpression + "\n"
                + "\n"
                + "CON SCORES\n"
                + "Logic: " + conLogic + "\n"
                + "Evidence: " + conEvidence + "\n"
                + "Rebuttal: " + conRebuttal + "\n"
                + "Expression: " + conExpression + "\n"
                + "\n"
                + "SCORE RATIONALE\n"
                + "Pro logic: The argument chain held together under pressure.\n"
                + "Pro evidence: Claims were supported by concrete examples.\n"
                + "Pro rebuttal: Engaged directly with the strongest objections.\n"
                + "Pro expression: Clear and well paced.\n"
                + "Con logic: Reasoning was coherent but occasionally stretched.\n"
                + "Con evidence: Relied more on principle than on data.\n"
                + "Con rebuttal: Answered most challenges raised by the other side.\n"
                + "Con expression: Persuasive and direct.\n"
                + "\n"
                + "STRENGTHS: structured openings, direct clash, consistent framing\n"
                + "WEAKNESSES: thin sourcing, repeated claims\n"
                + "SUGGESTIONS: cite specific data, address the weighing question earlier\n"
                + "OVERALL: A close, well argued exchange with clear clash on the central question.\n"
                + "RECOMMENDED WINNER: " + recommended + " - stronger weighted performance across the categories\n";
    }

    private void stream(String text, Consumer<String> chunkListener) {
        if (chunkListener == null) {
            return;
        }
        int chunkWords = Math.max(1, textGenerationProperties.getMockChunkWords());
        String[] words = text.split(" ");
        StringBuilder accumulated = new StringBuilder();
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                accumulated.append(' ');
            }
            accumulated.append(words[i]);
            if ((i + 1) % chunkWords == 0 || i == words.length - 1) {
                chunkListener.accept(accumulated.toString());
            }
        }
    }

    private String resolveConversationId(TextGenerationRequest request) {
        if (request.conversationId() != null) {
            return request.conversationId();
        }
        String seed = request.role().userTag() + "|" + request.apiKey();
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private int scoreFor(TextGenerationRequest request, String criterion) {
        return 60 + stableIndex(seed(request, criterion), 35);
    }

    private String seed(TextGenerationRequest request, String suffix) {
        return textGenerationProperties.getMockModel()
                + "|"
                + request.role().userTag()
                + "|"
                + request.apiKey()
                + "|"
                + request.prompt()
                + "|"
                + suffix;
    }

    private static int stableIndex(String seed, int bound) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(seed.getBytes(StandardCharsets.UTF_8));
            int raw = ByteBuffer.wrap(hash).getInt();
            return Math.floorMod(raw, bound);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 digest algorithm is required", ex);
        }
    }
}
