package com.rostrum.debate.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;

/**
 * Serializes debate sessions to their durable JSON snapshot and validates snapshots read back from storage.
 */
public final class DebateSnapshotJsonCodec {

    private static final String FIELD_ID = "id";
    private static final String FIELD_TOPIC = "topic";
    private static final String FIELD_BACKGROUND = "background";
    private static final String FIELD_STATUS = "status";
    private static final String FIELD_MESSAGES = "messages";
    private static final String FIELD_JUDGE_RESULTS = "judgeResults";
    private static final String FIELD_CONFIG = "config";
    private static final String FIELD_CREATED_AT = "createdAt";
    private static final String FIELD_UPDATED_AT = "updatedAt";

    private static final List<String> REQUIRED_TEXT_FIELDS = List.of(
            FIELD_ID,
            FIELD_TOPIC,
            FIELD_STATUS,
            FIELD_CREATED_AT,
            FIELD_UPDATED_AT
    );

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private DebateSnapshotJsonCodec() {
    }

    public static String toJson(DebateSession session) {
        if (session == null) {
            throw new IllegalArgumentException("Debate session is required");
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(session);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Debate session " + session.id() + " could not be serialized", ex);
        }
    }

    /**
     * Parses and structurally validates a snapshot.
     *
     * @throws IllegalArgumentException describing the first violation found
     */
    public static DebateSession fromJson(String snapshotJson) {
        if (snapshotJson == null || snapshotJson.isBlank()) {
            throw new IllegalArgumentException("Snapshot is empty");
        }

        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(snapshotJson);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Snapshot is not valid JSON: " + ex.getOriginalMessage(), ex);
        }

        validate(root);

        try {
            return OBJECT_MAPPER.treeToValue(root, DebateSession.class);
        } catch (JsonProcessingException | RuntimeException ex) {
            throw new IllegalArgumentException("Snapshot could not be bound to a debate session: " + ex.getMessage(), ex);
        }
    }

    /**
     * Parses a snapshot stored under {@code expectedId} and rejects one that names another debate.
     *
     * @throws IllegalArgumentException describing the first violation found
     */
    public static DebateSession fromJson(String snapshotJson, String expectedId) {
        DebateSession session = fromJson(snapshotJson);
        if (!session.id().equals(expectedId)) {
            throw new IllegalArgumentException(
                    "Snapshot field 'id' is '" + session.id() + "' but the snapshot is stored as '" + expectedId + "'");
        }
        return session;
    }

    static void validate(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Snapshot must be a JSON object");
        }
        for (String field : REQUIRED_TEXT_FIELDS) {
            requireText(root, field);
        }
        JsonNode background = root.get(FIELD_BACKGROUND);
        if (background != null && !background.isNull() && !background.isTextual()) {
            throw new IllegalArgumentException("Snapshot field 'background' must be textual");
        }

        DebateStatus status;
        try {
            status = DebateStatus.fromWireValue(root.get(FIELD_STATUS).textValue());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(
                    "Snapshot field 'status' has unknown value '" + root.get(FIELD_STATUS).textValue() + "'", ex);
        }

        int maxRounds = validateConfig(root.get(FIELD_CONFIG));
        validateMessages(root.get(FIELD_MESSAGES), maxRounds);
        validateJudgeResults(root.get(FIELD_JUDGE_RESULTS), status);
    }

    private static int validateConfig(JsonNode config) {
        if (config == null || !config.isObject()) {
            throw new IllegalArgumentException("Snapshot missing object field 'config'");
        }
        requireApiKey(config, "pro");
        requireApiKey(config, "con");

        JsonNode judges = config.get("judges");
        if (judges == null || !judges.isArray()) {
            throw new IllegalArgumentException("Snapshot missing array field 'config.judges'");
        }
        if (judges.size() != DebateConfig.PANEL_SIZE) {
            throw new IllegalArgumentException(
                    "Snapshot field 'config.judges' must hold exactly "
                            + DebateConfig.PANEL_SIZE
                            + " judges but holds "
                            + judges.size()
            );
        }
        for (int i = 0; i < judges.size(); i++) {
            JsonNode judge = judges.get(i);
            if (!judge.isObject() || !hasText(judge, "name") || !hasText(judge, "apiKey")) {
                throw new IllegalArgumentException(
                        "Snapshot field 'config.judges[" + i + "]' requires non-blank 'name' and 'apiKey'");
            }
        }

        JsonNode maxRounds = config.get("maxRounds");
        if (maxRounds == null || !maxRounds.isIntegralNumber()) {
            throw new IllegalArgumentException("Snapshot missing integer field 'config.maxRounds'");
        }
        int value = maxRounds.intValue();
        if (value < DebateConfig.MIN_ROUNDS || value > DebateConfig.MAX_ROUNDS) {
            throw new IllegalArgumentException(
                    "Snapshot field 'config.maxRounds' must be between "
                            + DebateConfig.MIN_ROUNDS
                            + " and "
                            + DebateConfig.MAX_ROUNDS
            );
        }
        return value;
    }

    private static void validateMessages(JsonNode messages, int maxRounds) {
        if (messages == null || !messages.isArray()) {
            throw new IllegalArgumentException("Snapshot missing array field 'messages'");
        }
        if (messages.size() > maxRounds * 2) {
            throw new IllegalArgumentException(
                    "Snapshot holds " + messages.size() + " turns but at most " + (maxRounds * 2) + " are allowed");
        }
        for (int i = 0; i < messages.size(); i++) {
            JsonNode turn = messages.get(i);
            if (!turn.isObject() || !turn.path("text").isTextual() || !turn.path("side").isTextual()) {
                throw new IllegalArgumentException("Snapshot field 'messages[" + i + "]' requires 'side' and 'text'");
            }
            DebateSide expected = DebateSide.forTurnIndex(i);
            if (!expected.wireValue().equals(turn.get("side").textValue())) {
                throw new IllegalArgumentException(
                        "Snapshot field 'messages[" + i + "].side' must be '" + expected.wireValue() + "'");
            }
        }
    }

    private static void validateJudgeResults(JsonNode judgeResults, DebateStatus status) {
        int count = 0;
        if (judgeResults != null && !judgeResults.isNull()) {
            if (!judgeResults.isArray()) {
                throw new IllegalArgumentException("Snapshot field 'judgeResults' must be an array");
            }
            count = judgeResults.size();
        }
        if (count != 0 && count != DebateConfig.PANEL_SIZE) {
            throw new IllegalArgumentException(
                    "Snapshot field 'judgeResults' must hold 0 or "
                            + DebateConfig.PANEL_SIZE
                            + " results but holds "
                            + count
            );
        }
        if (status == DebateStatus.COMPLETED && count != DebateConfig.PANEL_SIZE) {
            throw new IllegalArgumentException(
                    "Completed snapshot must hold " + DebateConfig.PANEL_SIZE + " judge results");
        }
    }

    private static void requireApiKey(JsonNode config, String participant) {
        JsonNode credential = config.get(participant);
        if (credential == null || !credential.isObject() || !hasText(credential, "apiKey")) {
            throw new IllegalArgumentException(
                    "Snapshot field 'config." + participant + ".apiKey' is required");
        }
    }

    private static void requireText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.textValue().isBlank()) {
            throw new IllegalArgumentException("Snapshot missing textual field '" + field + "'");
        }
    }

    private static boolean hasText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() && !value.textValue().isBlank();
    }
}
