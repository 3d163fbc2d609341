package com.rostrum.debate.dto;

import com.rostrum.debate.model.DebateConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public final class DebateRequests {

    private DebateRequests() {
    }

    public record CreateDebateRequest(
            @NotBlank(message = "topic is required")
            @Size(max = 2000, message = "topic must be at most 2000 characters")
            String topic,

            @Size(max = 10000, message = "background must be at most 10000 characters")
            String background,

            @NotBlank(message = "proApiKey is required")
            String proApiKey,

            @NotBlank(message = "conApiKey is required")
            String conApiKey,

            @NotNull(message = "judges are required")
            @Size(
                    min = DebateConfig.PANEL_SIZE,
                    max = DebateConfig.PANEL_SIZE,
                    message = "exactly 6 judges are required"
            )
            List<@Valid @NotNull(message = "judge entries must not be null") JudgeEntry> judges,

            @NotNull(message = "maxRounds is required")
            @Min(value = DebateConfig.MIN_ROUNDS, message = "maxRounds must be at least 1")
            @Max(value = DebateConfig.MAX_ROUNDS, message = "maxRounds must be at most 50")
            Integer maxRounds
    ) {
        @Override
        public String toString() {
            return "CreateDebateRequest[topic=" + topic + ", judges="
                    + (judges == null ? 0 : judges.size()) + ", maxRounds=" + maxRounds + "]";
        }
    }

    public record JudgeEntry(
            @NotBlank(message = "judge name is required")
            String name,

            @NotBlank(message = "judge apiKey is required")
            String apiKey
    ) {
        @Override
        public String toString() {
            return "JudgeEntry[name=" + name + ", apiKey=***]";
        }
    }
}
