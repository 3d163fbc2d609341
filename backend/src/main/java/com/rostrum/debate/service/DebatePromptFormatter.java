package com.rostrum.debate.service;

import com.rostrum.debate.model.DebateSide;
import com.rostrum.debate.model.DebateTurn;
import org.springframework.util.StringUtils;

import java.util.List;

final class DebatePromptFormatter {

    private DebatePromptFormatter() {
    }

    static String transcript(List<DebateTurn> messages) {
        if (messages.isEmpty()) {
            return "(no speeches yet)";
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < messages.size(); i++) {
            DebateTurn turn = messages.get(i);
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append("[Round ")
                    .append(i / 2 + 1)
                    .append("] ")
                    .append(sideLabel(turn.side()))
                    .append(": ")
                    .append(turn.text());
        }
        return builder.toString();
    }

    static String background(String background) {
        return StringUtils.hasText(background) ? background.trim() : "(none provided)";
    }

    static String sideLabel(DebateSide side) {
        return side == DebateSide.PRO ? "Pro" : "Con";
    }
}
