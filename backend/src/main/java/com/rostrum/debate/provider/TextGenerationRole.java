package com.rostrum.debate.provider;

import com.rostrum.debate.model.DebateSide;

public enum TextGenerationRole {
    PRO("pro-debater"),
    CON("con-debater"),
    JUDGE("judge");

    private final String userTag;

    TextGenerationRole(String userTag) {
        this.userTag = userTag;
    }

    public String userTag() {
        return userTag;
    }

    public static TextGenerationRole forSide(DebateSide side) {
        return side == DebateSide.PRO ? PRO : CON;
    }
}
