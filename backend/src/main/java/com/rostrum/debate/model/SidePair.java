package com.rostrum.debate.model;

/**
 * A value held once for each side of the debate.
 */
public record SidePair<T>(
        T pro,
        T con
) {
    public T get(DebateSide side) {
        return side == DebateSide.PRO ? pro : con;
    }

    public static <T> SidePair<T> of(T pro, T con) {
        return new SidePair<>(pro, con);
    }
}
