package com.tony.gridironSim.model.sim;

public record PlayEvent(
        Possession offense,
        PlayType type,
        PlayResult result,
        int down,
        int toGo,
        int yardlineBefore,
        int yards,
        boolean pressured,
        double epa,
        int seconds
) {
    public boolean isDropback() {
        return type == PlayType.PASS;
    }

    public boolean isOffensivePlay() {
        return type == PlayType.RUN || type == PlayType.PASS;
    }
}
