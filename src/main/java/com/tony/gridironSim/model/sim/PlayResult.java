package com.tony.gridironSim.model.sim;

public enum PlayResult {
    GAIN,
    INCOMPLETE,
    SCRAMBLE,
    THROWAWAY,
    SACK,
    INTERCEPTION,
    FUMBLE,
    TOUCHDOWN,
    SAFETY,
    FIELD_GOAL_GOOD,
    FIELD_GOAL_MISSED,
    PUNT;

    public boolean isTurnover() {
        return this == INTERCEPTION || this == FUMBLE;
    }
}
