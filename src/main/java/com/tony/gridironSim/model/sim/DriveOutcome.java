package com.tony.gridironSim.model.sim;

public enum DriveOutcome {
    TOUCHDOWN,
    FIELD_GOAL_MADE,
    FIELD_GOAL_MISSED,
    PUNT,
    TURNOVER,
    TURNOVER_ON_DOWNS,
    SAFETY,
    END_OF_HALF;

    public boolean isScore() {
        return this == TOUCHDOWN || this == FIELD_GOAL_MADE;
    }
}
