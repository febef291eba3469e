package com.tony.gridironSim.model.sim;

public enum DrivePhase {
    OPEN_FIELD,
    RED_ZONE,    // dans les 20 adverses
    GOAL_LINE,   // dans les 5 adverses
    TWO_MINUTE;  // 2 dernières minutes d'une mi-temps, hors zone rouge

    public static DrivePhase of(GameState state, int twoMinuteSeconds) {
        if (state.getYardline() >= 95) return GOAL_LINE;
        if (state.getYardline() >= 80) return RED_ZONE;
        if (state.isTwoMinute(twoMinuteSeconds)) return TWO_MINUTE;
        return OPEN_FIELD;
    }
}
