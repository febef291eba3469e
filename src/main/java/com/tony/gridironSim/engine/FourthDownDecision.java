package com.tony.gridironSim.engine;

public record FourthDownDecision(
        FourthDownChoice choice,
        double goValue,
        double fieldGoalValue,
        double puntValue,
        boolean desperation
) {
}
