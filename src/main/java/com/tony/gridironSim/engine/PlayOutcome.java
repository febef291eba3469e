package com.tony.gridironSim.engine;

import com.tony.gridironSim.model.sim.PlayResult;
import com.tony.gridironSim.model.sim.PlayType;

/**
 * Résultat brut d'une action de mêlée, avant application au GameState.
 * {@code turnoverSpot} : position (repère attaque) où la défense récupère le ballon.
 */
record PlayOutcome(
        PlayType type,
        PlayResult result,
        int yards,
        boolean pressured,
        int seconds,
        boolean clockStops,
        int turnoverSpot
) {
    PlayOutcome withYards(int newYards) {
        return new PlayOutcome(type, result, newYards, pressured, seconds, clockStops, turnoverSpot);
    }

    PlayOutcome withResult(PlayResult newResult) {
        return new PlayOutcome(type, newResult, yards, pressured, seconds, clockStops, turnoverSpot);
    }
}
