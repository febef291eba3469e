package com.tony.gridironSim.model.sim;

/**
 * Trace d'un drive (mode debug uniquement).
 */
public record DriveLogEntry(
        int driveNumber,
        Possession offense,
        int quarter,
        int clockAtStart,
        int startYardline,
        DriveOutcome outcome,
        int plays,
        int homeScore,
        int awayScore,
        boolean capped
) {
}
