package com.tony.gridironSim.model.sim;

import java.util.List;

public record SimulationTrial(
        int index,
        int homeScore,
        int awayScore,
        TeamTrialStats home,
        TeamTrialStats away,
        boolean overtime,
        boolean divergent,
        List<DriveLogEntry> driveLog
) {
    public int margin() {
        return homeScore - awayScore;
    }

    public int total() {
        return homeScore + awayScore;
    }
}
