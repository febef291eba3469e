package com.tony.gridironSim.model.sim;

public record TeamTrialStats(
        int points,
        int offensivePlays,
        int dropbacks,
        int pressures,
        int sacks,
        double offensiveEpa,
        int drives
) {
    public double epaPerPlay() {
        return offensivePlays == 0 ? 0.0 : offensiveEpa / offensivePlays;
    }

    public double pressureRate() {
        return dropbacks == 0 ? 0.0 : (double) pressures / dropbacks;
    }
}
