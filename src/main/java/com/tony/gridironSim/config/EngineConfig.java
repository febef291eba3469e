package com.tony.gridironSim.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Paramètres figés du moteur de simulation.
 * Passé explicitement à la construction des profils et à chaque batch :
 * deux saisons peuvent tourner en parallèle avec des réglages différents.
 */
@Value
@Builder(toBuilder = true)
public class EngineConfig {

    // --- Matchup (lignes OL/DL, couverture) ---
    @Builder.Default double basePressureRate = 0.212;
    @Builder.Default double pressureBeta = 0.004;      // par point de grade
    @Builder.Default double coverageBeta = 0.002;      // complétion par point de grade
    @Builder.Default double runBlockBeta = 0.05;       // yards par point de grade
    @Builder.Default double maxMismatch = 25.0;

    // --- Garde-fous ---
    @Builder.Default int maxPlaysPerDrive = 40;
    @Builder.Default int maxDrivesPerGame = 60;

    // --- Contexte de match ---
    @Builder.Default double homeFieldPoints = 1.5;
    @Builder.Default int scriptThreshold = 14;
    @Builder.Default int twoMinuteSeconds = 120;
    @Builder.Default double aggressivenessWeight = 0.35;
    @Builder.Default int maxFieldGoalDistance = 63;

    // --- Priors ligue (Empirical Bayes) ---
    @Builder.Default double priorGames = 4.0;
    @Builder.Default double playsPerGame = 62.0;

    // --- Monte Carlo ---
    @Builder.Default int trials = 10_000;
    @Builder.Default int minSurvivingTrials = 1_000;
    @Builder.Default double maxDiscardRate = 0.02;
    Duration wallClockBudget;

    // --- Conviction (cote -110) ---
    @Builder.Default double breakEvenProbability = 0.5238;
    @Builder.Default double highPointEdge = 3.0;
    @Builder.Default double mediumPointEdge = 1.5;
    @Builder.Default double highProbabilityEdge = 0.06;
    @Builder.Default double mediumProbabilityEdge = 0.03;

    // --- Centrage marché : moyennes recalées sur les lignes, forme conservée ---
    @Builder.Default boolean marketCentering = false;
    @Builder.Default double centeringAlpha = 1.0;      // 1 = ligne du marché, 0 = simulation brute
    @Builder.Default double centeringMinScale = 0.5;
    @Builder.Default double centeringMaxScale = 2.0;

    public static EngineConfig defaults() {
        return EngineConfig.builder().build();
    }
}
