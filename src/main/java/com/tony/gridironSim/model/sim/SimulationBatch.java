package com.tony.gridironSim.model.sim;

import lombok.Builder;
import lombok.Value;

/**
 * Agrégat d'un batch Monte Carlo. Les probabilités liées au marché sont nulles
 * quand aucune ligne n'a été fournie.
 */
@Value
@Builder
public class SimulationBatch {

    long batchSeed;

    int requestedTrials;
    int completedTrials;
    int discardedTrials;
    int survivingTrials;

    // --- Scores ---
    double homeScoreMean;
    double homeScoreMedian;
    double homeScoreVariance;
    double awayScoreMean;
    double awayScoreMedian;
    double awayScoreVariance;

    double marginMean;
    double marginMedian;
    double marginStdDev;
    double totalMean;
    double totalMedian;
    double totalStdDev;

    // --- Issue ---
    double homeWinProbability;
    double awayWinProbability;
    double tieProbability;
    double overtimeRate;

    // --- Marché ---
    Double spread;
    Double homeCoverProbability;
    Double awayCoverProbability;
    Double spreadPushProbability;

    Double total;
    Double overProbability;
    Double underProbability;
    Double totalPushProbability;
    // Probabilités lues sur la distribution recalée sur les lignes
    boolean marketCentered;

    // --- Efficacité simulée ---
    double homeEpaPerPlay;
    double awayEpaPerPlay;
    double homePressureRate;
    double awayPressureRate;

    ConvictionTier conviction;

    // --- Dégradations ---
    boolean truncated;
    boolean insufficientSample;
    boolean unreliable;

    public boolean isDegraded() {
        return truncated || insufficientSample || unreliable;
    }

    public double discardRate() {
        return completedTrials == 0 ? 0.0 : (double) discardedTrials / completedTrials;
    }
}
