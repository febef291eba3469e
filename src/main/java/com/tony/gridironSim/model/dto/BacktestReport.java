package com.tony.gridironSim.model.dto;

import com.tony.gridironSim.calibration.CalibrationMethod;
import com.tony.gridironSim.model.sim.ConvictionTier;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class BacktestReport {
    int season;
    int fromWeek;
    int toWeek;

    int gamesEvaluated;
    int gamesSkipped;

    // --- Précision ---
    double marginMae;
    double totalMae;
    double brierScore;          // sur la proba de victoire domicile
    double winnerAccuracy;

    // --- Paris ---
    int spreadBets;
    int totalBets;
    int wins;
    int losses;
    int pushes;
    double atsWinRate;          // paris écart, hors pushes
    double unitsProfit;         // cote -110
    double clvRate;             // part des paris meilleurs que la clôture

    // Taux de réussite des paris par niveau de conviction (hors pushes)
    Map<ConvictionTier, Double> accuracyByTier;

    // --- Calibration des probabilités (semaines antérieures uniquement) ---
    CalibrationMethod calibrationMethod;
    int calibratedSpreadGames;
    double rawCoverBrier;
    double calibratedCoverBrier;
    int calibratedTotalGames;
    double rawOverBrier;
    double calibratedOverBrier;
}
