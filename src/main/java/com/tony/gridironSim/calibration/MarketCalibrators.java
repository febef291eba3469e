package com.tony.gridironSim.calibration;

/**
 * Calibrateurs ajustés pour une semaine ; {@code null} quand l'historique est trop court.
 */
public record MarketCalibrators(ProbabilityCalibrator spread, ProbabilityCalibrator total) {

    public static final MarketCalibrators NONE = new MarketCalibrators(null, null);
}
