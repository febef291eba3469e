package com.tony.gridironSim.calibration;

/**
 * Transforme un z-score (simulé - ligne) / écart-type simulé en probabilité calibrée.
 */
public interface ProbabilityCalibrator {

    double probability(double z);

    CalibrationMethod method();
}
