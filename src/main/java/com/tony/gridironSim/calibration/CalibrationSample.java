package com.tony.gridironSim.calibration;

/**
 * Un match passé : z-score simulé contre la ligne et issue réelle (1 = cover / over).
 */
public record CalibrationSample(double z, double outcome) {

    public CalibrationSample {
        if (outcome != 0.0 && outcome != 1.0) {
            throw new IllegalArgumentException("Issue binaire attendue : " + outcome);
        }
    }
}
