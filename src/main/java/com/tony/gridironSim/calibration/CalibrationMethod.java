package com.tony.gridironSim.calibration;

public enum CalibrationMethod {
    PLATT,      // logistique sur le z-score
    ISOTONIC    // monotone, sans forme imposée
}
