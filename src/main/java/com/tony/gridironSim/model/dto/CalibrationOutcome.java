package com.tony.gridironSim.model.dto;

public enum CalibrationOutcome {
    CALIBRATED,
    SKIPPED_INSUFFICIENT_HISTORY
}
