package com.tony.gridironSim.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CalibrationMetric {
    POINTS_SCORED(2.0),
    POINTS_ALLOWED(2.0),
    OFFENSE_EPA(0.05),
    PRESSURE_RATE(0.04);

    // Borne absolue par défaut de la correction active
    private final double defaultClamp;
}
