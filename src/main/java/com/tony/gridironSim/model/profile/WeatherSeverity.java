package com.tony.gridironSim.model.profile;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum WeatherSeverity {
    NONE(1.0, 1.0),
    MODERATE(0.97, 0.85),   // vent 15+ mph ou pluie
    SEVERE(0.92, 0.70);     // vent 20+ mph, neige

    private final double passMultiplier;
    private final double explosiveMultiplier;
}
