package com.tony.gridironSim.model.profile;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RestCondition {
    SHORT_WEEK(0.97),   // jeudi soir
    NORMAL(1.0),
    EXTRA_REST(1.02);   // après une semaine de bye

    private final double efficiencyMultiplier;
}
