package com.tony.gridironSim.model.profile;

import lombok.Builder;
import lombok.Value;

/**
 * Facteurs de contexte fournis par les collaborateurs (météo, repos, blessures clés).
 */
@Value
@Builder
public class SituationalOverrides {

    public static final SituationalOverrides NONE = SituationalOverrides.builder().build();

    // Une blessure de sévérité 1.0 (QB titulaire) coûte 25% d'efficacité
    private static final double MAX_INJURY_PENALTY = 0.25;

    @Builder.Default WeatherSeverity weather = WeatherSeverity.NONE;
    @Builder.Default RestCondition rest = RestCondition.NORMAL;
    @Builder.Default double injurySeverity = 0.0;

    public double efficiencyMultiplier() {
        return rest.getEfficiencyMultiplier() * (1.0 - MAX_INJURY_PENALTY * injurySeverity);
    }

    public double passMultiplier() {
        return efficiencyMultiplier() * weather.getPassMultiplier();
    }

    public double explosiveMultiplier() {
        return weather.getExplosiveMultiplier();
    }
}
