package com.tony.gridironSim.config;

import com.tony.gridironSim.model.CalibrationMetric;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Réglages figés d'une passe de calibration.
 */
@Value
@Builder(toBuilder = true)
public class CalibrationSettings {

    @Builder.Default double damping = 0.5;
    @Builder.Default double materialityZ = 1.5;
    @Builder.Default int windowWeeks = 4;
    @Builder.Default int minHistoryWeeks = 3;
    @Singular("clamp") Map<CalibrationMetric, Double> clamps;

    /** Borne absolue de la correction active pour une métrique. */
    public double clampFor(CalibrationMetric metric) {
        Double bound = clamps.get(metric);
        return bound != null ? bound : metric.getDefaultClamp();
    }

    public double clamp(CalibrationMetric metric, double correction) {
        double bound = clampFor(metric);
        return Math.max(-bound, Math.min(bound, correction));
    }

    public static CalibrationSettings defaults() {
        return CalibrationSettings.builder().build();
    }
}
