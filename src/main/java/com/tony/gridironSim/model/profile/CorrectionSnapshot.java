package com.tony.gridironSim.model.profile;

import com.tony.gridironSim.model.CalibrationMetric;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Corrections de calibration actives pour une équipe à une semaine donnée.
 */
public record CorrectionSnapshot(Map<CalibrationMetric, Double> corrections, int sourceWeek) {

    public static final CorrectionSnapshot EMPTY = new CorrectionSnapshot(Map.of(), 0);

    public CorrectionSnapshot {
        corrections = corrections.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(corrections));
    }

    public double get(CalibrationMetric metric) {
        return corrections.getOrDefault(metric, 0.0);
    }

    public boolean isEmpty() {
        return corrections.isEmpty();
    }
}
