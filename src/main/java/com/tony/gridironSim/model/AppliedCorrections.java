package com.tony.gridironSim.model;

import com.tony.gridironSim.model.profile.CorrectionSnapshot;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Corrections de calibration réellement injectées dans le profil d'une équipe
 * au moment de la simulation d'un match.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppliedCorrections {
    private double pointsScored;
    private double pointsAllowed;
    private double offenseEpa;
    private double pressureRate;
    private int sourceWeek;

    public static AppliedCorrections of(CorrectionSnapshot snapshot) {
        return AppliedCorrections.builder()
                .pointsScored(snapshot.get(CalibrationMetric.POINTS_SCORED))
                .pointsAllowed(snapshot.get(CalibrationMetric.POINTS_ALLOWED))
                .offenseEpa(snapshot.get(CalibrationMetric.OFFENSE_EPA))
                .pressureRate(snapshot.get(CalibrationMetric.PRESSURE_RATE))
                .sourceWeek(snapshot.sourceWeek())
                .build();
    }

    public double get(CalibrationMetric metric) {
        return switch (metric) {
            case POINTS_SCORED -> pointsScored;
            case POINTS_ALLOWED -> pointsAllowed;
            case OFFENSE_EPA -> offenseEpa;
            case PRESSURE_RATE -> pressureRate;
        };
    }
}
