package com.tony.gridironSim.model.dto;

import com.tony.gridironSim.model.CalibrationRecord;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class CalibrationResult {
    int season;
    int asOfWeek;

    // Vrai si la semaine avait déjà été calibrée : on renvoie les lignes existantes
    boolean alreadyCalibrated;

    @Singular("calibrationRecord") List<CalibrationRecord> records;
    @Singular Map<String, CalibrationOutcome> teamOutcomes;

    public long skippedTeams() {
        return teamOutcomes.values().stream()
                .filter(o -> o == CalibrationOutcome.SKIPPED_INSUFFICIENT_HISTORY)
                .count();
    }
}
