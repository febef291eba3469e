package com.tony.gridironSim.service;

import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.model.profile.GradeUnit;
import com.tony.gridironSim.model.profile.MatchupContext;
import com.tony.gridironSim.model.profile.TeamProfile;
import org.springframework.stereotype.Component;

/**
 * Confronte les notes d'unités d'une attaque à celles d'une défense.
 */
@Component
public class MatchupResolver {

    public MatchupContext resolve(TeamProfile offense, TeamProfile defense, EngineConfig config) {
        // Sans notes des deux côtés, aucun écart : le moteur s'appuie sur l'efficacité seule
        if (!offense.hasAdvancedGrades() || !defense.hasAdvancedGrades()) {
            return MatchupContext.NEUTRAL;
        }
        double max = config.getMaxMismatch();
        return new MatchupContext(
                mismatch(offense, GradeUnit.PASS_BLOCK, defense, GradeUnit.PASS_RUSH, max),
                mismatch(offense, GradeUnit.RECEIVING, defense, GradeUnit.COVERAGE, max),
                mismatch(offense, GradeUnit.RUN_BLOCK, defense, GradeUnit.RUN_DEFENSE, max));
    }

    private double mismatch(TeamProfile offense, GradeUnit offenseUnit,
                            TeamProfile defense, GradeUnit defenseUnit, double max) {
        double diff = offense.grade(offenseUnit).orElse(0.0) - defense.grade(defenseUnit).orElse(0.0);
        return Math.max(-max, Math.min(max, diff));
    }
}
