package com.tony.gridironSim;

import com.tony.gridironSim.model.UnitGrades;
import com.tony.gridironSim.model.profile.GradedProfile;
import com.tony.gridironSim.model.profile.ProxyProfile;
import com.tony.gridironSim.model.profile.TeamProfile;

/**
 * Profils d'équipe prêts à l'emploi pour les tests (valeurs ligue par défaut).
 */
public final class ProfileFixtures {

    private ProfileFixtures() {
    }

    public static TeamProfile proxy(String teamCode) {
        return ProxyProfile.builder()
                .teamCode(teamCode).season(2024).week(6).gamesPlayed(5)
                .build();
    }

    public static TeamProfile graded(String teamCode, UnitGrades grades) {
        return GradedProfile.builder()
                .teamCode(teamCode).season(2024).week(6).gamesPlayed(5)
                .grades(grades)
                .build();
    }

    public static UnitGrades grades(double passBlock, double passRush, double runBlock,
                                    double runDefense, double receiving, double coverage) {
        return UnitGrades.builder()
                .passBlock(passBlock).passRush(passRush)
                .runBlock(runBlock).runDefense(runDefense)
                .receiving(receiving).coverage(coverage)
                .build();
    }

    public static UnitGrades uniformGrades(double value) {
        return grades(value, value, value, value, value, value);
    }
}
