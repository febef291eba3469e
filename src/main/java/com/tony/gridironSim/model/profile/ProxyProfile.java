package com.tony.gridironSim.model.profile;

import lombok.experimental.SuperBuilder;

import java.util.OptionalDouble;

/**
 * Profil sans notes avancées : le taux de réussite au sol sert de proxy de la ligne.
 */
@SuperBuilder(toBuilder = true)
public class ProxyProfile extends TeamProfile {

    private static final double RUSH_SUCCESS_SD = 0.04;

    @Override
    public boolean hasAdvancedGrades() {
        return false;
    }

    @Override
    public OptionalDouble grade(GradeUnit unit) {
        return OptionalDouble.empty();
    }

    @Override
    public double lineStrength() {
        return (getRushSuccessRate() - LeagueBaseline.RUSH_SUCCESS_RATE) / RUSH_SUCCESS_SD;
    }
}
