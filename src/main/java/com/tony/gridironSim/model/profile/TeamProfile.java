package com.tony.gridironSim.model.profile;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.util.OptionalDouble;

/**
 * Photo figée d'une équipe à une semaine donnée : tout ce dont le moteur a besoin,
 * déjà lissé vers la moyenne ligue et corrigé par la calibration.
 * Immuable : partagée sans risque entre tous les essais d'un batch.
 */
@Getter
@SuperBuilder(toBuilder = true)
public abstract class TeamProfile {

    private final String teamCode;
    private final int season;
    private final int week;
    private final int gamesPlayed;

    // --- Efficacité ---
    @Builder.Default private final double offEpaPerPlay = LeagueBaseline.EPA_PER_PLAY;
    @Builder.Default private final double defEpaPerPlay = LeagueBaseline.EPA_PER_PLAY;
    @Builder.Default private final double offSuccessRate = LeagueBaseline.SUCCESS_RATE;
    @Builder.Default private final double defSuccessRate = LeagueBaseline.SUCCESS_RATE;
    @Builder.Default private final double rushSuccessRate = LeagueBaseline.RUSH_SUCCESS_RATE;

    // --- Passe / Course ---
    @Builder.Default private final double completionRate = LeagueBaseline.COMPLETION_RATE;
    @Builder.Default private final double yardsPerCompletion = LeagueBaseline.YARDS_PER_COMPLETION;
    @Builder.Default private final double yardsPerCarry = LeagueBaseline.YARDS_PER_CARRY;
    @Builder.Default private final double explosivePassRate = LeagueBaseline.EXPLOSIVE_PASS_RATE;
    @Builder.Default private final double interceptionRate = LeagueBaseline.INTERCEPTION_RATE;
    @Builder.Default private final double fumbleRate = LeagueBaseline.FUMBLE_RATE;

    // --- Pression ---
    @Builder.Default private final double pressureRateAllowed = LeagueBaseline.PRESSURE_RATE;
    @Builder.Default private final double pressureRateGenerated = LeagueBaseline.PRESSURE_RATE;

    // --- Situations ---
    @Builder.Default private final double redZoneTdRate = LeagueBaseline.RED_ZONE_TD_RATE;
    @Builder.Default private final double goalLineTdRate = LeagueBaseline.GOAL_LINE_TD_RATE;
    @Builder.Default private final double fourthDownAggressiveness = LeagueBaseline.FOURTH_DOWN_AGGRESSIVENESS;

    // --- Équipes spéciales ---
    @Builder.Default private final double fieldGoalPct = LeagueBaseline.FIELD_GOAL_PCT;
    @Builder.Default private final double netPuntAverage = LeagueBaseline.NET_PUNT_AVERAGE;
    @Builder.Default private final double kickReturnStart = LeagueBaseline.KICK_RETURN_START;

    // --- Rythme ---
    @Builder.Default private final double secondsPerPlay = LeagueBaseline.SECONDS_PER_PLAY;
    @Builder.Default private final double neutralPassRate = LeagueBaseline.NEUTRAL_PASS_RATE;

    @Builder.Default private final SituationalOverrides overrides = SituationalOverrides.NONE;
    @Builder.Default private final CorrectionSnapshot corrections = CorrectionSnapshot.EMPTY;

    public abstract boolean hasAdvancedGrades();

    public abstract OptionalDouble grade(GradeUnit unit);

    /**
     * Force de la ligne offensive en écarts-types autour de la moyenne (0 = ligue).
     */
    public abstract double lineStrength();

    public ProfileMode mode() {
        return hasAdvancedGrades() ? ProfileMode.GRADED : ProfileMode.PROXY;
    }

    public double efficiencyMultiplier() {
        return overrides.efficiencyMultiplier();
    }

    public double passEfficiencyMultiplier() {
        return overrides.passMultiplier();
    }

    public double explosiveMultiplier() {
        return overrides.explosiveMultiplier();
    }
}
