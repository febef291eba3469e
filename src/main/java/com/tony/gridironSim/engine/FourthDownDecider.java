package com.tony.gridironSim.engine;

import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.model.profile.LeagueBaseline;
import com.tony.gridironSim.model.profile.TeamProfile;
import com.tony.gridironSim.model.sim.GameState;

/**
 * Décision au 4e essai : on compare les points attendus de GO, FIELD_GOAL et PUNT.
 */
public class FourthDownDecider {

    // Mené de plus d'un TD dans les 2 dernières minutes : on tente toujours
    private static final int DESPERATION_DEFICIT = 7;

    private final EngineConfig config;
    private final ExpectedPointsModel expectedPoints;
    private final SpecialTeamsSimulator specialTeams;
    private final ScoringZoneModel scoringZone;

    public FourthDownDecider(EngineConfig config, ExpectedPointsModel expectedPoints,
                             SpecialTeamsSimulator specialTeams, ScoringZoneModel scoringZone) {
        this.config = config;
        this.expectedPoints = expectedPoints;
        this.specialTeams = specialTeams;
        this.scoringZone = scoringZone;
    }

    public static double conversionProbability(int toGo) {
        if (toGo <= 1) return 0.70;
        if (toGo <= 3) return 0.55;
        if (toGo <= 5) return 0.40;
        return 0.20;
    }

    public FourthDownDecision decide(GameState state, TeamProfile offense, TeamProfile defense) {
        int yardline = state.getYardline();
        int toGo = state.getToGo();

        double goValue = goValue(yardline, toGo, offense, defense)
                + config.getAggressivenessWeight() * offense.getFourthDownAggressiveness();
        double fieldGoalValue = fieldGoalValue(yardline, offense);
        double puntValue = puntValue(yardline, offense);

        boolean desperation = state.getQuarter() >= 4
                && state.secondsLeftInHalf() <= config.getTwoMinuteSeconds()
                && state.offenseLead() < -DESPERATION_DEFICIT;
        if (desperation) {
            return new FourthDownDecision(FourthDownChoice.GO, goValue, fieldGoalValue, puntValue, true);
        }

        FourthDownChoice choice = FourthDownChoice.PUNT;
        double best = puntValue;
        if (fieldGoalValue > best) {
            choice = FourthDownChoice.FIELD_GOAL;
            best = fieldGoalValue;
        }
        if (goValue > best) {
            choice = FourthDownChoice.GO;
        }
        return new FourthDownDecision(choice, goValue, fieldGoalValue, puntValue, false);
    }

    double goValue(int yardline, int toGo, TeamProfile offense, TeamProfile defense) {
        double failure = expectedPoints.afterChangeOfPossession(100 - yardline);
        if (yardline + toGo >= 100) {
            double p = scoringZone.touchdownProbability(yardline, offense, defense);
            return p * ExpectedPointsModel.TOUCHDOWN_VALUE + (1 - p) * failure;
        }
        double p = conversionProbability(toGo)
                + 0.5 * (offense.getOffSuccessRate() - LeagueBaseline.SUCCESS_RATE)
                + 0.5 * (defense.getDefSuccessRate() - LeagueBaseline.SUCCESS_RATE);
        p = Distributions.clamp(p, 0.05, 0.95);
        double success = expectedPoints.value(yardline + toGo, 1, 10);
        return p * success + (1 - p) * failure;
    }

    double fieldGoalValue(int yardline, TeamProfile kicker) {
        if (!specialTeams.inFieldGoalRange(yardline)) {
            return Double.NEGATIVE_INFINITY;
        }
        double p = specialTeams.makeProbability(SpecialTeamsSimulator.fieldGoalDistance(yardline), kicker);
        double miss = expectedPoints.afterChangeOfPossession(SpecialTeamsSimulator.missedFieldGoalStart(yardline));
        return p * ExpectedPointsModel.FIELD_GOAL_VALUE + (1 - p) * miss;
    }

    double puntValue(int yardline, TeamProfile punter) {
        int opponentStart;
        if (yardline + 45 >= 100) {
            opponentStart = SpecialTeamsSimulator.TOUCHBACK_PUNT;
        } else {
            int landing = yardline + (int) Math.round(punter.getNetPuntAverage());
            opponentStart = landing >= 100 ? SpecialTeamsSimulator.TOUCHBACK_PUNT : 100 - landing;
        }
        return expectedPoints.afterChangeOfPossession(opponentStart);
    }
}
