package com.tony.gridironSim.engine;

import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.model.profile.LeagueBaseline;
import com.tony.gridironSim.model.profile.TeamProfile;

import java.util.SplittableRandom;

/**
 * Équipes spéciales en événements discrets : pas de simulation action par action.
 */
public class SpecialTeamsSimulator {

    static final int TOUCHBACK_KICKOFF = 25;
    static final int TOUCHBACK_PUNT = 20;
    static final int MISSED_FIELD_GOAL_MIN_START = 20;

    private static final double KICKOFF_TOUCHBACK_RATE = 0.60;
    private static final double KICK_RETURN_TD_RATE = 0.003;
    private static final double EXTRA_POINT_RATE = 0.94;
    private static final double TWO_POINT_RATE = 0.48;

    private final EngineConfig config;

    public SpecialTeamsSimulator(EngineConfig config) {
        this.config = config;
    }

    public record KickoffResult(int startYardline, boolean returnTouchdown) {
    }

    public KickoffResult kickoff(TeamProfile receiver, SplittableRandom rng) {
        if (Distributions.bernoulli(rng, KICK_RETURN_TD_RATE)) {
            return new KickoffResult(100, true);
        }
        if (Distributions.bernoulli(rng, KICKOFF_TOUCHBACK_RATE)) {
            return new KickoffResult(TOUCHBACK_KICKOFF, false);
        }
        int start = (int) Math.round(Distributions.normal(rng, receiver.getKickReturnStart(), 6.0));
        return new KickoffResult(Distributions.clamp(start, 5, 50), false);
    }

    /** Coup de pied libre après un safety. */
    public int freeKickStart(SplittableRandom rng) {
        return Distributions.clamp((int) Math.round(Distributions.normal(rng, 35.0, 6.0)), 15, 60);
    }

    /**
     * Départ de l'adversaire (son propre repère) après un punt depuis {@code yardline}.
     */
    public int punt(int yardline, TeamProfile punter, SplittableRandom rng) {
        int net;
        if (yardline + 45 >= 100) {
            // Touchback probable : le punt ne rapporte que jusqu'aux 20 adverses
            net = Math.max(0, (100 - yardline) - TOUCHBACK_PUNT);
        } else {
            net = Distributions.clamp((int) Math.round(Distributions.normal(rng, punter.getNetPuntAverage(), 5.0)), 15, 60);
        }
        int landing = yardline + net;
        return landing >= 100 ? TOUCHBACK_PUNT : 100 - landing;
    }

    public static int fieldGoalDistance(int yardline) {
        return (100 - yardline) + 17;
    }

    public boolean inFieldGoalRange(int yardline) {
        return fieldGoalDistance(yardline) <= config.getMaxFieldGoalDistance();
    }

    public double makeProbability(int distance, TeamProfile kicker) {
        double base;
        if (distance < 30) base = 0.90;
        else if (distance < 40) base = 0.85;
        else if (distance < 50) base = 0.70;
        else base = 0.50;
        double adjusted = base + (kicker.getFieldGoalPct() - LeagueBaseline.FIELD_GOAL_PCT) * 0.3;
        return Distributions.clamp(adjusted, 0.05, 0.98);
    }

    public boolean fieldGoal(int yardline, TeamProfile kicker, SplittableRandom rng) {
        return Distributions.bernoulli(rng, makeProbability(fieldGoalDistance(yardline), kicker));
    }

    /** Départ adverse après un field goal manqué : au point du tir, jamais en deçà des 20. */
    public static int missedFieldGoalStart(int yardline) {
        return Math.max(MISSED_FIELD_GOAL_MIN_START, 107 - yardline);
    }

    /**
     * Transformation après touchdown. {@code leadAfterTouchdown} du point de vue de l'équipe qui a marqué.
     * On tente 2 points en fin de match quand l'écart l'exige (-2, -5, -10, +1, +5).
     */
    public int conversion(int leadAfterTouchdown, boolean lateGame, SplittableRandom rng) {
        boolean goForTwo = lateGame && switch (leadAfterTouchdown) {
            case -10, -5, -2, 1, 5 -> true;
            default -> false;
        };
        if (goForTwo) {
            return Distributions.bernoulli(rng, TWO_POINT_RATE) ? 2 : 0;
        }
        return Distributions.bernoulli(rng, EXTRA_POINT_RATE) ? 1 : 0;
    }
}
