package com.tony.gridironSim.engine;

import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.model.profile.LeagueBaseline;
import com.tony.gridironSim.model.profile.MatchupContext;
import com.tony.gridironSim.model.profile.TeamProfile;
import com.tony.gridironSim.model.sim.DrivePhase;
import com.tony.gridironSim.model.sim.GameState;
import com.tony.gridironSim.model.sim.PlayResult;
import com.tony.gridironSim.model.sim.PlayType;

import java.util.SplittableRandom;

/**
 * Simule une action de mêlée (course ou passe).
 */
public class PlaySimulator {

    // Répartition des issues sous pression
    static final double SCRAMBLE_SHARE = 0.18;
    static final double THROWAWAY_SHARE = 0.10;
    static final double SACK_SHARE = 0.28;
    private static final double STRIP_SACK_RATE = 0.10;

    private static final double INT_UNDER_PRESSURE = 0.035;
    private static final double INT_CLEAN = 0.015;
    private static final double PRESSURED_COMPLETION_FACTOR = 0.75;
    private static final double MAX_COVERAGE_SHIFT = 0.08;

    private static final double YARDS_PER_EPA = 8.0;
    private static final double RUN_SD = 3.5;
    private static final double LINE_STRENGTH_YARDS = 0.4;
    private static final double EXPLOSIVE_RUN_RATE = 0.03;

    private static final int STOPPED_CLOCK_SECONDS = 7;

    private final EngineConfig config;
    private final ScoringZoneModel scoringZone;

    public PlaySimulator(EngineConfig config, ScoringZoneModel scoringZone) {
        this.config = config;
        this.scoringZone = scoringZone;
    }

    PlayOutcome simulate(GameState state, TeamProfile offense, TeamProfile defense,
                         MatchupContext matchup, SplittableRandom rng) {
        boolean pass = Distributions.bernoulli(rng, passRate(state, offense));
        int yardline = state.getYardline();

        PlayOutcome outcome = pass
                ? passPlay(state, offense, defense, matchup, rng)
                : runPlay(state, offense, defense, matchup, rng);

        if (outcome.result().isTurnover()) {
            return outcome;
        }
        DrivePhase phase = DrivePhase.of(state, config.getTwoMinuteSeconds());
        if (phase == DrivePhase.RED_ZONE || phase == DrivePhase.GOAL_LINE) {
            // Zone rouge / goal line : le touchdown est tiré directement, pas déduit des yards
            boolean scoringChance = outcome.result() != PlayResult.SACK && outcome.result() != PlayResult.THROWAWAY;
            if (scoringChance && Distributions.bernoulli(rng, scoringZone.touchdownProbability(yardline, offense, defense))) {
                return outcome.withYards(100 - yardline).withResult(PlayResult.TOUCHDOWN);
            }
            if (yardline + outcome.yards() >= 100) {
                return outcome.withYards(99 - yardline);
            }
        } else if (yardline + outcome.yards() >= 100) {
            return outcome.withYards(100 - yardline).withResult(PlayResult.TOUCHDOWN);
        }
        if (yardline + outcome.yards() <= 0) {
            return outcome.withResult(PlayResult.SAFETY);
        }
        return outcome;
    }

    /**
     * Probabilité de passe selon l'essai, la distance, le score et l'horloge.
     */
    public double passRate(GameState state, TeamProfile offense) {
        double rate = offense.getNeutralPassRate();
        int down = state.getDown();
        int toGo = state.getToGo();

        if (down == 1) rate -= 0.05;
        else if (down == 2 && toGo >= 8) rate += 0.08;
        else if (down >= 3) rate = toGo >= 5 ? 0.85 : toGo <= 2 ? 0.45 : 0.65;

        int lead = state.offenseLead();
        boolean secondHalf = state.getQuarter() >= 3;
        if (lead >= config.getScriptThreshold() && secondHalf) rate -= 0.20;      // gestion du chrono
        else if (lead <= -config.getScriptThreshold()) rate += 0.20;              // hurry-up

        if (state.isTwoMinute(config.getTwoMinuteSeconds())) {
            if (lead <= 0) rate = Math.max(rate, 0.80);
            else if (state.getQuarter() >= 4) rate = Math.min(rate, 0.25);
        }
        if (state.getYardline() >= 95) rate -= 0.10;

        return Distributions.clamp(rate, 0.05, 0.95);
    }

    /**
     * Probabilité de pression sur un dropback.
     */
    public double pressureProbability(TeamProfile offense, TeamProfile defense, MatchupContext matchup) {
        double base = config.getBasePressureRate();
        double mismatch = Distributions.clamp(matchup.passProtection(), -config.getMaxMismatch(), config.getMaxMismatch());
        double p = base
                + 0.5 * (offense.getPressureRateAllowed() - base)
                + 0.5 * (defense.getPressureRateGenerated() - base)
                - config.getPressureBeta() * mismatch;
        return Distributions.clamp(p, 0.05, 0.55);
    }

    double completionProbability(TeamProfile offense, TeamProfile defense, MatchupContext matchup) {
        double coverageShift = Distributions.clamp(config.getCoverageBeta() * matchup.coverage(),
                -MAX_COVERAGE_SHIFT, MAX_COVERAGE_SHIFT);
        double p = offense.getCompletionRate() * offense.passEfficiencyMultiplier()
                + coverageShift
                + 0.3 * efficiencyEdge(offense, defense);
        return Distributions.clamp(p, 0.20, 0.85);
    }

    private PlayOutcome passPlay(GameState state, TeamProfile offense, TeamProfile defense,
                                 MatchupContext matchup, SplittableRandom rng) {
        int yardline = state.getYardline();
        boolean pressured = Distributions.bernoulli(rng, pressureProbability(offense, defense, matchup));
        double intScale = offense.getInterceptionRate() / LeagueBaseline.INTERCEPTION_RATE;

        double completion = completionProbability(offense, defense, matchup);
        double intRate = INT_CLEAN * intScale;

        if (pressured) {
            double r = rng.nextDouble();
            if (r < SCRAMBLE_SHARE) {
                int yards = (int) Math.round(Math.max(-2, Distributions.normal(rng, 4.0, 4.0)));
                return new PlayOutcome(PlayType.PASS, PlayResult.SCRAMBLE, yards, true,
                        playSeconds(state, offense, rng, false), false, 0);
            }
            if (r < SCRAMBLE_SHARE + THROWAWAY_SHARE) {
                return new PlayOutcome(PlayType.PASS, PlayResult.THROWAWAY, 0, true,
                        STOPPED_CLOCK_SECONDS, true, 0);
            }
            if (r < SCRAMBLE_SHARE + THROWAWAY_SHARE + SACK_SHARE) {
                int loss = (int) Math.round(Distributions.clamp(Distributions.normal(rng, 7.0, 2.5), 1.0, 15.0));
                if (Distributions.bernoulli(rng, STRIP_SACK_RATE)) {
                    return new PlayOutcome(PlayType.PASS, PlayResult.FUMBLE, -loss, true,
                            STOPPED_CLOCK_SECONDS, true, Math.max(1, yardline - loss));
                }
                return new PlayOutcome(PlayType.PASS, PlayResult.SACK, -loss, true,
                        playSeconds(state, offense, rng, false), false, 0);
            }
            // Passe lancée sous pression
            completion *= PRESSURED_COMPLETION_FACTOR;
            intRate = INT_UNDER_PRESSURE * intScale;
        }

        if (Distributions.bernoulli(rng, intRate)) {
            int spot = yardline + (int) Math.round(Distributions.clamp(Distributions.normal(rng, 12.0, 7.0), 0.0, 50.0));
            return new PlayOutcome(PlayType.PASS, PlayResult.INTERCEPTION, 0, pressured,
                    STOPPED_CLOCK_SECONDS, true, spot);
        }
        if (!Distributions.bernoulli(rng, completion)) {
            return new PlayOutcome(PlayType.PASS, PlayResult.INCOMPLETE, 0, pressured,
                    STOPPED_CLOCK_SECONDS, true, 0);
        }

        double explosiveShare = Distributions.clamp(
                offense.getExplosivePassRate() * offense.explosiveMultiplier() / offense.getCompletionRate(), 0.02, 0.40);
        double yards;
        if (Distributions.bernoulli(rng, explosiveShare)) {
            yards = 20.0 + Distributions.logNormal(rng, 8.0, 0.7);
        } else {
            double mean = Math.max(3.0, offense.getYardsPerCompletion() * 0.75
                    + YARDS_PER_EPA * efficiencyEdge(offense, defense));
            yards = Distributions.gamma2(rng, mean);
        }
        return new PlayOutcome(PlayType.PASS, PlayResult.GAIN, (int) Math.round(yards), pressured,
                playSeconds(state, offense, rng, false), false, 0);
    }

    private PlayOutcome runPlay(GameState state, TeamProfile offense, TeamProfile defense,
                                MatchupContext matchup, SplittableRandom rng) {
        double lineShift = offense.hasAdvancedGrades() && defense.hasAdvancedGrades()
                ? config.getRunBlockBeta() * matchup.runBlock()
                : LINE_STRENGTH_YARDS * Distributions.clamp(offense.lineStrength(), -2.5, 2.5);
        double mean = offense.getYardsPerCarry() * offense.efficiencyMultiplier()
                + 0.5 * YARDS_PER_EPA * efficiencyEdge(offense, defense)
                + lineShift;

        double yards = Distributions.normal(rng, mean, RUN_SD);
        if (Distributions.bernoulli(rng, EXPLOSIVE_RUN_RATE)) {
            yards += Distributions.logNormal(rng, 12.0, 0.6);
        }
        int gained = (int) Math.round(Math.max(-5.0, yards));

        if (Distributions.bernoulli(rng, offense.getFumbleRate())) {
            return new PlayOutcome(PlayType.RUN, PlayResult.FUMBLE, gained, false,
                    STOPPED_CLOCK_SECONDS, true, Distributions.clamp(state.getYardline() + gained, 1, 99));
        }
        return new PlayOutcome(PlayType.RUN, PlayResult.GAIN, gained, false,
                playSeconds(state, offense, rng, false), false, 0);
    }

    /**
     * Écart d'efficacité attaque/défense en EPA par action (positif = avantage attaque).
     */
    double efficiencyEdge(TeamProfile offense, TeamProfile defense) {
        return (offense.getOffEpaPerPlay() - LeagueBaseline.EPA_PER_PLAY)
                + (defense.getDefEpaPerPlay() - LeagueBaseline.EPA_PER_PLAY);
    }

    int playSeconds(GameState state, TeamProfile offense, SplittableRandom rng, boolean clockStops) {
        if (clockStops) return STOPPED_CLOCK_SECONDS;
        double pace = offense.getSecondsPerPlay() * 1.1;
        int lead = state.offenseLead();
        if (state.isTwoMinute(config.getTwoMinuteSeconds()) && lead <= 0) {
            pace = 18.0;                                   // no-huddle
        } else if (lead <= -config.getScriptThreshold()) {
            pace *= 0.8;
        } else if (lead >= config.getScriptThreshold() && state.getQuarter() >= 3) {
            pace *= 1.25;                                  // on fait tourner l'horloge
        }
        return (int) Math.round(Distributions.clamp(Distributions.normal(rng, pace, 4.0), 5.0, 45.0));
    }
}
