package com.tony.gridironSim.engine;

import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.model.profile.MatchupContext;
import com.tony.gridironSim.model.profile.TeamProfile;
import com.tony.gridironSim.model.sim.DriveOutcome;
import com.tony.gridironSim.model.sim.DriveResult;
import com.tony.gridironSim.model.sim.GameState;
import com.tony.gridironSim.model.sim.PlayEvent;
import com.tony.gridironSim.model.sim.PlayResult;
import com.tony.gridironSim.model.sim.PlayType;
import com.tony.gridironSim.model.sim.Possession;
import lombok.extern.slf4j.Slf4j;

import java.util.SplittableRandom;

/**
 * Machine à états d'un drive : enchaîne les actions jusqu'à un événement terminal.
 */
@Slf4j
public class DriveSimulator {

    private static final int KICKOFF_SECONDS = 5;
    private static final int PUNT_SECONDS = 10;
    private static final int FIELD_GOAL_SECONDS = 5;
    private static final int TIMEOUT_SECONDS = 6;
    private static final int LAST_KICK_SECONDS = 10;
    private static final double OUT_OF_BOUNDS_RATE = 0.35;

    private final EngineConfig config;
    private final PlaySimulator playSimulator;
    private final SpecialTeamsSimulator specialTeams;
    private final FourthDownDecider fourthDownDecider;
    private final ExpectedPointsModel expectedPoints;

    public DriveSimulator(EngineConfig config, PlaySimulator playSimulator, SpecialTeamsSimulator specialTeams,
                          FourthDownDecider fourthDownDecider, ExpectedPointsModel expectedPoints) {
        this.config = config;
        this.playSimulator = playSimulator;
        this.specialTeams = specialTeams;
        this.fourthDownDecider = fourthDownDecider;
        this.expectedPoints = expectedPoints;
    }

    public DriveResult simulate(GameState state, Possession side, TeamProfile offense, TeamProfile defense,
                                MatchupContext matchup, DriveStart start, SplittableRandom rng) {
        int startYardline = start.yardline();
        if (start.fromKickoff()) {
            state.tick(KICKOFF_SECONDS);
            SpecialTeamsSimulator.KickoffResult kick = specialTeams.kickoff(offense, rng);
            if (kick.returnTouchdown()) {
                state.startDrive(side, 99);
                int points = scoreTouchdown(state, side, rng);
                return DriveResult.builder()
                        .offense(side).startYardline(100)
                        .outcome(DriveOutcome.TOUCHDOWN)
                        .offensePoints(points)
                        .kickoffNext(true)
                        .build();
            }
            startYardline = kick.startYardline();
        }
        state.startDrive(side, startYardline);

        DriveResult.DriveResultBuilder drive = DriveResult.builder().offense(side).startYardline(startYardline);
        double epaTotal = 0.0;
        int plays = 0;

        while (true) {
            if (state.isHalfOver()) {
                return drive.outcome(DriveOutcome.END_OF_HALF).epaTotal(epaTotal).kickoffNext(true).build();
            }
            if (plays >= config.getMaxPlaysPerDrive()) {
                log.debug("Drive plafonné à {} actions ({} au {})", plays, side, state.getYardline());
                return drive.outcome(DriveOutcome.TURNOVER_ON_DOWNS).capped(true).epaTotal(epaTotal)
                        .nextStartYardline(clampSpot(100 - state.getYardline())).build();
            }

            int yardline = state.getYardline();
            int down = state.getDown();
            int toGo = state.getToGo();
            double before = expectedPoints.value(yardline, down, toGo);

            // Dernier tir avant la fin de la mi-temps
            if (state.secondsLeftInHalf() <= LAST_KICK_SECONDS
                    && specialTeams.inFieldGoalRange(yardline)
                    && (state.getQuarter() == 2 || state.offenseLead() >= -3)) {
                return kickFieldGoal(state, side, offense, drive, epaTotal, before, rng);
            }

            if (down == 4) {
                FourthDownDecision decision = fourthDownDecider.decide(state, offense, defense);
                if (decision.choice() == FourthDownChoice.PUNT) {
                    return punt(state, side, offense, drive, epaTotal, before, rng);
                }
                if (decision.choice() == FourthDownChoice.FIELD_GOAL) {
                    return kickFieldGoal(state, side, offense, drive, epaTotal, before, rng);
                }
            }

            PlayOutcome outcome = playSimulator.simulate(state, offense, defense, matchup, rng);
            plays++;
            int seconds = clockUsage(state, side, outcome, rng);

            switch (outcome.result()) {
                case TOUCHDOWN -> {
                    state.countPlay();
                    double epa = ExpectedPointsModel.TOUCHDOWN_VALUE - before;
                    drive.play(event(side, outcome, down, toGo, yardline, epa, seconds));
                    state.tick(seconds);
                    int points = scoreTouchdown(state, side, rng);
                    return drive.outcome(DriveOutcome.TOUCHDOWN).epaTotal(epaTotal + epa)
                            .offensePoints(points).kickoffNext(true).build();
                }
                case SAFETY -> {
                    state.countPlay();
                    double epa = ExpectedPointsModel.SAFETY_VALUE - before;
                    drive.play(event(side, outcome, down, toGo, yardline, epa, seconds));
                    state.tick(seconds);
                    state.addPoints(side.opposite(), 2);
                    return drive.outcome(DriveOutcome.SAFETY).epaTotal(epaTotal + epa).defensePoints(2)
                            .nextStartYardline(specialTeams.freeKickStart(rng)).build();
                }
                case INTERCEPTION, FUMBLE -> {
                    state.countPlay();
                    int spot = outcome.turnoverSpot();
                    int opponentStart = spot >= 100 ? SpecialTeamsSimulator.TOUCHBACK_PUNT : clampSpot(100 - spot);
                    double epa = expectedPoints.afterChangeOfPossession(opponentStart) - before;
                    drive.play(event(side, outcome, down, toGo, yardline, epa, seconds));
                    state.tick(seconds);
                    return drive.outcome(DriveOutcome.TURNOVER).epaTotal(epaTotal + epa)
                            .nextStartYardline(opponentStart).build();
                }
                default -> {
                    state.advance(outcome.yards());
                    if (state.getDown() > 4) {
                        int opponentStart = clampSpot(100 - state.getYardline());
                        double epa = expectedPoints.afterChangeOfPossession(opponentStart) - before;
                        drive.play(event(side, outcome, down, toGo, yardline, epa, seconds));
                        state.tick(seconds);
                        return drive.outcome(DriveOutcome.TURNOVER_ON_DOWNS).epaTotal(epaTotal + epa)
                                .nextStartYardline(opponentStart).build();
                    }
                    double epa = expectedPoints.value(state.getYardline(), state.getDown(), state.getToGo()) - before;
                    epaTotal += epa;
                    drive.play(event(side, outcome, down, toGo, yardline, epa, seconds));
                    state.tick(seconds);
                }
            }
        }
    }

    /**
     * Secondes consommées, avec arrêts de jeu en mode 2 minutes :
     * sortie en touche ou temps mort de l'équipe menée.
     */
    private int clockUsage(GameState state, Possession side, PlayOutcome outcome, SplittableRandom rng) {
        if (outcome.clockStops() || !state.isTwoMinute(config.getTwoMinuteSeconds())) {
            return outcome.seconds();
        }
        int lead = state.offenseLead();
        if (lead <= 0) {
            if (Distributions.bernoulli(rng, OUT_OF_BOUNDS_RATE) || state.useTimeout(side)) {
                return TIMEOUT_SECONDS;
            }
        } else if (state.getQuarter() >= 4 && state.useTimeout(side.opposite())) {
            return TIMEOUT_SECONDS;
        }
        return outcome.seconds();
    }

    private int scoreTouchdown(GameState state, Possession side, SplittableRandom rng) {
        state.addPoints(side, 6);
        boolean lateGame = state.getQuarter() >= 4 && state.secondsLeftInHalf() <= 600;
        int extra = specialTeams.conversion(state.offenseLead(), lateGame, rng);
        state.addPoints(side, extra);
        return 6 + extra;
    }

    private DriveResult kickFieldGoal(GameState state, Possession side, TeamProfile kicker,
                                      DriveResult.DriveResultBuilder drive, double epaTotal, double before,
                                      SplittableRandom rng) {
        int yardline = state.getYardline();
        boolean made = specialTeams.fieldGoal(yardline, kicker, rng);
        state.countPlay();
        if (made) {
            double epa = ExpectedPointsModel.FIELD_GOAL_VALUE - before;
            drive.play(specialEvent(side, PlayType.FIELD_GOAL, PlayResult.FIELD_GOAL_GOOD, state, epa, FIELD_GOAL_SECONDS));
            state.tick(FIELD_GOAL_SECONDS);
            state.addPoints(side, 3);
            return drive.outcome(DriveOutcome.FIELD_GOAL_MADE).epaTotal(epaTotal + epa)
                    .offensePoints(3).kickoffNext(true).build();
        }
        int opponentStart = SpecialTeamsSimulator.missedFieldGoalStart(yardline);
        double epa = expectedPoints.afterChangeOfPossession(opponentStart) - before;
        drive.play(specialEvent(side, PlayType.FIELD_GOAL, PlayResult.FIELD_GOAL_MISSED, state, epa, FIELD_GOAL_SECONDS));
        state.tick(FIELD_GOAL_SECONDS);
        return drive.outcome(DriveOutcome.FIELD_GOAL_MISSED).epaTotal(epaTotal + epa)
                .nextStartYardline(opponentStart).build();
    }

    private DriveResult punt(GameState state, Possession side, TeamProfile punter,
                             DriveResult.DriveResultBuilder drive, double epaTotal, double before,
                             SplittableRandom rng) {
        int opponentStart = specialTeams.punt(state.getYardline(), punter, rng);
        double epa = expectedPoints.afterChangeOfPossession(opponentStart) - before;
        state.countPlay();
        drive.play(specialEvent(side, PlayType.PUNT, PlayResult.PUNT, state, epa, PUNT_SECONDS));
        state.tick(PUNT_SECONDS);
        return drive.outcome(DriveOutcome.PUNT).epaTotal(epaTotal + epa).nextStartYardline(opponentStart).build();
    }

    private static PlayEvent event(Possession side, PlayOutcome outcome, int down, int toGo, int yardline,
                                   double epa, int seconds) {
        return new PlayEvent(side, outcome.type(), outcome.result(), down, toGo, yardline,
                outcome.yards(), outcome.pressured(), epa, seconds);
    }

    private static PlayEvent specialEvent(Possession side, PlayType type, PlayResult result, GameState state,
                                          double epa, int seconds) {
        return new PlayEvent(side, type, result, state.getDown(), state.getToGo(), state.getYardline(),
                0, false, epa, seconds);
    }

    private static int clampSpot(int yardline) {
        return Distributions.clamp(yardline, 1, 99);
    }
}
