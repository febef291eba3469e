package com.tony.gridironSim.engine;

import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.model.profile.MatchupContext;
import com.tony.gridironSim.model.profile.TeamProfile;
import com.tony.gridironSim.model.sim.DriveLogEntry;
import com.tony.gridironSim.model.sim.DriveOutcome;
import com.tony.gridironSim.model.sim.DriveResult;
import com.tony.gridironSim.model.sim.GameState;
import com.tony.gridironSim.model.sim.PlayEvent;
import com.tony.gridironSim.model.sim.PlayResult;
import com.tony.gridironSim.model.sim.Possession;
import com.tony.gridironSim.model.sim.SimulationRequest;
import com.tony.gridironSim.model.sim.SimulationTrial;
import com.tony.gridironSim.model.sim.TeamTrialStats;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Orchestre un match complet : deux mi-temps, bonus terrain, prolongation simplifiée.
 * Sans état : une instance peut servir tous les essais d'un batch en parallèle.
 */
@Slf4j
public class GameSimulator {

    private final EngineConfig config;
    private final DriveSimulator driveSimulator;

    public GameSimulator(EngineConfig config, DriveSimulator driveSimulator) {
        this.config = config;
        this.driveSimulator = driveSimulator;
    }

    public static GameSimulator forConfig(EngineConfig config) {
        ExpectedPointsModel expectedPoints = new ExpectedPointsModel();
        ScoringZoneModel scoringZone = new ScoringZoneModel();
        SpecialTeamsSimulator specialTeams = new SpecialTeamsSimulator(config);
        PlaySimulator playSimulator = new PlaySimulator(config, scoringZone);
        FourthDownDecider decider = new FourthDownDecider(config, expectedPoints, specialTeams, scoringZone);
        DriveSimulator driveSimulator = new DriveSimulator(config, playSimulator, specialTeams, decider, expectedPoints);
        return new GameSimulator(config, driveSimulator);
    }

    public SimulationTrial simulate(int index, SimulationRequest request, SplittableRandom rng) {
        Trial trial = new Trial(request, rng);

        // Coup d'envoi au toss, puis alternance stricte après chaque drive
        Possession next = rng.nextBoolean() ? Possession.HOME : Possession.AWAY;

        next = trial.playHalf(next);
        if (!trial.divergent) {
            trial.state.startSecondHalf();
            trial.start = DriveStart.kickoff();
            next = trial.playHalf(next);
        }

        // Avantage du terrain : une seule fois, en fin de temps réglementaire
        trial.state.addPoints(Possession.HOME, Distributions.stochasticRound(rng, config.getHomeFieldPoints()));

        boolean overtime = false;
        if (!trial.divergent && trial.state.getHomeScore() == trial.state.getAwayScore()) {
            overtime = true;
            trial.state.startOvertime();
            trial.start = DriveStart.kickoff();
            // Une possession chacun ; si toujours égalité, le match reste nul
            for (int i = 0; i < 2 && !trial.divergent; i++) {
                next = trial.playDrive(next);
            }
        }

        GameState state = trial.state;
        if (trial.divergent) {
            log.debug("Essai {} divergent ({} drives)", index, state.getDriveCount());
        }
        return new SimulationTrial(index, state.getHomeScore(), state.getAwayScore(),
                trial.stats(Possession.HOME), trial.stats(Possession.AWAY),
                overtime, trial.divergent,
                trial.driveLog == null ? List.of() : Collections.unmodifiableList(trial.driveLog));
    }

    /**
     * État d'un essai en cours (compteurs par équipe, trace optionnelle).
     */
    private final class Trial {
        final SimulationRequest request;
        final SplittableRandom rng;
        final GameState state = new GameState();
        final List<DriveLogEntry> driveLog;
        final int[] plays = new int[2];
        final int[] dropbacks = new int[2];
        final int[] pressures = new int[2];
        final int[] sacks = new int[2];
        final double[] epa = new double[2];
        final int[] drives = new int[2];
        DriveStart start = DriveStart.kickoff();
        boolean divergent;

        Trial(SimulationRequest request, SplittableRandom rng) {
            this.request = request;
            this.rng = rng;
            this.driveLog = request.isTraceDrives() ? new ArrayList<>() : null;
        }

        Possession playHalf(Possession receiver) {
            Possession next = receiver;
            while (!state.isHalfOver() && !divergent) {
                next = playDrive(next);
            }
            return next;
        }

        Possession playDrive(Possession side) {
            if (state.getDriveCount() >= config.getMaxDrivesPerGame()) {
                divergent = true;
                return side;
            }
            boolean home = side == Possession.HOME;
            TeamProfile offense = home ? request.getHome() : request.getAway();
            TeamProfile defense = home ? request.getAway() : request.getHome();
            MatchupContext matchup = home ? request.getHomeMatchup() : request.getAwayMatchup();

            int quarter = state.getQuarter();
            int clock = state.getClock();
            DriveResult drive = driveSimulator.simulate(state, side, offense, defense, matchup, start, rng);
            record(side, drive);
            if (driveLog != null) {
                driveLog.add(new DriveLogEntry(state.getDriveCount(), side, quarter, clock, drive.getStartYardline(),
                        drive.getOutcome(), drive.getPlays().size(), state.getHomeScore(), state.getAwayScore(),
                        drive.isCapped()));
            }
            if (drive.isCapped()) {
                divergent = true;
            }

            start = drive.isKickoffNext() || drive.getOutcome() == DriveOutcome.END_OF_HALF
                    ? DriveStart.kickoff()
                    : DriveStart.at(drive.getNextStartYardline());
            return side.opposite();
        }

        private void record(Possession side, DriveResult drive) {
            int i = side.ordinal();
            drives[i]++;
            for (PlayEvent play : drive.getPlays()) {
                if (!play.isOffensivePlay()) continue;
                plays[i]++;
                epa[i] += play.epa();
                if (play.isDropback()) {
                    dropbacks[i]++;
                    if (play.pressured()) pressures[i]++;
                    if (play.result() == PlayResult.SACK) sacks[i]++;
                }
            }
        }

        TeamTrialStats stats(Possession side) {
            int i = side.ordinal();
            return new TeamTrialStats(state.scoreOf(side), plays[i], dropbacks[i], pressures[i], sacks[i],
                    epa[i], drives[i]);
        }
    }
}
