package com.tony.gridironSim.engine;

import com.tony.gridironSim.ProfileFixtures;
import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.model.profile.MatchupContext;
import com.tony.gridironSim.model.profile.TeamProfile;
import com.tony.gridironSim.model.sim.DriveOutcome;
import com.tony.gridironSim.model.sim.DriveResult;
import com.tony.gridironSim.model.sim.GameState;
import com.tony.gridironSim.model.sim.Possession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DriveSimulatorTest {

    private final TeamProfile offense = ProfileFixtures.proxy("DET");
    private final TeamProfile defense = ProfileFixtures.proxy("GB");

    private static DriveSimulator driveSimulator(EngineConfig config) {
        ExpectedPointsModel ep = new ExpectedPointsModel();
        ScoringZoneModel zone = new ScoringZoneModel();
        SpecialTeamsSimulator st = new SpecialTeamsSimulator(config);
        return new DriveSimulator(config, new PlaySimulator(config, zone), st,
                new FourthDownDecider(config, ep, st, zone), ep);
    }

    @Test
    @DisplayName("Un drive plafonné se termine en TURNOVER_ON_DOWNS marqué capped")
    void cappedDriveResolvesAsTurnoverOnDowns() {
        EngineConfig config = EngineConfig.builder().maxPlaysPerDrive(3).build();
        DriveSimulator simulator = driveSimulator(config);

        int capped = 0;
        for (long seed = 0; seed < 300; seed++) {
            GameState state = new GameState();
            DriveResult drive = simulator.simulate(state, Possession.HOME, offense, defense,
                    MatchupContext.NEUTRAL, DriveStart.at(30), new SplittableRandom(seed));

            long scrimmagePlays = drive.getPlays().stream().filter(p -> p.isOffensivePlay()).count();
            assertThat(scrimmagePlays).isLessThanOrEqualTo(3);
            if (drive.isCapped()) {
                capped++;
                assertThat(drive.getOutcome()).isEqualTo(DriveOutcome.TURNOVER_ON_DOWNS);
                assertThat(scrimmagePlays).isEqualTo(3);
                assertThat(drive.getNextStartYardline()).isBetween(1, 99);
            }
        }
        // La plupart des drives de 3 actions ne se terminent pas d'eux-mêmes
        assertThat(capped).isGreaterThan(100);
    }

    @Test
    @DisplayName("Mi-temps écoulée : le drive se termine immédiatement en END_OF_HALF")
    void endOfHalf() {
        GameState state = new GameState();
        state.tick(GameState.QUARTER_SECONDS);
        state.tick(GameState.QUARTER_SECONDS);

        DriveResult drive = driveSimulator(EngineConfig.defaults()).simulate(state, Possession.AWAY, offense, defense,
                MatchupContext.NEUTRAL, DriveStart.at(25), new SplittableRandom(7));

        assertThat(drive.getOutcome()).isEqualTo(DriveOutcome.END_OF_HALF);
        assertThat(drive.getPlays()).isEmpty();
        assertThat(drive.isKickoffNext()).isTrue();
    }

    @Test
    @DisplayName("Les points du drive correspondent au score ajouté au GameState")
    void drivePointsMatchScoreboard() {
        DriveSimulator simulator = driveSimulator(EngineConfig.defaults());
        for (long seed = 0; seed < 200; seed++) {
            GameState state = new GameState();
            DriveResult drive = simulator.simulate(state, Possession.HOME, offense, defense,
                    MatchupContext.NEUTRAL, DriveStart.kickoff(), new SplittableRandom(seed));

            assertThat(state.getHomeScore()).isEqualTo(drive.getOffensePoints());
            assertThat(state.getAwayScore()).isEqualTo(drive.getDefensePoints());
            if (drive.getOutcome() == DriveOutcome.TOUCHDOWN) {
                assertThat(drive.getOffensePoints()).isBetween(6, 8);
            }
            if (drive.getOutcome() == DriveOutcome.SAFETY) {
                assertThat(drive.getDefensePoints()).isEqualTo(2);
            }
            if (drive.getOutcome() == DriveOutcome.FIELD_GOAL_MADE) {
                assertThat(drive.getOffensePoints()).isEqualTo(3);
            }
        }
    }

    @Test
    @DisplayName("Même graine, même drive")
    void sameSeedSameDrive() {
        DriveSimulator simulator = driveSimulator(EngineConfig.defaults());

        DriveResult first = simulator.simulate(new GameState(), Possession.HOME, offense, defense,
                MatchupContext.NEUTRAL, DriveStart.at(25), new SplittableRandom(99));
        DriveResult second = simulator.simulate(new GameState(), Possession.HOME, offense, defense,
                MatchupContext.NEUTRAL, DriveStart.at(25), new SplittableRandom(99));

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Départ sur kickoff ou à une position donnée, position hors terrain refusée")
    void driveStartFactories() {
        DriveStart kickoff = DriveStart.kickoff();
        DriveStart spot = DriveStart.at(25);

        assertThat(kickoff.fromKickoff()).isTrue();
        assertThat(spot.fromKickoff()).isFalse();
        assertThat(spot.yardline()).isEqualTo(25);
        assertThatThrownBy(() -> DriveStart.at(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DriveStart.at(100)).isInstanceOf(IllegalArgumentException.class);
    }
}
