package com.tony.gridironSim.engine;

import com.tony.gridironSim.ProfileFixtures;
import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.model.sim.DriveLogEntry;
import com.tony.gridironSim.model.sim.SimulationRequest;
import com.tony.gridironSim.model.sim.SimulationTrial;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;

class GameSimulatorTest {

    private SimulationRequest request(EngineConfig config) {
        return SimulationRequest.builder()
                .home(ProfileFixtures.proxy("PHI"))
                .away(ProfileFixtures.proxy("DAL"))
                .config(config)
                .traceDrives(true)
                .build();
    }

    @Test
    @DisplayName("La possession alterne après chaque drive, mi-temps et prolongation comprises")
    void possessionAlternatesAfterEveryDrive() {
        EngineConfig config = EngineConfig.defaults();
        GameSimulator simulator = GameSimulator.forConfig(config);

        for (int i = 0; i < 200; i++) {
            SimulationTrial trial = simulator.simulate(i, request(config), new SplittableRandom(TrialSeeds.forTrial(1L, i)));
            List<DriveLogEntry> log = trial.driveLog();

            assertThat(log).isNotEmpty();
            for (int d = 1; d < log.size(); d++) {
                assertThat(log.get(d).offense()).isEqualTo(log.get(d - 1).offense().opposite());
            }
        }
    }

    @Test
    @DisplayName("Le score de chaque équipe ne diminue jamais au cours d'un essai")
    void scoresAreMonotonic() {
        EngineConfig config = EngineConfig.defaults();
        GameSimulator simulator = GameSimulator.forConfig(config);

        for (int i = 0; i < 200; i++) {
            SimulationTrial trial = simulator.simulate(i, request(config), new SplittableRandom(TrialSeeds.forTrial(2L, i)));
            List<DriveLogEntry> log = trial.driveLog();

            int home = 0;
            int away = 0;
            for (DriveLogEntry entry : log) {
                assertThat(entry.homeScore()).isGreaterThanOrEqualTo(home);
                assertThat(entry.awayScore()).isGreaterThanOrEqualTo(away);
                home = entry.homeScore();
                away = entry.awayScore();
            }
            assertThat(trial.homeScore()).isGreaterThanOrEqualTo(home);
            assertThat(trial.awayScore()).isGreaterThanOrEqualTo(away);
        }
    }

    @Test
    @DisplayName("Scores plausibles pour deux équipes moyennes")
    void plausibleScores() {
        EngineConfig config = EngineConfig.defaults();
        GameSimulator simulator = GameSimulator.forConfig(config);

        double totalPoints = 0;
        int n = 500;
        for (int i = 0; i < n; i++) {
            SimulationTrial trial = simulator.simulate(i, request(config), new SplittableRandom(TrialSeeds.forTrial(3L, i)));
            totalPoints += trial.total();
            assertThat(trial.home().drives() + trial.away().drives()).isBetween(8, config.getMaxDrivesPerGame());
        }
        double meanTotal = totalPoints / n;
        assertThat(meanTotal).isBetween(20.0, 75.0);
    }

    @Test
    @DisplayName("Borne de drives atteinte : l'essai est marqué divergent")
    void driveBoundMarksTrialDivergent() {
        EngineConfig config = EngineConfig.builder().maxDrivesPerGame(2).build();
        GameSimulator simulator = GameSimulator.forConfig(config);

        SimulationTrial trial = simulator.simulate(0, request(config), new SplittableRandom(5));

        assertThat(trial.divergent()).isTrue();
        assertThat(trial.driveLog()).hasSizeLessThanOrEqualTo(2);
    }

    @Test
    @DisplayName("Un essai ne dépend que de sa graine")
    void trialIsReproducible() {
        EngineConfig config = EngineConfig.defaults();
        GameSimulator simulator = GameSimulator.forConfig(config);

        SimulationTrial a = simulator.simulate(4, request(config), new SplittableRandom(TrialSeeds.forTrial(11L, 4)));
        SimulationTrial b = simulator.simulate(4, request(config), new SplittableRandom(TrialSeeds.forTrial(11L, 4)));

        assertThat(b).isEqualTo(a);
    }
}
