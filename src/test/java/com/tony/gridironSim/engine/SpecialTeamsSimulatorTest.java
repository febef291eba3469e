package com.tony.gridironSim.engine;

import com.tony.gridironSim.ProfileFixtures;
import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.model.profile.ProxyProfile;
import com.tony.gridironSim.model.profile.TeamProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;

class SpecialTeamsSimulatorTest {

    private final SpecialTeamsSimulator specialTeams = new SpecialTeamsSimulator(EngineConfig.defaults());
    private final TeamProfile team = ProfileFixtures.proxy("BAL");

    @Test
    @DisplayName("Field goal manqué : l'adversaire repart du point du tir, au moins de ses 20")
    void missedFieldGoalSpot() {
        assertThat(SpecialTeamsSimulator.missedFieldGoalStart(65)).isEqualTo(42);
        assertThat(SpecialTeamsSimulator.missedFieldGoalStart(95)).isEqualTo(20);
    }

    @Test
    @DisplayName("Distance de field goal = yards jusqu'à l'en-but + 17")
    void fieldGoalDistance() {
        assertThat(SpecialTeamsSimulator.fieldGoalDistance(75)).isEqualTo(42);
        assertThat(specialTeams.inFieldGoalRange(70)).isTrue();
        assertThat(specialTeams.inFieldGoalRange(40)).isFalse();
    }

    @Test
    @DisplayName("La réussite baisse avec la distance et suit la précision du kicker")
    void makeProbability() {
        TeamProfile accurate = ProxyProfile.builder()
                .teamCode("BAL").season(2024).week(6).gamesPlayed(5)
                .fieldGoalPct(0.95)
                .build();

        assertThat(specialTeams.makeProbability(25, team)).isGreaterThan(specialTeams.makeProbability(52, team));
        assertThat(specialTeams.makeProbability(45, accurate)).isGreaterThan(specialTeams.makeProbability(45, team));
    }

    @Test
    @DisplayName("Punt proche de l'en-but adverse : touchback aux 20")
    void puntTouchback() {
        for (long seed = 0; seed < 50; seed++) {
            assertThat(specialTeams.punt(60, team, new SplittableRandom(seed))).isEqualTo(20);
        }
    }

    @Test
    @DisplayName("Punt depuis son camp : l'adversaire repart entre ses 20 et ses 65")
    void puntFromOwnTerritory() {
        for (long seed = 0; seed < 200; seed++) {
            int start = specialTeams.punt(20, team, new SplittableRandom(seed));
            assertThat(start).isBetween(20, 65);
        }
    }

    @Test
    @DisplayName("Coup d'envoi : départ entre les 5 et les 50, ou touchdown sur retour")
    void kickoffStart() {
        for (long seed = 0; seed < 500; seed++) {
            SpecialTeamsSimulator.KickoffResult kick = specialTeams.kickoff(team, new SplittableRandom(seed));
            if (!kick.returnTouchdown()) {
                assertThat(kick.startYardline()).isBetween(5, 50);
            }
        }
    }
}
