package com.tony.gridironSim.service;

import com.tony.gridironSim.ProfileFixtures;
import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.model.profile.MatchupContext;
import com.tony.gridironSim.model.profile.TeamProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MatchupResolverTest {

    private final MatchupResolver resolver = new MatchupResolver();
    private final EngineConfig config = EngineConfig.defaults();

    @Test
    @DisplayName("Écarts attaque - défense par unité")
    void computesUnitMismatches() {
        TeamProfile offense = ProfileFixtures.graded("SF", ProfileFixtures.grades(78, 60, 82, 60, 75, 60));
        TeamProfile defense = ProfileFixtures.graded("SEA", ProfileFixtures.grades(60, 70, 60, 74, 60, 81));

        MatchupContext matchup = resolver.resolve(offense, defense, config);

        assertThat(matchup.passProtection()).isEqualTo(8.0);
        assertThat(matchup.runBlock()).isEqualTo(8.0);
        assertThat(matchup.coverage()).isEqualTo(-6.0);
    }

    @Test
    @DisplayName("Les écarts extrêmes sont plafonnés")
    void mismatchesAreClamped() {
        TeamProfile offense = ProfileFixtures.graded("SF", ProfileFixtures.grades(95, 60, 40, 60, 75, 60));
        TeamProfile defense = ProfileFixtures.graded("SEA", ProfileFixtures.grades(60, 40, 60, 95, 60, 75));

        MatchupContext matchup = resolver.resolve(offense, defense, config);

        assertThat(matchup.passProtection()).isEqualTo(25.0);
        assertThat(matchup.runBlock()).isEqualTo(-25.0);
    }

    @Test
    @DisplayName("Un camp sans notes : contexte neutre")
    void proxySideGivesNeutralContext() {
        TeamProfile offense = ProfileFixtures.graded("SF", ProfileFixtures.uniformGrades(90));

        assertThat(resolver.resolve(offense, ProfileFixtures.proxy("SEA"), config)).isEqualTo(MatchupContext.NEUTRAL);
        assertThat(resolver.resolve(ProfileFixtures.proxy("SEA"), offense, config)).isEqualTo(MatchupContext.NEUTRAL);
    }
}
