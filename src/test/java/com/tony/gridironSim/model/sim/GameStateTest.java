package com.tony.gridironSim.model.sim;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameStateTest {

    @Test
    @DisplayName("Un score ne peut jamais diminuer")
    void pointsCannotBeNegative() {
        GameState state = new GameState();
        state.addPoints(Possession.HOME, 7);

        assertThatThrownBy(() -> state.addPoints(Possession.HOME, -3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(state.getHomeScore()).isEqualTo(7);
    }

    @Test
    @DisplayName("La fin du 1er quart-temps enchaîne sur le 2e sans finir la mi-temps")
    void firstQuarterRollsIntoSecond() {
        GameState state = new GameState();
        state.tick(GameState.QUARTER_SECONDS);

        assertThat(state.getQuarter()).isEqualTo(2);
        assertThat(state.getClock()).isEqualTo(GameState.QUARTER_SECONDS);
        assertThat(state.isHalfOver()).isFalse();

        state.tick(GameState.QUARTER_SECONDS + 30);
        assertThat(state.getClock()).isZero();
        assertThat(state.isHalfOver()).isTrue();
    }

    @Test
    @DisplayName("Premier essai quand la distance est couverte, sinon essai suivant")
    void advanceHandlesFirstDowns() {
        GameState state = new GameState();
        state.startDrive(Possession.AWAY, 25);

        state.advance(4);
        assertThat(state.getDown()).isEqualTo(2);
        assertThat(state.getToGo()).isEqualTo(6);

        state.advance(7);
        assertThat(state.getDown()).isEqualTo(1);
        assertThat(state.getToGo()).isEqualTo(10);
        assertThat(state.getYardline()).isEqualTo(36);
    }

    @Test
    @DisplayName("Près de l'en-but adverse, la distance est bornée par la ligne de but")
    void goalToGo() {
        GameState state = new GameState();
        state.startDrive(Possession.HOME, 94);

        assertThat(state.getToGo()).isEqualTo(6);
    }

    @Test
    @DisplayName("Mode 2 minutes uniquement en fin de mi-temps")
    void twoMinuteWindow() {
        GameState state = new GameState();
        state.tick(800);
        assertThat(state.isTwoMinute(120)).isFalse(); // 1er quart

        state.tick(100);   // -> Q2, 900 s
        state.tick(800);   // Q2, 100 s
        assertThat(state.isTwoMinute(120)).isTrue();
        assertThat(state.secondsLeftInHalf()).isEqualTo(100);
    }

    @Test
    @DisplayName("Temps morts : 3 par mi-temps, jamais en négatif")
    void timeouts() {
        GameState state = new GameState();
        assertThat(state.useTimeout(Possession.HOME)).isTrue();
        assertThat(state.useTimeout(Possession.HOME)).isTrue();
        assertThat(state.useTimeout(Possession.HOME)).isTrue();
        assertThat(state.useTimeout(Possession.HOME)).isFalse();

        state.startSecondHalf();
        assertThat(state.timeoutsOf(Possession.HOME)).isEqualTo(3);
    }
}
