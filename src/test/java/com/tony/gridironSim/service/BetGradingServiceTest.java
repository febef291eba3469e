package com.tony.gridironSim.service;

import com.tony.gridironSim.model.BetGrade;
import com.tony.gridironSim.model.BetSide;
import com.tony.gridironSim.model.dto.BetRecommendation;
import com.tony.gridironSim.model.sim.SimulationBatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

class BetGradingServiceTest {

    private final BetGradingService service = new BetGradingService();

    @Test
    @DisplayName("Pari écart : victoire, défaite et push")
    void gradesSpreadBets() {
        // Domicile -3 : gagne de 7, de 3, de 1
        assertThat(service.gradeSpread(BetSide.HOME, -3.0, 27, 20)).isEqualTo(BetGrade.WIN);
        assertThat(service.gradeSpread(BetSide.HOME, -3.0, 23, 20)).isEqualTo(BetGrade.PUSH);
        assertThat(service.gradeSpread(BetSide.AWAY, -3.0, 21, 20)).isEqualTo(BetGrade.WIN);
        assertThat(service.gradeSpread(BetSide.HOME, -3.0, 21, 20)).isEqualTo(BetGrade.LOSS);
    }

    @Test
    @DisplayName("Pari total : over, under et push")
    void gradesTotalBets() {
        assertThat(service.gradeTotal(BetSide.OVER, 44.5, 24, 21)).isEqualTo(BetGrade.WIN);
        assertThat(service.gradeTotal(BetSide.UNDER, 44.5, 24, 21)).isEqualTo(BetGrade.LOSS);
        assertThat(service.gradeTotal(BetSide.OVER, 45.0, 24, 21)).isEqualTo(BetGrade.PUSH);
    }

    @Test
    @DisplayName("Un côté incompatible avec le marché est refusé")
    void rejectsWrongSide() {
        assertThatThrownBy(() -> service.gradeSpread(BetSide.OVER, -3.0, 20, 17))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.gradeTotal(BetSide.HOME, 44.5, 20, 17))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Profit à -110 : push = 0, victoire = 0.909, défaite = -1")
    void profitAtStandardJuice() {
        assertThat(service.profit(BetGrade.PUSH)).isZero();
        assertThat(service.profit(BetGrade.WIN)).isCloseTo(0.9091, offset(1e-4));
        assertThat(service.profit(BetGrade.LOSS)).isEqualTo(-1.0);
    }

    @Test
    @DisplayName("Closing line value selon le côté joué")
    void closingLineValue() {
        assertThat(service.beatClosingLine(BetSide.HOME, -2.5, -3.5)).isTrue();
        assertThat(service.beatClosingLine(BetSide.AWAY, -3.5, -2.5)).isTrue();
        assertThat(service.beatClosingLine(BetSide.OVER, 44.5, 46.0)).isTrue();
        assertThat(service.beatClosingLine(BetSide.UNDER, 44.5, 46.0)).isFalse();
        assertThat(service.beatClosingLine(BetSide.HOME, -3.0, -3.0)).isFalse();
    }

    @Test
    @DisplayName("Recommandation quand l'écart modèle / marché dépasse le seuil")
    void recommendsOnEdge() {
        SimulationBatch batch = SimulationBatch.builder()
                .survivingTrials(5000).marginMean(6.0).totalMean(41.0)
                .build();

        BetRecommendation rec = service.recommend(batch, -3.5, 44.5, 1.5, 2.0);

        assertThat(rec.getSpreadPick()).isEqualTo(BetSide.HOME);
        assertThat(rec.getSpreadEdge()).isCloseTo(2.5, offset(1e-9));
        assertThat(rec.getTotalPick()).isEqualTo(BetSide.UNDER);
        assertThat(rec.getTotalEdge()).isCloseTo(-3.5, offset(1e-9));
    }

    @Test
    @DisplayName("Pas de pari sous le seuil ni sur un batch insuffisant")
    void noRecommendation() {
        SimulationBatch close = SimulationBatch.builder().marginMean(4.0).totalMean(45.0).build();
        SimulationBatch thin = SimulationBatch.builder().marginMean(10.0).totalMean(60.0).insufficientSample(true).build();

        BetRecommendation rec = service.recommend(close, -3.5, 44.5, 1.5, 2.0);

        assertThat(rec.hasSpreadPick()).isFalse();
        assertThat(rec.hasTotalPick()).isFalse();
        assertThat(service.recommend(thin, -3.5, 44.5, 1.5, 2.0)).isEqualTo(BetRecommendation.NONE);
    }
}
