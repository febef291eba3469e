package com.tony.gridironSim.service;

import com.tony.gridironSim.model.BetGrade;
import com.tony.gridironSim.model.BetSide;
import com.tony.gridironSim.model.dto.BetRecommendation;
import com.tony.gridironSim.model.sim.SimulationBatch;
import org.springframework.stereotype.Service;

@Service
public class BetGradingService {

    // Gain net d'une mise de 1 unité à -110
    static final double WIN_PAYOUT = 100.0 / 110.0;

    /**
     * Recommandations du modèle face au marché : au plus un pari écart et un pari total.
     * Aucun pari sur un batch à l'échantillon insuffisant ou peu fiable.
     */
    public BetRecommendation recommend(SimulationBatch batch, Double spread, Double total,
                                       double spreadEdgeThreshold, double totalEdgeThreshold) {
        if (batch.isInsufficientSample() || batch.isUnreliable()) {
            return BetRecommendation.NONE;
        }
        BetRecommendation.BetRecommendationBuilder rec = BetRecommendation.builder();
        if (spread != null) {
            // Marge attendue par le marché = -spread
            double edge = batch.getMarginMean() + spread;
            if (Math.abs(edge) >= spreadEdgeThreshold) {
                rec.spreadPick(edge > 0 ? BetSide.HOME : BetSide.AWAY).spreadLine(spread).spreadEdge(edge);
            }
        }
        if (total != null) {
            double edge = batch.getTotalMean() - total;
            if (Math.abs(edge) >= totalEdgeThreshold) {
                rec.totalPick(edge > 0 ? BetSide.OVER : BetSide.UNDER).totalLine(total).totalEdge(edge);
            }
        }
        return rec.build();
    }

    public BetGrade gradeSpread(BetSide side, double spread, int homeScore, int awayScore) {
        if (side != BetSide.HOME && side != BetSide.AWAY) {
            throw new IllegalArgumentException("Côté invalide pour un pari écart : " + side);
        }
        double adjusted = homeScore - awayScore + spread;
        if (adjusted == 0) return BetGrade.PUSH;
        boolean homeCovers = adjusted > 0;
        return homeCovers == (side == BetSide.HOME) ? BetGrade.WIN : BetGrade.LOSS;
    }

    public BetGrade gradeTotal(BetSide side, double total, int homeScore, int awayScore) {
        if (side != BetSide.OVER && side != BetSide.UNDER) {
            throw new IllegalArgumentException("Côté invalide pour un pari total : " + side);
        }
        int points = homeScore + awayScore;
        if (points == total) return BetGrade.PUSH;
        boolean over = points > total;
        return over == (side == BetSide.OVER) ? BetGrade.WIN : BetGrade.LOSS;
    }

    public double profit(BetGrade grade) {
        return switch (grade) {
            case WIN -> WIN_PAYOUT;
            case LOSS -> -1.0;
            case PUSH -> 0.0;
        };
    }

    /**
     * Closing Line Value : la ligne obtenue est-elle meilleure que la ligne de clôture ?
     * Spreads du point de vue domicile.
     */
    public boolean beatClosingLine(BetSide side, double placed, double closing) {
        return switch (side) {
            case HOME -> placed > closing;    // +3.5 pris, clôture +2.5
            case AWAY -> placed < closing;    // domicile -2.5 pris, clôture -3.5
            case OVER -> placed < closing;
            case UNDER -> placed > closing;
        };
    }
}
