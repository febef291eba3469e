package com.tony.gridironSim.service;

import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.model.sim.ConvictionTier;
import com.tony.gridironSim.model.sim.SimulationBatch;
import com.tony.gridironSim.model.sim.SimulationRequest;
import com.tony.gridironSim.model.sim.SimulationTrial;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

/**
 * Réduit les essais d'un batch en distribution, dans l'ordre des index (résultat déterministe).
 */
@Component
@Slf4j
public class SimulationAggregator {

    /**
     * @param trials essais indexés ; {@code null} = non exécuté (budget horaire dépassé)
     */
    public SimulationBatch aggregate(SimulationRequest request, long batchSeed, SimulationTrial[] trials, boolean truncated) {
        EngineConfig config = request.getConfig();
        Double spread = request.getSpread();
        Double total = request.getTotal();

        DescriptiveStatistics home = new DescriptiveStatistics();
        DescriptiveStatistics away = new DescriptiveStatistics();
        DescriptiveStatistics margin = new DescriptiveStatistics();
        DescriptiveStatistics points = new DescriptiveStatistics();

        int completed = 0;
        int discarded = 0;
        int homeWins = 0, awayWins = 0, ties = 0, overtimes = 0;
        int homeCovers = 0, awayCovers = 0, spreadPushes = 0;
        int overs = 0, unders = 0, totalPushes = 0;
        double homeEpa = 0, awayEpa = 0;
        long homePlays = 0, awayPlays = 0;
        long homePressures = 0, awayPressures = 0, homeDropbacks = 0, awayDropbacks = 0;

        for (SimulationTrial t : trials) {
            if (t == null) continue;
            completed++;
            if (t.divergent()) {
                discarded++;
                continue;
            }
            home.addValue(t.homeScore());
            away.addValue(t.awayScore());
            margin.addValue(t.margin());
            points.addValue(t.total());

            if (t.margin() > 0) homeWins++;
            else if (t.margin() < 0) awayWins++;
            else ties++;
            if (t.overtime()) overtimes++;

            if (spread != null) {
                // Spread domicile : -3.5 => le domicile doit gagner de 4+
                double adjusted = t.margin() + spread;
                if (adjusted > 0) homeCovers++;
                else if (adjusted < 0) awayCovers++;
                else spreadPushes++;
            }
            if (total != null) {
                if (t.total() > total) overs++;
                else if (t.total() < total) unders++;
                else totalPushes++;
            }

            homeEpa += t.home().offensiveEpa();
            awayEpa += t.away().offensiveEpa();
            homePlays += t.home().offensivePlays();
            awayPlays += t.away().offensivePlays();
            homePressures += t.home().pressures();
            awayPressures += t.away().pressures();
            homeDropbacks += t.home().dropbacks();
            awayDropbacks += t.away().dropbacks();
        }

        int n = (int) home.getN();
        double discardRate = completed == 0 ? 0.0 : (double) discarded / completed;
        boolean unreliable = discardRate > config.getMaxDiscardRate();
        boolean insufficient = n < config.getMinSurvivingTrials();

        if (discarded > 0) {
            log.warn("⚠️ {} essai(s) divergent(s) écarté(s) sur {} ({}%)", discarded, completed,
                    String.format("%.2f", 100 * discardRate));
        }
        if (insufficient) {
            log.warn("⚠️ Échantillon insuffisant : {} essais valides (min {})", n, config.getMinSurvivingTrials());
        }

        SimulationBatch.SimulationBatchBuilder batch = SimulationBatch.builder()
                .batchSeed(batchSeed)
                .requestedTrials(trials.length)
                .completedTrials(completed)
                .discardedTrials(discarded)
                .survivingTrials(n)
                .truncated(truncated)
                .insufficientSample(insufficient)
                .unreliable(unreliable)
                .spread(spread)
                .total(total);

        if (n == 0) {
            return batch.conviction(ConvictionTier.LOW).build();
        }

        batch.homeScoreMean(home.getMean())
                .homeScoreMedian(home.getPercentile(50))
                .homeScoreVariance(home.getVariance())
                .awayScoreMean(away.getMean())
                .awayScoreMedian(away.getPercentile(50))
                .awayScoreVariance(away.getVariance())
                .marginMean(margin.getMean())
                .marginMedian(margin.getPercentile(50))
                .marginStdDev(margin.getStandardDeviation())
                .totalMean(points.getMean())
                .totalMedian(points.getPercentile(50))
                .totalStdDev(points.getStandardDeviation())
                .homeWinProbability((double) homeWins / n)
                .awayWinProbability((double) awayWins / n)
                .tieProbability((double) ties / n)
                .overtimeRate((double) overtimes / n)
                .homeEpaPerPlay(homePlays == 0 ? 0.0 : homeEpa / homePlays)
                .awayEpaPerPlay(awayPlays == 0 ? 0.0 : awayEpa / awayPlays)
                .homePressureRate(homeDropbacks == 0 ? 0.0 : (double) homePressures / homeDropbacks)
                .awayPressureRate(awayDropbacks == 0 ? 0.0 : (double) awayPressures / awayDropbacks);

        // Centrage marché : les probabilités se lisent sur la distribution recalée
        boolean centered = config.isMarketCentering() && spread != null && total != null;
        if (centered) {
            MarketCentering.CenteredScores scores = MarketCentering.center(home.getValues(), away.getValues(),
                    spread, total, config.getCenteringAlpha(), config.getCenteringMinScale(), config.getCenteringMaxScale());
            int[] cover = sides(scores.margins(), -spread);
            int[] overUnder = sides(scores.totals(), total);
            homeCovers = cover[0];
            awayCovers = cover[1];
            spreadPushes = cover[2];
            overs = overUnder[0];
            unders = overUnder[1];
            totalPushes = overUnder[2];
            log.debug("🎯 Distribution recalée sur le marché (spread {}, total {})", spread, total);
        }
        batch.marketCentered(centered);

        // Écart en points : médiane simulée brute contre la ligne du marché
        ConvictionTier tier = ConvictionTier.LOW;
        if (spread != null) {
            double homeCover = (double) homeCovers / n;
            double awayCover = (double) awayCovers / n;
            batch.homeCoverProbability(homeCover)
                    .awayCoverProbability(awayCover)
                    .spreadPushProbability((double) spreadPushes / n);
            tier = ConvictionTier.max(tier, tierFor(Math.abs(margin.getPercentile(50) + spread),
                    winShare(homeCover, awayCover), config));
        }
        if (total != null) {
            double over = (double) overs / n;
            double under = (double) unders / n;
            batch.overProbability(over)
                    .underProbability(under)
                    .totalPushProbability((double) totalPushes / n);
            tier = ConvictionTier.max(tier, tierFor(Math.abs(points.getPercentile(50) - total),
                    winShare(over, under), config));
        }
        // Un batch dégradé ne peut pas porter de conviction
        if (truncated || insufficient || unreliable) {
            tier = ConvictionTier.LOW;
        }
        return batch.conviction(tier).build();
    }

    /** Effectifs au-dessus, en dessous et sur la ligne. */
    private static int[] sides(double[] values, double line) {
        int[] counts = new int[3];
        for (double v : values) {
            if (v > line) counts[0]++;
            else if (v < line) counts[1]++;
            else counts[2]++;
        }
        return counts;
    }

    /** Probabilité de gagner le meilleur côté, pushes exclus. */
    private static double winShare(double a, double b) {
        double decided = a + b;
        return decided == 0 ? 0.0 : Math.max(a, b) / decided;
    }

    ConvictionTier tierFor(double pointEdge, double winShare, EngineConfig config) {
        double probabilityEdge = winShare - config.getBreakEvenProbability();
        if (pointEdge >= config.getHighPointEdge() && probabilityEdge >= config.getHighProbabilityEdge()) {
            return ConvictionTier.HIGH;
        }
        if (pointEdge >= config.getMediumPointEdge() && probabilityEdge >= config.getMediumProbabilityEdge()) {
            return ConvictionTier.MEDIUM;
        }
        return ConvictionTier.LOW;
    }
}
