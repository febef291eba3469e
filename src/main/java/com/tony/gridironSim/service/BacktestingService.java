package com.tony.gridironSim.service;

import com.tony.gridironSim.calibration.MarketCalibrators;
import com.tony.gridironSim.config.BacktestProperties;
import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.config.SimulationProperties;
import com.tony.gridironSim.engine.TrialSeeds;
import com.tony.gridironSim.exception.DataUnavailableException;
import com.tony.gridironSim.model.AppliedCorrections;
import com.tony.gridironSim.model.BacktestRecord;
import com.tony.gridironSim.model.BetGrade;
import com.tony.gridironSim.model.Game;
import com.tony.gridironSim.model.GameBoxScore;
import com.tony.gridironSim.model.MarketLine;
import com.tony.gridironSim.model.dto.BacktestReport;
import com.tony.gridironSim.model.dto.BetRecommendation;
import com.tony.gridironSim.model.profile.TeamProfile;
import com.tony.gridironSim.model.sim.ConvictionTier;
import com.tony.gridironSim.model.sim.SimulationBatch;
import com.tony.gridironSim.model.sim.SimulationRequest;
import com.tony.gridironSim.repository.BacktestRecordRepository;
import com.tony.gridironSim.repository.GameRepository;
import com.tony.gridironSim.repository.MarketLineRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Rejoue des semaines passées comme si on était au coup d'envoi de chaque match :
 * stats, corrections et lignes de marché strictement antérieures.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestingService {

    private final GameRepository gameRepository;
    private final MarketLineRepository marketLineRepository;
    private final BacktestRecordRepository backtestRepository;
    private final TeamProfileBuilder profileBuilder;
    private final MatchupResolver matchupResolver;
    private final MonteCarloRunner runner;
    private final BetGradingService bettingService;
    private final ProbabilityCalibrationService probabilityCalibration;
    private final SimulationProperties simulationProperties;
    private final BacktestProperties backtestProperties;

    public BacktestReport runBacktest(int season, int fromWeek, int toWeek) {
        if (fromWeek > toWeek) {
            throw new IllegalArgumentException("Plage de semaines invalide : " + fromWeek + " > " + toWeek);
        }
        EngineConfig config = simulationProperties.toEngineConfig().toBuilder()
                .trials(backtestProperties.getTrials())
                .wallClockBudget(null)
                .build();

        List<Game> games = gameRepository.findCompletedGames(season, fromWeek, toWeek);
        log.info("🔁 Backtest S{} semaines {} à {} : {} matchs", season, fromWeek, toWeek, games.size());

        // Historique de calibration : semaines déjà rejouées, complété au fil du backtest
        List<BacktestRecord> history = new ArrayList<>();
        if (fromWeek > 1) {
            history.addAll(backtestRepository.findBySeasonAndWeekBetweenOrderByWeekAsc(season, 1, fromWeek - 1));
        }

        List<BacktestRecord> records = new ArrayList<>();
        int skipped = 0;
        int calibratedWeek = -1;
        MarketCalibrators calibrators = MarketCalibrators.NONE;
        for (Game game : games) {
            if (game.getWeek() != calibratedWeek) {
                calibratedWeek = game.getWeek();
                calibrators = probabilityCalibration.fitBefore(history, calibratedWeek);
            }
            try {
                BacktestRecord record = backtestGame(game, config, calibrators);
                records.add(record);
                history.add(record);
            } catch (DataUnavailableException e) {
                // Pas de stats (ex: première semaine) : le match est ignoré, pas inventé
                log.warn("   -> {} @ {} ignoré : {}", game.getAwayTeam(), game.getHomeTeam(), e.getMessage());
                skipped++;
            }
        }

        BacktestReport report = summarize(season, fromWeek, toWeek, records, skipped);
        log.info("📊 --- RÉSULTATS DU BACKTEST ---");
        log.info("🏟️  Matchs analysés : {} (ignorés : {})", report.getGamesEvaluated(), report.getGamesSkipped());
        log.info("🎯 MAE marge / total : {} / {}", String.format("%.2f", report.getMarginMae()), String.format("%.2f", report.getTotalMae()));
        log.info("💰 ATS : {}% | Unités : {} | CLV : {}%", String.format("%.1f", 100 * report.getAtsWinRate()),
                String.format("%+.2f", report.getUnitsProfit()), String.format("%.1f", 100 * report.getClvRate()));
        if (report.getCalibratedSpreadGames() > 0) {
            log.info("📐 Brier cover brut / calibré ({}) : {} / {} sur {} matchs", report.getCalibrationMethod(),
                    String.format("%.4f", report.getRawCoverBrier()), String.format("%.4f", report.getCalibratedCoverBrier()),
                    report.getCalibratedSpreadGames());
        }
        return report;
    }

    BacktestRecord backtestGame(Game game, EngineConfig config, MarketCalibrators calibrators) {
        LocalDateTime cutoff = game.getKickoff();
        TeamProfile home = profileBuilder.buildProfile(game.getHomeTeam(), game.getSeason(), game.getWeek(),
                config, PredictionService.overrides(game, true), cutoff);
        TeamProfile away = profileBuilder.buildProfile(game.getAwayTeam(), game.getSeason(), game.getWeek(),
                config, PredictionService.overrides(game, false), cutoff);

        // Double filtre : la requête borne déjà à la limite, on ne fait pas confiance aveuglément
        List<MarketLine> lines = marketLineRepository.findAvailableLines(game.getId(), cutoff).stream()
                .filter(l -> l.getCapturedAt() != null && !l.getCapturedAt().isAfter(cutoff))
                .toList();
        Double placedSpread = first(lines, MarketLine::getSpread);
        Double closingSpread = last(lines, MarketLine::getSpread);
        Double placedTotal = first(lines, MarketLine::getTotal);
        Double closingTotal = last(lines, MarketLine::getTotal);

        SimulationRequest request = SimulationRequest.builder()
                .home(home)
                .away(away)
                .homeMatchup(matchupResolver.resolve(home, away, config))
                .awayMatchup(matchupResolver.resolve(away, home, config))
                .config(config)
                .seed(TrialSeeds.forTrial(backtestProperties.getSeed(), game.getId().intValue()))
                .spread(placedSpread)
                .total(placedTotal)
                .build();
        SimulationBatch batch = runner.run(request);

        int homeScore = game.getHomeScore();
        int awayScore = game.getAwayScore();
        BacktestRecord.BacktestRecordBuilder record = BacktestRecord.builder()
                .gameId(game.getId())
                .season(game.getSeason())
                .week(game.getWeek())
                .homeTeam(game.getHomeTeam())
                .awayTeam(game.getAwayTeam())
                .predictedHomeScore(batch.getHomeScoreMean())
                .predictedAwayScore(batch.getAwayScoreMean())
                .actualHomeScore(homeScore)
                .actualAwayScore(awayScore)
                .marginError(batch.getMarginMean() - (homeScore - awayScore))
                .totalError(batch.getTotalMean() - (homeScore + awayScore))
                .homeWinProbability(batch.getHomeWinProbability())
                .simHomeEpaPerPlay(batch.getHomeEpaPerPlay())
                .simAwayEpaPerPlay(batch.getAwayEpaPerPlay())
                .simHomePressureRate(batch.getHomePressureRate())
                .simAwayPressureRate(batch.getAwayPressureRate())
                .actualHomeEpaPerPlay(boxValue(game.getHomeBox(), GameBoxScore::getEpaPerPlay))
                .actualAwayEpaPerPlay(boxValue(game.getAwayBox(), GameBoxScore::getEpaPerPlay))
                .actualHomePressureRate(boxValue(game.getHomeBox(), GameBoxScore::getPressureRate))
                .actualAwayPressureRate(boxValue(game.getAwayBox(), GameBoxScore::getPressureRate))
                .homeCorrections(AppliedCorrections.of(home.getCorrections()))
                .awayCorrections(AppliedCorrections.of(away.getCorrections()))
                .conviction(batch.getConviction())
                .placedSpread(placedSpread)
                .closingSpread(closingSpread)
                .placedTotal(placedTotal)
                .closingTotal(closingTotal)
                .createdAt(LocalDateTime.now());

        if (placedSpread != null && batch.getHomeCoverProbability() != null) {
            double z = probabilityCalibration.zScore(batch.getMarginMean() + placedSpread, batch.getMarginStdDev());
            record.spreadZ(z)
                    .rawHomeCoverProbability(decidedShare(batch.getHomeCoverProbability(), batch.getAwayCoverProbability()));
            if (calibrators.spread() != null) {
                record.calibratedHomeCoverProbability(calibrators.spread().probability(z));
            }
        }
        if (placedTotal != null && batch.getOverProbability() != null) {
            double z = probabilityCalibration.zScore(batch.getTotalMean() - placedTotal, batch.getTotalStdDev());
            record.totalZ(z)
                    .rawOverProbability(decidedShare(batch.getOverProbability(), batch.getUnderProbability()));
            if (calibrators.total() != null) {
                record.calibratedOverProbability(calibrators.total().probability(z));
            }
        }

        BetRecommendation rec = bettingService.recommend(batch, placedSpread, placedTotal,
                backtestProperties.getSpreadEdge(), backtestProperties.getTotalEdge());
        double profit = 0.0;
        if (rec.hasSpreadPick()) {
            BetGrade grade = bettingService.gradeSpread(rec.getSpreadPick(), placedSpread, homeScore, awayScore);
            profit += bettingService.profit(grade);
            record.spreadPick(rec.getSpreadPick()).spreadGrade(grade)
                    .spreadBeatClose(bettingService.beatClosingLine(rec.getSpreadPick(), placedSpread, closingSpread));
        }
        if (rec.hasTotalPick()) {
            BetGrade grade = bettingService.gradeTotal(rec.getTotalPick(), placedTotal, homeScore, awayScore);
            profit += bettingService.profit(grade);
            record.totalPick(rec.getTotalPick()).totalGrade(grade)
                    .totalBeatClose(bettingService.beatClosingLine(rec.getTotalPick(), placedTotal, closingTotal));
        }
        record.profitUnits(profit);

        BacktestRecord built = record.build();
        // Rejouer une semaine remplace la ligne existante du match
        backtestRepository.findByGameId(game.getId()).ifPresent(existing -> built.setId(existing.getId()));
        return backtestRepository.save(built);
    }

    BacktestReport summarize(int season, int fromWeek, int toWeek, List<BacktestRecord> records, int skipped) {
        int n = records.size();
        double marginAbs = 0, totalAbs = 0, brier = 0;
        int correctWinner = 0;
        int spreadBets = 0, totalBets = 0, wins = 0, losses = 0, pushes = 0;
        int spreadWins = 0, spreadLosses = 0;
        int clvBets = 0, clvBeats = 0;
        double units = 0;
        Map<ConvictionTier, int[]> byTier = new EnumMap<>(ConvictionTier.class);

        for (BacktestRecord r : records) {
            marginAbs += Math.abs(r.getMarginError());
            totalAbs += Math.abs(r.getTotalError());

            int actualMargin = r.getActualHomeScore() - r.getActualAwayScore();
            double outcome = actualMargin > 0 ? 1.0 : actualMargin < 0 ? 0.0 : 0.5;
            brier += Math.pow(r.getHomeWinProbability() - outcome, 2);
            if ((r.getHomeWinProbability() > 0.5 && actualMargin > 0) || (r.getHomeWinProbability() < 0.5 && actualMargin < 0)) {
                correctWinner++;
            }

            units += r.getProfitUnits();
            int[] tier = byTier.computeIfAbsent(r.getConviction() != null ? r.getConviction() : ConvictionTier.LOW,
                    k -> new int[2]);
            for (BetGrade g : new BetGrade[]{r.getSpreadGrade(), r.getTotalGrade()}) {
                if (g == null) continue;
                if (g == BetGrade.WIN) { wins++; tier[0]++; }
                else if (g == BetGrade.LOSS) { losses++; tier[1]++; }
                else pushes++;
            }
            if (r.getSpreadGrade() != null) spreadBets++;
            if (r.getSpreadGrade() == BetGrade.WIN) spreadWins++;
            if (r.getSpreadGrade() == BetGrade.LOSS) spreadLosses++;
            if (r.getTotalGrade() != null) totalBets++;
            for (Boolean beat : new Boolean[]{r.getSpreadBeatClose(), r.getTotalBeatClose()}) {
                if (beat == null) continue;
                clvBets++;
                if (beat) clvBeats++;
            }
        }

        BrierScores cover = coverBrier(records);
        BrierScores over = overBrier(records);

        Map<ConvictionTier, Double> accuracyByTier = new EnumMap<>(ConvictionTier.class);
        byTier.forEach((tier, wl) -> {
            if (wl[0] + wl[1] > 0) accuracyByTier.put(tier, (double) wl[0] / (wl[0] + wl[1]));
        });

        return BacktestReport.builder()
                .season(season).fromWeek(fromWeek).toWeek(toWeek)
                .gamesEvaluated(n)
                .gamesSkipped(skipped)
                .marginMae(n == 0 ? 0.0 : marginAbs / n)
                .totalMae(n == 0 ? 0.0 : totalAbs / n)
                .brierScore(n == 0 ? 0.0 : brier / n)
                .winnerAccuracy(n == 0 ? 0.0 : (double) correctWinner / n)
                .spreadBets(spreadBets)
                .totalBets(totalBets)
                .wins(wins)
                .losses(losses)
                .pushes(pushes)
                .atsWinRate(spreadWins + spreadLosses == 0 ? 0.0 : (double) spreadWins / (spreadWins + spreadLosses))
                .unitsProfit(units)
                .clvRate(clvBets == 0 ? 0.0 : (double) clvBeats / clvBets)
                .accuracyByTier(accuracyByTier)
                .calibrationMethod(backtestProperties.getProbabilityCalibration())
                .calibratedSpreadGames(cover.games())
                .rawCoverBrier(cover.raw())
                .calibratedCoverBrier(cover.calibrated())
                .calibratedTotalGames(over.games())
                .rawOverBrier(over.raw())
                .calibratedOverBrier(over.calibrated())
                .build();
    }

    /** Brier brut et calibré, sur les mêmes matchs, pushes exclus. */
    private record BrierScores(int games, double raw, double calibrated) {

        static final BrierScores EMPTY = new BrierScores(0, 0.0, 0.0);
    }

    private static BrierScores coverBrier(List<BacktestRecord> records) {
        int n = 0;
        double raw = 0, calibrated = 0;
        for (BacktestRecord r : records) {
            if (r.getCalibratedHomeCoverProbability() == null || r.getRawHomeCoverProbability() == null) continue;
            double adjusted = r.getActualHomeScore() - r.getActualAwayScore() + r.getPlacedSpread();
            if (adjusted == 0) continue;
            double outcome = adjusted > 0 ? 1.0 : 0.0;
            raw += Math.pow(r.getRawHomeCoverProbability() - outcome, 2);
            calibrated += Math.pow(r.getCalibratedHomeCoverProbability() - outcome, 2);
            n++;
        }
        return n == 0 ? BrierScores.EMPTY : new BrierScores(n, raw / n, calibrated / n);
    }

    private static BrierScores overBrier(List<BacktestRecord> records) {
        int n = 0;
        double raw = 0, calibrated = 0;
        for (BacktestRecord r : records) {
            if (r.getCalibratedOverProbability() == null || r.getRawOverProbability() == null) continue;
            double points = r.getActualHomeScore() + r.getActualAwayScore();
            if (points == r.getPlacedTotal()) continue;
            double outcome = points > r.getPlacedTotal() ? 1.0 : 0.0;
            raw += Math.pow(r.getRawOverProbability() - outcome, 2);
            calibrated += Math.pow(r.getCalibratedOverProbability() - outcome, 2);
            n++;
        }
        return n == 0 ? BrierScores.EMPTY : new BrierScores(n, raw / n, calibrated / n);
    }

    /** Part du côté a parmi les issues tranchées ; null si tout est push. */
    private static Double decidedShare(Double a, Double b) {
        double decided = a + b;
        return decided == 0 ? null : a / decided;
    }

    private static Double first(List<MarketLine> lines, Function<MarketLine, Double> field) {
        return lines.stream().map(field).filter(v -> v != null).findFirst().orElse(null);
    }

    private static Double last(List<MarketLine> lines, Function<MarketLine, Double> field) {
        Double value = null;
        for (MarketLine line : lines) {
            Double v = field.apply(line);
            if (v != null) value = v;
        }
        return value;
    }

    private static Double boxValue(GameBoxScore box, Function<GameBoxScore, Double> field) {
        return box == null ? null : field.apply(box);
    }
}
