package com.tony.gridironSim.service;

import com.tony.gridironSim.config.CalibrationSettings;
import com.tony.gridironSim.model.AppliedCorrections;
import com.tony.gridironSim.model.BacktestRecord;
import com.tony.gridironSim.model.CalibrationMetric;
import com.tony.gridironSim.model.CalibrationRecord;
import com.tony.gridironSim.model.dto.CalibrationOutcome;
import com.tony.gridironSim.model.dto.CalibrationResult;
import com.tony.gridironSim.model.profile.CorrectionSnapshot;
import com.tony.gridironSim.repository.BacktestRecordRepository;
import com.tony.gridironSim.repository.CalibrationRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Boucle de rétroaction : compare le simulé au réel sur une fenêtre glissante
 * et écrit, une fois par semaine, des corrections amorties et bornées.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CalibrationService {

    private static final double MIN_STANDARD_ERROR = 1e-6;

    private final BacktestRecordRepository backtestRepository;
    private final CalibrationRecordRepository calibrationRepository;

    @Transactional
    public CalibrationResult calibrate(int season, int asOfWeek, CalibrationSettings settings) {
        if (calibrationRepository.existsBySeasonAndAsOfWeek(season, asOfWeek)) {
            log.warn("🔒 Calibration S{} sem. {} déjà écrite : passe refusée", season, asOfWeek);
            return CalibrationResult.builder()
                    .season(season).asOfWeek(asOfWeek)
                    .alreadyCalibrated(true)
                    .records(calibrationRepository.findBySeasonAndAsOfWeek(season, asOfWeek))
                    .build();
        }

        int fromWeek = Math.max(1, asOfWeek - settings.getWindowWeeks() + 1);
        List<BacktestRecord> history = backtestRepository.findBySeasonAndWeekBetweenOrderByWeekAsc(season, fromWeek, asOfWeek);
        log.info("📊 Calibration S{} sem. {} : {} matchs (semaines {} à {})", season, asOfWeek, history.size(), fromWeek, asOfWeek);

        Map<String, TeamHistory> byTeam = new TreeMap<>();
        for (BacktestRecord r : history) {
            byTeam.computeIfAbsent(r.getHomeTeam(), k -> new TeamHistory()).add(r, true);
            byTeam.computeIfAbsent(r.getAwayTeam(), k -> new TeamHistory()).add(r, false);
        }

        CalibrationResult.CalibrationResultBuilder result = CalibrationResult.builder().season(season).asOfWeek(asOfWeek);
        List<CalibrationRecord> written = new ArrayList<>();
        LocalDateTime now = LocalDateTime.now();

        for (Map.Entry<String, TeamHistory> entry : byTeam.entrySet()) {
            String team = entry.getKey();
            TeamHistory teamHistory = entry.getValue();
            if (teamHistory.weeks.size() < settings.getMinHistoryWeeks()) {
                log.info("⏭️ Calibration ignorée pour {} : {} semaine(s) d'historique (min {})",
                        team, teamHistory.weeks.size(), settings.getMinHistoryWeeks());
                result.teamOutcome(team, CalibrationOutcome.SKIPPED_INSUFFICIENT_HISTORY);
                continue;
            }

            Map<CalibrationMetric, CalibrationRecord> previous = latestBefore(team, season, asOfWeek);
            for (CalibrationMetric metric : CalibrationMetric.values()) {
                CalibrationRecord prev = previous.get(metric);
                written.add(calibrateMetric(season, asOfWeek, team, metric, teamHistory.diffs.get(metric),
                        prev, settings, now));
            }
            result.teamOutcome(team, CalibrationOutcome.CALIBRATED);
        }

        List<CalibrationRecord> saved = calibrationRepository.saveAll(written);
        long material = saved.stream().filter(CalibrationRecord::isMaterial).count();
        log.info("✅ Calibration S{} sem. {} : {} corrections écrites ({} significatives)", season, asOfWeek, saved.size(), material);
        return result.records(saved).build();
    }

    private CalibrationRecord calibrateMetric(int season, int asOfWeek, String team, CalibrationMetric metric,
                                              List<Double> diffs, CalibrationRecord prev,
                                              CalibrationSettings settings, LocalDateTime now) {
        double previousCorrection = prev != null ? prev.getCorrection() : 0.0;
        int version = prev != null ? prev.getVersion() + 1 : 1;

        DescriptiveStatistics stats = new DescriptiveStatistics();
        diffs.forEach(stats::addValue);
        int n = (int) stats.getN();

        double bias = n > 0 ? stats.getMean() : 0.0;
        double z = 0.0;
        if (n >= settings.getMinHistoryWeeks()) {
            double se = Math.max(stats.getStandardDeviation() / Math.sqrt(n), MIN_STANDARD_ERROR);
            z = bias / se;
        }
        boolean material = Math.abs(z) > settings.getMaterialityZ();
        double raw = -settings.getDamping() * bias;

        // Biais mesuré hors correction : la nouvelle correction remplace l'ancienne.
        // Bruit : on reconduit la correction précédente telle quelle
        double correction = material
                ? settings.clamp(metric, raw)
                : settings.clamp(metric, previousCorrection);

        if (material) {
            log.info("   -> {} {} : biais={} z={} correction {} -> {}", team, metric,
                    String.format("%.3f", bias), String.format("%.2f", z),
                    String.format("%.3f", previousCorrection), String.format("%.3f", correction));
        }
        return CalibrationRecord.builder()
                .season(season).teamCode(team).metric(metric).asOfWeek(asOfWeek)
                .version(version)
                .windowWeeks(settings.getWindowWeeks())
                .sampleSize(n)
                .bias(bias).zScore(z)
                .rawCorrection(raw)
                .correction(correction)
                .material(material)
                .createdAt(now)
                .build();
    }

    /**
     * Corrections actives pour une équipe avant les matchs de {@code week} :
     * dernière ligne par métrique avec asOfWeek < week.
     */
    public CorrectionSnapshot activeCorrections(String teamCode, int season, int week) {
        Map<CalibrationMetric, CalibrationRecord> latest = latestBefore(teamCode, season, week);
        if (latest.isEmpty()) {
            return CorrectionSnapshot.EMPTY;
        }
        Map<CalibrationMetric, Double> values = new EnumMap<>(CalibrationMetric.class);
        int sourceWeek = 0;
        for (CalibrationRecord r : latest.values()) {
            values.put(r.getMetric(), r.getCorrection());
            sourceWeek = Math.max(sourceWeek, r.getAsOfWeek());
        }
        return new CorrectionSnapshot(values, sourceWeek);
    }

    private Map<CalibrationMetric, CalibrationRecord> latestBefore(String teamCode, int season, int week) {
        Map<CalibrationMetric, CalibrationRecord> latest = new EnumMap<>(CalibrationMetric.class);
        // Trié par semaine décroissante : la première ligne vue par métrique est la plus récente
        for (CalibrationRecord r : calibrationRepository
                .findBySeasonAndTeamCodeAndAsOfWeekLessThanOrderByAsOfWeekDesc(season, teamCode, week)) {
            latest.putIfAbsent(r.getMetric(), r);
        }
        return latest;
    }

    /**
     * Écarts simulé - réel d'une équipe, par métrique, ramenés au modèle non corrigé :
     * la correction active au moment du match est retirée de chaque écart.
     */
    private static final class TeamHistory {
        final Set<Integer> weeks = new HashSet<>();
        final Map<CalibrationMetric, List<Double>> diffs = new EnumMap<>(CalibrationMetric.class);

        TeamHistory() {
            for (CalibrationMetric m : CalibrationMetric.values()) {
                diffs.put(m, new ArrayList<>());
            }
        }

        void add(BacktestRecord r, boolean home) {
            weeks.add(r.getWeek());
            AppliedCorrections applied = home ? r.getHomeCorrections() : r.getAwayCorrections();
            if (home) {
                addDiff(CalibrationMetric.POINTS_SCORED, r.getPredictedHomeScore() - r.getActualHomeScore(), applied);
                addDiff(CalibrationMetric.POINTS_ALLOWED, r.getPredictedAwayScore() - r.getActualAwayScore(), applied);
                addIfKnown(CalibrationMetric.OFFENSE_EPA, r.getSimHomeEpaPerPlay(), r.getActualHomeEpaPerPlay(), applied);
                addIfKnown(CalibrationMetric.PRESSURE_RATE, r.getSimHomePressureRate(), r.getActualHomePressureRate(), applied);
            } else {
                addDiff(CalibrationMetric.POINTS_SCORED, r.getPredictedAwayScore() - r.getActualAwayScore(), applied);
                addDiff(CalibrationMetric.POINTS_ALLOWED, r.getPredictedHomeScore() - r.getActualHomeScore(), applied);
                addIfKnown(CalibrationMetric.OFFENSE_EPA, r.getSimAwayEpaPerPlay(), r.getActualAwayEpaPerPlay(), applied);
                addIfKnown(CalibrationMetric.PRESSURE_RATE, r.getSimAwayPressureRate(), r.getActualAwayPressureRate(), applied);
            }
        }

        private void addDiff(CalibrationMetric metric, double diff, AppliedCorrections applied) {
            double correction = applied != null ? applied.get(metric) : 0.0;
            diffs.get(metric).add(diff - correction);
        }

        private void addIfKnown(CalibrationMetric metric, double simulated, Double actual, AppliedCorrections applied) {
            if (actual != null) {
                addDiff(metric, simulated - actual, applied);
            }
        }
    }
}
