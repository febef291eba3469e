package com.tony.gridironSim.job;

import com.tony.gridironSim.config.CalibrationProperties;
import com.tony.gridironSim.model.Game;
import com.tony.gridironSim.model.dto.BacktestReport;
import com.tony.gridironSim.model.dto.CalibrationResult;
import com.tony.gridironSim.repository.GameRepository;
import com.tony.gridironSim.service.BacktestingService;
import com.tony.gridironSim.service.CalibrationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class WeeklyCalibrationJob {

    private final GameRepository gameRepository;
    private final BacktestingService backtestingService;
    private final CalibrationService calibrationService;
    private final CalibrationProperties calibrationProperties;

    /**
     * Mardi matin : tous les matchs de la semaine (jeudi -> lundi soir) sont joués.
     * 1. Backtest de la dernière semaine terminée (alimente l'historique simulé vs réel)
     * 2. Passe de calibration unique pour cette semaine
     */
    @Scheduled(cron = "${calibration.cron:0 0 6 * * TUE}")
    public void runWeekly() {
        log.info("⏰ [CRON] Démarrage : backtest + calibration hebdomadaire...");
        try {
            Optional<Game> last = gameRepository.findTopByHomeScoreIsNotNullAndKickoffBeforeOrderByKickoffDesc(LocalDateTime.now());
            if (last.isEmpty()) {
                log.info("   -> Aucun match terminé, rien à calibrer.");
                return;
            }
            int season = last.get().getSeason();
            int week = last.get().getWeek();

            BacktestReport report = backtestingService.runBacktest(season, week, week);
            log.info("   -> Backtest S{} sem. {} : {} matchs", season, week, report.getGamesEvaluated());

            CalibrationResult result = calibrationService.calibrate(season, week, calibrationProperties.toSettings());
            if (result.isAlreadyCalibrated()) {
                log.info("   -> Semaine déjà calibrée, corrections inchangées.");
            } else {
                log.info("   -> {} corrections écrites, {} équipe(s) ignorée(s)", result.getRecords().size(), result.skippedTeams());
            }
            log.info("✅ [CRON] Calibration hebdomadaire terminée.");
        } catch (Exception e) {
            log.error("❌ [CRON] Echec de la calibration hebdomadaire", e);
        }
    }
}
