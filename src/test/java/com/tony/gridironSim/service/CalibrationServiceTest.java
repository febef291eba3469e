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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.data.Offset.offset;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CalibrationServiceTest {

    @Mock
    private BacktestRecordRepository backtestRepository;

    @Mock
    private CalibrationRecordRepository calibrationRepository;

    @InjectMocks
    private CalibrationService service;

    private final CalibrationSettings settings = CalibrationSettings.defaults();

    /** KC à domicile ; la marge simulé - réel sur les points marqués vaut {@code scoredDiff}. */
    private static BacktestRecord kcHome(int week, String opponent, int scoredDiff) {
        return BacktestRecord.builder()
                .gameId((long) week).season(2024).week(week)
                .homeTeam("KC").awayTeam(opponent)
                .predictedHomeScore(24 + scoredDiff).actualHomeScore(24)
                .predictedAwayScore(20).actualAwayScore(20)
                .build();
    }

    /** KC à domicile, simulé avec une correction POINTS_SCORED de {@code applied} déjà active. */
    private static BacktestRecord kcHomeCorrected(int week, String opponent, double scoredDiff, double applied,
                                                  int sourceWeek) {
        return BacktestRecord.builder()
                .gameId((long) week).season(2024).week(week)
                .homeTeam("KC").awayTeam(opponent)
                .predictedHomeScore(24 + scoredDiff).actualHomeScore(24)
                .predictedAwayScore(20).actualAwayScore(20)
                .homeCorrections(AppliedCorrections.builder().pointsScored(applied).sourceWeek(sourceWeek).build())
                .build();
    }

    private static List<BacktestRecord> overEstimatedHistory() {
        return List.of(kcHome(3, "LV", 29), kcHome(4, "DEN", 30), kcHome(5, "LAC", 31), kcHome(6, "CIN", 30));
    }

    private void stubFreshWeek(List<BacktestRecord> history) {
        when(calibrationRepository.existsBySeasonAndAsOfWeek(2024, 6)).thenReturn(false);
        when(backtestRepository.findBySeasonAndWeekBetweenOrderByWeekAsc(2024, 3, 6)).thenReturn(history);
        when(calibrationRepository.saveAll(ArgumentMatchers.<CalibrationRecord>anyList()))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static CalibrationRecord find(CalibrationResult result, String team, CalibrationMetric metric) {
        return result.getRecords().stream()
                .filter(r -> r.getTeamCode().equals(team) && r.getMetric() == metric)
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("Biais significatif : correction amortie puis bornée")
    void materialBiasIsClamped() {
        // ARRANGE
        stubFreshWeek(overEstimatedHistory());

        // ACT
        CalibrationResult result = service.calibrate(2024, 6, settings);

        // ASSERT : biais +30, -0.5 * 30 = -15, borné à -2
        CalibrationRecord scored = find(result, "KC", CalibrationMetric.POINTS_SCORED);
        assertThat(scored.getBias()).isCloseTo(30.0, offset(1e-9));
        assertThat(scored.isMaterial()).isTrue();
        assertThat(scored.getRawCorrection()).isCloseTo(-15.0, offset(1e-9));
        assertThat(scored.getCorrection()).isCloseTo(-2.0, offset(1e-9));
        assertThat(scored.getVersion()).isEqualTo(1);
        assertThat(scored.getSampleSize()).isEqualTo(4);
    }

    @Test
    @DisplayName("Équipes sans historique suffisant ignorées, sans ligne écrite")
    void teamsWithShortHistoryAreSkipped() {
        stubFreshWeek(overEstimatedHistory());

        CalibrationResult result = service.calibrate(2024, 6, settings);

        assertThat(result.getTeamOutcomes())
                .containsEntry("KC", CalibrationOutcome.CALIBRATED)
                .containsEntry("DEN", CalibrationOutcome.SKIPPED_INSUFFICIENT_HISTORY);
        assertThat(result.skippedTeams()).isEqualTo(4);
        assertThat(result.getRecords())
                .hasSize(CalibrationMetric.values().length)
                .allMatch(r -> r.getTeamCode().equals("KC"));
    }

    @Test
    @DisplayName("Biais non significatif : la correction précédente est reconduite")
    void noiseCarriesPreviousCorrection() {
        stubFreshWeek(overEstimatedHistory());
        CalibrationRecord previous = CalibrationRecord.builder()
                .season(2024).teamCode("KC").metric(CalibrationMetric.POINTS_ALLOWED)
                .asOfWeek(5).version(2).correction(0.5)
                .build();
        when(calibrationRepository.findBySeasonAndTeamCodeAndAsOfWeekLessThanOrderByAsOfWeekDesc(2024, "KC", 6))
                .thenReturn(List.of(previous));

        CalibrationResult result = service.calibrate(2024, 6, settings);

        CalibrationRecord allowed = find(result, "KC", CalibrationMetric.POINTS_ALLOWED);
        assertThat(allowed.isMaterial()).isFalse();
        assertThat(allowed.getCorrection()).isCloseTo(0.5, offset(1e-9));
        assertThat(allowed.getVersion()).isEqualTo(3);
    }

    @Test
    @DisplayName("Métrique sans donnée réelle : aucun échantillon, aucune correction")
    void metricWithoutObservationsStaysNeutral() {
        stubFreshWeek(overEstimatedHistory());

        CalibrationResult result = service.calibrate(2024, 6, settings);

        CalibrationRecord pressure = find(result, "KC", CalibrationMetric.PRESSURE_RATE);
        assertThat(pressure.getSampleSize()).isZero();
        assertThat(pressure.isMaterial()).isFalse();
        assertThat(pressure.getCorrection()).isZero();
    }

    @Test
    @DisplayName("Une semaine déjà calibrée n'est jamais réécrite")
    void refusesSecondPass() {
        CalibrationRecord existing = CalibrationRecord.builder()
                .season(2024).teamCode("KC").metric(CalibrationMetric.POINTS_SCORED).asOfWeek(6).correction(-1.0)
                .build();
        when(calibrationRepository.existsBySeasonAndAsOfWeek(2024, 6)).thenReturn(true);
        when(calibrationRepository.findBySeasonAndAsOfWeek(2024, 6)).thenReturn(List.of(existing));

        CalibrationResult result = service.calibrate(2024, 6, settings);

        assertThat(result.isAlreadyCalibrated()).isTrue();
        assertThat(result.getRecords()).containsExactly(existing);
        verify(calibrationRepository, never()).saveAll(ArgumentMatchers.<CalibrationRecord>anyList());
    }

    @Test
    @DisplayName("Corrections actives : la plus récente strictement antérieure, par métrique")
    void activeCorrectionsUseLatestPriorWeek() {
        CalibrationRecord week5 = CalibrationRecord.builder()
                .season(2024).teamCode("KC").metric(CalibrationMetric.OFFENSE_EPA).asOfWeek(5).correction(0.03)
                .build();
        CalibrationRecord week4 = CalibrationRecord.builder()
                .season(2024).teamCode("KC").metric(CalibrationMetric.OFFENSE_EPA).asOfWeek(4).correction(0.01)
                .build();
        when(calibrationRepository.findBySeasonAndTeamCodeAndAsOfWeekLessThanOrderByAsOfWeekDesc(2024, "KC", 6))
                .thenReturn(List.of(week5, week4));

        CorrectionSnapshot snapshot = service.activeCorrections("KC", 2024, 6);

        assertThat(snapshot.get(CalibrationMetric.OFFENSE_EPA)).isCloseTo(0.03, offset(1e-9));
        assertThat(snapshot.get(CalibrationMetric.POINTS_SCORED)).isZero();
        assertThat(snapshot.sourceWeek()).isEqualTo(5);
    }

    @Test
    @DisplayName("Aucun historique de calibration : snapshot vide")
    void noHistoryGivesEmptySnapshot() {
        assertThat(service.activeCorrections("KC", 2024, 1)).isEqualTo(CorrectionSnapshot.EMPTY);
    }

    @Test
    @DisplayName("Fenêtre mêlant semaines corrigées et non corrigées : le biais déjà corrigé n'est pas recompté")
    void correctionIsNotCompoundedAcrossOverlappingWindows() {
        // ARRANGE : semaines 4-6 sans correction (biais +1), semaine 7 simulée avec -0.5 (reste +0.5)
        List<BacktestRecord> history = List.of(
                kcHomeCorrected(4, "LV", 0.8, 0.0, 0),
                kcHomeCorrected(5, "DEN", 1.0, 0.0, 0),
                kcHomeCorrected(6, "LAC", 1.2, 0.0, 0),
                kcHomeCorrected(7, "CIN", 0.5, -0.5, 6));
        CalibrationRecord week6 = CalibrationRecord.builder()
                .season(2024).teamCode("KC").metric(CalibrationMetric.POINTS_SCORED)
                .asOfWeek(6).version(1).correction(-0.5)
                .build();
        when(calibrationRepository.existsBySeasonAndAsOfWeek(2024, 7)).thenReturn(false);
        when(backtestRepository.findBySeasonAndWeekBetweenOrderByWeekAsc(2024, 4, 7)).thenReturn(history);
        when(calibrationRepository.findBySeasonAndTeamCodeAndAsOfWeekLessThanOrderByAsOfWeekDesc(2024, "KC", 7))
                .thenReturn(List.of(week6));
        when(calibrationRepository.saveAll(ArgumentMatchers.<CalibrationRecord>anyList()))
                .thenAnswer(invocation -> invocation.getArgument(0));

        // ACT
        CalibrationResult result = service.calibrate(2024, 7, settings);

        // ASSERT : biais hors correction +1, correction -0.5 (et non -0.5 + -0.5 * 0.875)
        CalibrationRecord scored = find(result, "KC", CalibrationMetric.POINTS_SCORED);
        assertThat(scored.getBias()).isCloseTo(1.0, offset(1e-9));
        assertThat(scored.isMaterial()).isTrue();
        assertThat(scored.getCorrection()).isCloseTo(-0.5, offset(1e-9));
        assertThat(scored.getVersion()).isEqualTo(2);
    }

    @Test
    @DisplayName("Biais persistant : la correction reste stable d'une semaine sur l'autre")
    void stableBiasGivesStableCorrection() {
        // ARRANGE : même biais brut +1 chaque semaine, semaines 5 à 7 déjà corrigées de -0.5
        List<BacktestRecord> history = List.of(
                kcHomeCorrected(5, "DEN", 0.4, -0.5, 4),
                kcHomeCorrected(6, "LAC", 0.5, -0.5, 5),
                kcHomeCorrected(7, "CIN", 0.6, -0.5, 6));
        CalibrationSettings narrow = settings.toBuilder().windowWeeks(3).build();
        CalibrationRecord week6 = CalibrationRecord.builder()
                .season(2024).teamCode("KC").metric(CalibrationMetric.POINTS_SCORED)
                .asOfWeek(6).version(3).correction(-0.5)
                .build();
        when(calibrationRepository.existsBySeasonAndAsOfWeek(2024, 7)).thenReturn(false);
        when(backtestRepository.findBySeasonAndWeekBetweenOrderByWeekAsc(2024, 5, 7)).thenReturn(history);
        when(calibrationRepository.findBySeasonAndTeamCodeAndAsOfWeekLessThanOrderByAsOfWeekDesc(2024, "KC", 7))
                .thenReturn(List.of(week6));
        when(calibrationRepository.saveAll(ArgumentMatchers.<CalibrationRecord>anyList()))
                .thenAnswer(invocation -> invocation.getArgument(0));

        // ACT
        CalibrationResult result = service.calibrate(2024, 7, narrow);

        // ASSERT
        CalibrationRecord scored = find(result, "KC", CalibrationMetric.POINTS_SCORED);
        assertThat(scored.getBias()).isCloseTo(1.0, offset(1e-9));
        assertThat(scored.getCorrection()).isCloseTo(-0.5, offset(1e-9));
    }
}
