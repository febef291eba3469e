package com.tony.gridironSim.service;

import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.exception.DataUnavailableException;
import com.tony.gridironSim.exception.LookAheadViolationException;
import com.tony.gridironSim.model.CalibrationMetric;
import com.tony.gridironSim.model.TeamWeekStats;
import com.tony.gridironSim.model.profile.CorrectionSnapshot;
import com.tony.gridironSim.model.profile.GradedProfile;
import com.tony.gridironSim.model.profile.LeagueBaseline;
import com.tony.gridironSim.model.profile.ProxyProfile;
import com.tony.gridironSim.model.profile.SituationalOverrides;
import com.tony.gridironSim.model.profile.TeamProfile;
import com.tony.gridironSim.repository.TeamWeekStatsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class TeamProfileBuilder {

    private final TeamWeekStatsRepository statsRepository;
    private final CalibrationService calibrationService;

    public TeamProfile buildProfile(String teamCode, int season, int asOfWeek,
                                    EngineConfig config, SituationalOverrides overrides) {
        return buildProfile(teamCode, season, asOfWeek, config, overrides, null);
    }

    /**
     * Construit le profil d'une équipe tel que connu avant les matchs de {@code asOfWeek}.
     *
     * @param cutoff limite de décision (backtest) : une ligne publiée après est une fuite de données
     * @throws DataUnavailableException     aucune statistique pour cette équipe / semaine
     * @throws LookAheadViolationException  statistiques publiées après {@code cutoff}
     */
    public TeamProfile buildProfile(String teamCode, int season, int asOfWeek, EngineConfig config,
                                    SituationalOverrides overrides, LocalDateTime cutoff) {
        TeamWeekStats stats = statsRepository.findByTeamCodeAndSeasonAndWeek(teamCode, season, asOfWeek)
                .orElseThrow(() -> new DataUnavailableException(teamCode, season, asOfWeek));

        if (cutoff != null && stats.getAvailableAt() != null && stats.getAvailableAt().isAfter(cutoff)) {
            throw new LookAheadViolationException("stats " + teamCode + " S" + asOfWeek, stats.getAvailableAt(), cutoff);
        }
        SituationalOverrides context = overrides != null ? overrides : SituationalOverrides.NONE;
        if (context.getInjurySeverity() < 0 || context.getInjurySeverity() > 1) {
            throw new IllegalArgumentException("Sévérité de blessure hors [0,1] : " + context.getInjurySeverity());
        }

        // Empirical Bayes : en début de saison, on reste proche de la moyenne ligue
        double denominator = stats.getGamesPlayed() + config.getPriorGames();
        double w = denominator > 0 ? stats.getGamesPlayed() / denominator : 1.0;
        Shrinker s = new Shrinker(w);

        CorrectionSnapshot corrections = calibrationService.activeCorrections(teamCode, season, asOfWeek);
        double offEpa = s.apply(stats.getOffEpaPerPlay(), LeagueBaseline.EPA_PER_PLAY)
                + corrections.get(CalibrationMetric.OFFENSE_EPA)
                + corrections.get(CalibrationMetric.POINTS_SCORED) / config.getPlaysPerGame();
        double defEpa = s.apply(stats.getDefEpaPerPlay(), LeagueBaseline.EPA_PER_PLAY)
                + corrections.get(CalibrationMetric.POINTS_ALLOWED) / config.getPlaysPerGame();
        double pressureAllowed = clamp(s.apply(stats.getPressureRateAllowed(), LeagueBaseline.PRESSURE_RATE)
                + corrections.get(CalibrationMetric.PRESSURE_RATE), 0.02, 0.60);

        boolean graded = stats.getGrades() != null && stats.getGrades().isComplete();
        TeamProfile.TeamProfileBuilder<?, ?> builder;
        if (graded) {
            builder = GradedProfile.builder().grades(stats.getGrades());
        } else {
            builder = ProxyProfile.builder();
            log.info("⚠️ Notes avancées absentes pour {} (S{} sem. {}) : mode proxy", teamCode, season, asOfWeek);
        }

        builder.teamCode(teamCode);
        builder.season(season);
        builder.week(asOfWeek);
        builder.gamesPlayed(stats.getGamesPlayed());
        builder.offEpaPerPlay(offEpa);
        builder.defEpaPerPlay(defEpa);
        builder.offSuccessRate(s.apply(stats.getOffSuccessRate(), LeagueBaseline.SUCCESS_RATE));
        builder.defSuccessRate(s.apply(stats.getDefSuccessRate(), LeagueBaseline.SUCCESS_RATE));
        builder.rushSuccessRate(s.apply(stats.getRushSuccessRate(), LeagueBaseline.RUSH_SUCCESS_RATE));
        builder.completionRate(s.apply(stats.getCompletionRate(), LeagueBaseline.COMPLETION_RATE));
        builder.yardsPerCompletion(s.apply(stats.getYardsPerCompletion(), LeagueBaseline.YARDS_PER_COMPLETION));
        builder.yardsPerCarry(s.apply(stats.getYardsPerCarry(), LeagueBaseline.YARDS_PER_CARRY));
        builder.explosivePassRate(s.apply(stats.getExplosivePassRate(), LeagueBaseline.EXPLOSIVE_PASS_RATE));
        builder.interceptionRate(s.apply(stats.getInterceptionRate(), LeagueBaseline.INTERCEPTION_RATE));
        builder.fumbleRate(s.apply(stats.getFumbleRate(), LeagueBaseline.FUMBLE_RATE));
        builder.pressureRateAllowed(pressureAllowed);
        builder.pressureRateGenerated(s.apply(stats.getPressureRateGenerated(), LeagueBaseline.PRESSURE_RATE));
        builder.redZoneTdRate(s.apply(stats.getRedZoneTdRate(), LeagueBaseline.RED_ZONE_TD_RATE));
        builder.goalLineTdRate(s.apply(stats.getGoalLineTdRate(), LeagueBaseline.GOAL_LINE_TD_RATE));
        builder.fourthDownAggressiveness(s.apply(stats.getFourthDownAggressiveness(), LeagueBaseline.FOURTH_DOWN_AGGRESSIVENESS));
        builder.fieldGoalPct(s.apply(stats.getFieldGoalPct(), LeagueBaseline.FIELD_GOAL_PCT));
        builder.netPuntAverage(s.apply(stats.getNetPuntAverage(), LeagueBaseline.NET_PUNT_AVERAGE));
        builder.kickReturnStart(s.apply(stats.getKickReturnStart(), LeagueBaseline.KICK_RETURN_START));
        builder.secondsPerPlay(s.apply(stats.getSecondsPerPlay(), LeagueBaseline.SECONDS_PER_PLAY));
        builder.neutralPassRate(s.apply(stats.getNeutralPassRate(), LeagueBaseline.NEUTRAL_PASS_RATE));
        builder.overrides(context);
        builder.corrections(corrections);

        TeamProfile profile = builder.build();
        log.debug("Profil {} S{} sem. {} : mode={}, poids observé={}, corrections={}",
                teamCode, season, asOfWeek, profile.mode(), String.format("%.2f", w), corrections.corrections());
        return profile;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /** Lissage vers le prior ligue ; une stat absente vaut le prior. */
    private record Shrinker(double weight) {
        double apply(Double observed, double prior) {
            return observed == null ? prior : weight * observed + (1 - weight) * prior;
        }
    }
}
