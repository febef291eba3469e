package com.tony.gridironSim.service;

import com.tony.gridironSim.config.BacktestProperties;
import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.config.SimulationProperties;
import com.tony.gridironSim.exception.DataUnavailableException;
import com.tony.gridironSim.model.Game;
import com.tony.gridironSim.model.MarketLine;
import com.tony.gridironSim.model.dto.BetRecommendation;
import com.tony.gridironSim.model.dto.GamePrediction;
import com.tony.gridironSim.model.profile.RestCondition;
import com.tony.gridironSim.model.profile.SituationalOverrides;
import com.tony.gridironSim.model.profile.TeamProfile;
import com.tony.gridironSim.model.profile.WeatherSeverity;
import com.tony.gridironSim.model.sim.PredictionStatus;
import com.tony.gridironSim.model.sim.SimulationBatch;
import com.tony.gridironSim.model.sim.SimulationRequest;
import com.tony.gridironSim.repository.GameRepository;
import com.tony.gridironSim.repository.MarketLineRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Chaîne complète pour un match à venir : profils, matchups, batch Monte Carlo, recommandations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PredictionService {

    private final GameRepository gameRepository;
    private final MarketLineRepository marketLineRepository;
    private final TeamProfileBuilder profileBuilder;
    private final MatchupResolver matchupResolver;
    private final MonteCarloRunner runner;
    private final BetGradingService bettingService;
    private final SimulationProperties simulationProperties;
    private final BacktestProperties backtestProperties;

    public GamePrediction predict(Long gameId) {
        Game game = gameRepository.findById(gameId)
                .orElseThrow(() -> new IllegalArgumentException("Match introuvable : " + gameId));

        List<MarketLine> lines = marketLineRepository.findAvailableLines(gameId, LocalDateTime.now());
        Double spread = null;
        Double total = null;
        // Dernière ligne connue pour chaque marché
        for (MarketLine line : lines) {
            if (line.getSpread() != null) spread = line.getSpread();
            if (line.getTotal() != null) total = line.getTotal();
        }
        return predict(game, simulationProperties.toEngineConfig(), null, spread, total);
    }

    public GamePrediction predict(Game game, EngineConfig config, Long seed, Double spread, Double total) {
        GamePrediction.GamePredictionBuilder prediction = GamePrediction.builder()
                .gameId(game.getId())
                .homeTeam(game.getHomeTeam())
                .awayTeam(game.getAwayTeam())
                .season(game.getSeason())
                .week(game.getWeek());

        TeamProfile home;
        TeamProfile away;
        try {
            home = profileBuilder.buildProfile(game.getHomeTeam(), game.getSeason(), game.getWeek(), config, overrides(game, true));
            away = profileBuilder.buildProfile(game.getAwayTeam(), game.getSeason(), game.getWeek(), config, overrides(game, false));
        } catch (DataUnavailableException e) {
            log.warn("❌ Pas de prédiction pour {} @ {} : {}", game.getAwayTeam(), game.getHomeTeam(), e.getMessage());
            return prediction.status(PredictionStatus.NO_PREDICTION).message(e.getMessage()).build();
        }

        SimulationRequest request = SimulationRequest.builder()
                .home(home)
                .away(away)
                .homeMatchup(matchupResolver.resolve(home, away, config))
                .awayMatchup(matchupResolver.resolve(away, home, config))
                .config(config)
                .seed(seed)
                .spread(spread)
                .total(total)
                .build();
        SimulationBatch batch = runner.run(request);

        boolean proxy = !home.hasAdvancedGrades() || !away.hasAdvancedGrades();
        PredictionStatus status = batch.isDegraded() || proxy
                ? PredictionStatus.LOW_CONFIDENCE
                : PredictionStatus.FULL_CONFIDENCE;
        BetRecommendation recommendation = bettingService.recommend(batch, spread, total,
                backtestProperties.getSpreadEdge(), backtestProperties.getTotalEdge());

        return prediction.status(status)
                .homeMode(home.mode())
                .awayMode(away.mode())
                .batch(batch)
                .recommendation(recommendation)
                .build();
    }

    static SituationalOverrides overrides(Game game, boolean home) {
        RestCondition rest = home ? game.getHomeRest() : game.getAwayRest();
        Double injury = home ? game.getHomeInjurySeverity() : game.getAwayInjurySeverity();
        return SituationalOverrides.builder()
                .weather(game.getWeather() != null ? game.getWeather() : WeatherSeverity.NONE)
                .rest(rest != null ? rest : RestCondition.NORMAL)
                .injurySeverity(injury != null ? injury : 0.0)
                .build();
    }
}
