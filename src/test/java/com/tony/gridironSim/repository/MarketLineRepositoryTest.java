package com.tony.gridironSim.repository;

import com.tony.gridironSim.model.Game;
import com.tony.gridironSim.model.MarketLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class MarketLineRepositoryTest {

    private static final LocalDateTime KICKOFF = LocalDateTime.of(2024, 9, 8, 13, 0);

    @Autowired
    private MarketLineRepository marketLineRepository;

    @Autowired
    private GameRepository gameRepository;

    private static MarketLine line(Long gameId, double spread, LocalDateTime capturedAt) {
        return MarketLine.builder().gameId(gameId).spread(spread).total(44.5).capturedAt(capturedAt).source("close").build();
    }

    @Test
    @DisplayName("Seules les lignes connues avant la limite sont renvoyées, de l'ouverture à la clôture")
    void linesAreBoundedByCutoff() {
        marketLineRepository.saveAll(List.of(
                line(1L, -3.5, KICKOFF.minusHours(2)),
                line(1L, -2.5, KICKOFF.minusDays(5)),
                line(1L, -7.0, KICKOFF.plusHours(1)),
                line(2L, 1.5, KICKOFF.minusDays(1))));

        List<MarketLine> lines = marketLineRepository.findAvailableLines(1L, KICKOFF);

        assertThat(lines).extracting(MarketLine::getSpread).containsExactly(-2.5, -3.5);
    }

    @Test
    @DisplayName("Matchs terminés d'une plage de semaines, dans l'ordre chronologique")
    void completedGamesInRange() {
        gameRepository.saveAll(List.of(
                Game.builder().season(2024).week(2).homeTeam("KC").awayTeam("CIN").kickoff(KICKOFF.plusDays(7))
                        .homeScore(26).awayScore(25).build(),
                Game.builder().season(2024).week(1).homeTeam("PHI").awayTeam("GB").kickoff(KICKOFF.minusDays(2))
                        .homeScore(34).awayScore(29).build(),
                Game.builder().season(2024).week(2).homeTeam("BUF").awayTeam("MIA").kickoff(KICKOFF.plusDays(4))
                        .build(),
                Game.builder().season(2024).week(3).homeTeam("DAL").awayTeam("BAL").kickoff(KICKOFF.plusDays(14))
                        .homeScore(25).awayScore(28).build()));

        List<Game> games = gameRepository.findCompletedGames(2024, 1, 2);

        assertThat(games).extracting(Game::getHomeTeam).containsExactly("PHI", "KC");
        assertThat(gameRepository.findTopByHomeScoreIsNotNullAndKickoffBeforeOrderByKickoffDesc(KICKOFF.plusDays(10)))
                .get().extracting(Game::getHomeTeam).isEqualTo("KC");
    }
}
