package com.tony.gridironSim.repository;

import com.tony.gridironSim.model.Game;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface GameRepository extends JpaRepository<Game, Long> {

    // Matchs joués (score connu) d'une plage de semaines, dans l'ordre chronologique
    @Query("SELECT g FROM Game g WHERE g.season = :season AND g.week BETWEEN :fromWeek AND :toWeek " +
            "AND g.homeScore IS NOT NULL AND g.awayScore IS NOT NULL " +
            "ORDER BY g.week ASC, g.kickoff ASC, g.id ASC")
    List<Game> findCompletedGames(@Param("season") int season,
                                  @Param("fromWeek") int fromWeek,
                                  @Param("toWeek") int toWeek);

    // Dernier match terminé avant une date (pour le job hebdo)
    Optional<Game> findTopByHomeScoreIsNotNullAndKickoffBeforeOrderByKickoffDesc(LocalDateTime before);
}
