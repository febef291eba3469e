package com.tony.gridironSim.repository;

import com.tony.gridironSim.model.MarketLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface MarketLineRepository extends JpaRepository<MarketLine, Long> {

    // Lignes connues à la date limite, de la plus ancienne (ouverture) à la plus récente (clôture)
    @Query("SELECT l FROM MarketLine l WHERE l.gameId = :gameId AND l.capturedAt <= :cutoff " +
            "ORDER BY l.capturedAt ASC, l.id ASC")
    List<MarketLine> findAvailableLines(@Param("gameId") Long gameId, @Param("cutoff") LocalDateTime cutoff);
}
