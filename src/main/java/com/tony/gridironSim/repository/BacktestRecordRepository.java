package com.tony.gridironSim.repository;

import com.tony.gridironSim.model.BacktestRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface BacktestRecordRepository extends JpaRepository<BacktestRecord, Long> {

    List<BacktestRecord> findBySeasonAndWeekBetweenOrderByWeekAsc(int season, int fromWeek, int toWeek);

    Optional<BacktestRecord> findByGameId(Long gameId);
}
