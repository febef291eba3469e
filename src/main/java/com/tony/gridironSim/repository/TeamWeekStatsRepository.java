package com.tony.gridironSim.repository;

import com.tony.gridironSim.model.TeamWeekStats;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface TeamWeekStatsRepository extends JpaRepository<TeamWeekStats, Long> {

    Optional<TeamWeekStats> findByTeamCodeAndSeasonAndWeek(String teamCode, int season, int week);
}
