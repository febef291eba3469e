package com.tony.gridironSim.repository;

import com.tony.gridironSim.model.CalibrationRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CalibrationRecordRepository extends JpaRepository<CalibrationRecord, Long> {

    boolean existsBySeasonAndAsOfWeek(int season, int asOfWeek);

    List<CalibrationRecord> findBySeasonAndAsOfWeek(int season, int asOfWeek);

    // Historique strictement antérieur à la semaine : jamais de correction rétroactive
    List<CalibrationRecord> findBySeasonAndTeamCodeAndAsOfWeekLessThanOrderByAsOfWeekDesc(
            int season, String teamCode, int week);
}
