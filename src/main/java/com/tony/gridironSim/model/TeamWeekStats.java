package com.tony.gridironSim.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Statistiques d'efficacité cumulées d'une équipe, telles que connues à une semaine donnée.
 * Table écrite par le pipeline d'ingestion (hors périmètre).
 */
@Entity
@Table(name = "team_week_stats",
        uniqueConstraints = @UniqueConstraint(columnNames = {"teamCode", "season", "week"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamWeekStats {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 4)
    private String teamCode;
    private int season;
    private int week;

    private int gamesPlayed;

    // Horodatage de publication : sert de garde-fou anti look-ahead en backtest
    private LocalDateTime availableAt;

    // --- Efficacité (EPA/jeu) ---
    private Double offEpaPerPlay;
    private Double defEpaPerPlay;       // EPA concédé par jeu
    private Double offSuccessRate;
    private Double defSuccessRate;
    private Double rushSuccessRate;

    // --- Passe / Course ---
    private Double completionRate;
    private Double yardsPerCompletion;
    private Double yardsPerCarry;
    private Double explosivePassRate;
    private Double interceptionRate;
    private Double fumbleRate;

    // --- Pression ---
    private Double pressureRateAllowed;
    private Double pressureRateGenerated;

    // --- Situations ---
    private Double redZoneTdRate;
    private Double goalLineTdRate;
    private Double fourthDownAggressiveness;

    // --- Équipes spéciales ---
    private Double fieldGoalPct;
    private Double netPuntAverage;
    private Double kickReturnStart;

    // --- Rythme ---
    private Double secondsPerPlay;
    private Double neutralPassRate;

    @Embedded
    private UnitGrades grades;
}
