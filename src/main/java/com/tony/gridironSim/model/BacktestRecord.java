package com.tony.gridironSim.model;

import com.tony.gridironSim.model.sim.ConvictionTier;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Une ligne par match rejoué : prédiction, réalité, paris et leur résultat.
 * Sert aussi d'historique à la calibration.
 */
@Entity
@Table(name = "backtest_record", indexes = @Index(columnList = "season, week"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long gameId;
    private int season;
    private int week;
    @Column(length = 4)
    private String homeTeam;
    @Column(length = 4)
    private String awayTeam;

    // --- Prédiction vs réalité ---
    private double predictedHomeScore;
    private double predictedAwayScore;
    private int actualHomeScore;
    private int actualAwayScore;
    private double marginError;
    private double totalError;
    private double homeWinProbability;

    // --- Efficacité simulée vs réelle (alimente la calibration) ---
    private double simHomeEpaPerPlay;
    private double simAwayEpaPerPlay;
    private Double actualHomeEpaPerPlay;
    private Double actualAwayEpaPerPlay;
    private double simHomePressureRate;
    private double simAwayPressureRate;
    private Double actualHomePressureRate;
    private Double actualAwayPressureRate;

    // --- Corrections actives lors de la simulation (null = aucune) ---
    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "pointsScored", column = @Column(name = "home_corr_points_scored")),
            @AttributeOverride(name = "pointsAllowed", column = @Column(name = "home_corr_points_allowed")),
            @AttributeOverride(name = "offenseEpa", column = @Column(name = "home_corr_offense_epa")),
            @AttributeOverride(name = "pressureRate", column = @Column(name = "home_corr_pressure_rate")),
            @AttributeOverride(name = "sourceWeek", column = @Column(name = "home_corr_source_week"))
    })
    private AppliedCorrections homeCorrections;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "pointsScored", column = @Column(name = "away_corr_points_scored")),
            @AttributeOverride(name = "pointsAllowed", column = @Column(name = "away_corr_points_allowed")),
            @AttributeOverride(name = "offenseEpa", column = @Column(name = "away_corr_offense_epa")),
            @AttributeOverride(name = "pressureRate", column = @Column(name = "away_corr_pressure_rate")),
            @AttributeOverride(name = "sourceWeek", column = @Column(name = "away_corr_source_week"))
    })
    private AppliedCorrections awayCorrections;

    @Enumerated(EnumType.STRING)
    private ConvictionTier conviction;

    // --- Pari écart ---
    @Enumerated(EnumType.STRING)
    private BetSide spreadPick;
    private Double placedSpread;
    private Double closingSpread;
    @Enumerated(EnumType.STRING)
    private BetGrade spreadGrade;
    private Boolean spreadBeatClose;

    // --- Pari total ---
    @Enumerated(EnumType.STRING)
    private BetSide totalPick;
    private Double placedTotal;
    private Double closingTotal;
    @Enumerated(EnumType.STRING)
    private BetGrade totalGrade;
    private Boolean totalBeatClose;

    private double profitUnits;

    // --- Calibration des probabilités (z borné, probas hors pushes) ---
    private Double spreadZ;
    private Double rawHomeCoverProbability;
    private Double calibratedHomeCoverProbability;
    private Double totalZ;
    private Double rawOverProbability;
    private Double calibratedOverProbability;

    private LocalDateTime createdAt;
}
