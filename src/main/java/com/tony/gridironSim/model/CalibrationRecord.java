package com.tony.gridironSim.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Correction de biais par équipe et métrique, écrite une seule fois par semaine.
 * Seules les semaines suivantes la consomment (jamais rétroactif).
 */
@Entity
@Table(name = "calibration_record",
        uniqueConstraints = @UniqueConstraint(columnNames = {"season", "teamCode", "metric", "asOfWeek"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private int season;
    @Column(nullable = false, length = 4)
    private String teamCode;
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CalibrationMetric metric;
    private int asOfWeek;

    private int version;
    private int windowWeeks;
    private int sampleSize;

    private double bias;            // simulé (hors correction) - réel
    private double zScore;
    private double rawCorrection;   // -damping * biais, avant bornage
    private double correction;      // correction active, bornée
    private boolean material;

    private LocalDateTime createdAt;
}
