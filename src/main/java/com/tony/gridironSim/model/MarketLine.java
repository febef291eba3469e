package com.tony.gridironSim.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Ligne de marché capturée à un instant donné.
 * Spread du point de vue domicile : -3.5 = domicile favori de 3.5 points.
 */
@Entity
@Table(name = "market_line", indexes = @Index(columnList = "gameId, capturedAt"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketLine {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long gameId;

    private Double spread;
    private Double total;

    @Column(nullable = false)
    private LocalDateTime capturedAt;

    private String source;
}
