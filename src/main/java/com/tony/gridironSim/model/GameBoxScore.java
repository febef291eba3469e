package com.tony.gridironSim.model;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Réalisé d'une équipe sur un match (rempli après le coup de sifflet final).
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameBoxScore {
    private Integer offensivePlays;
    private Double epaPerPlay;
    private Double pressureRate;
    private Integer sacks;
}
