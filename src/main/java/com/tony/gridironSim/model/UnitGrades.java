package com.tony.gridironSim.model;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.stream.Stream;

/**
 * Notes d'unités (0-100) fournies par un service externe.
 * Toute note manquante ou négative = pas de notes avancées pour la semaine.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnitGrades {

    public static final double ABSENT_GRADE = -1.0;

    private Double passBlock;
    private Double passRush;
    private Double runBlock;
    private Double runDefense;
    private Double receiving;
    private Double coverage;

    public boolean isComplete() {
        return Stream.of(passBlock, passRush, runBlock, runDefense, receiving, coverage)
                .allMatch(g -> g != null && g >= 0);
    }
}
