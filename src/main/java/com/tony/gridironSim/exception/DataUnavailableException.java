package com.tony.gridironSim.exception;

import lombok.Getter;

/**
 * Aucune statistique pour l'équipe à la semaine demandée (bye, semaine future...).
 * On ne retombe jamais sur une équipe "moyenne ligue" à la place.
 */
@Getter
public class DataUnavailableException extends RuntimeException {

    private final String teamCode;
    private final int season;
    private final int week;

    public DataUnavailableException(String teamCode, int season, int week) {
        super(String.format("Aucune statistique pour %s (saison %d, semaine %d)", teamCode, season, week));
        this.teamCode = teamCode;
        this.season = season;
        this.week = week;
    }
}
