package com.tony.gridironSim.model.profile;

/**
 * Écarts de notes (attaque - défense) pour un sens de jeu.
 * Positif = avantage attaque. Nul quand un des deux camps n'a pas de notes.
 */
public record MatchupContext(double passProtection, double coverage, double runBlock) {

    public static final MatchupContext NEUTRAL = new MatchupContext(0.0, 0.0, 0.0);
}
