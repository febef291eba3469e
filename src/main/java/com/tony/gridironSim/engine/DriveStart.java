package com.tony.gridironSim.engine;

/**
 * Début de drive : sur coup d'envoi, ou à une position donnée (repère de l'attaque).
 */
public record DriveStart(boolean fromKickoff, int yardline) {

    public static DriveStart kickoff() {
        return new DriveStart(true, 0);
    }

    public static DriveStart at(int yardline) {
        if (yardline < 1 || yardline > 99) {
            throw new IllegalArgumentException("Position de départ invalide : " + yardline);
        }
        return new DriveStart(false, yardline);
    }
}
