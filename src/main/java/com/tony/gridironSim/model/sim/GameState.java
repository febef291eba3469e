package com.tony.gridironSim.model.sim;

import lombok.Getter;

/**
 * État mutable d'un essai. Une instance par essai, jamais partagée entre threads.
 * yardline : 0 = propre ligne de but de l'attaque, 100 = en-but adverse.
 */
@Getter
public class GameState {

    public static final int QUARTER_SECONDS = 900;
    public static final int OVERTIME_QUARTER = 5;
    public static final int OVERTIME_SECONDS = 600;
    private static final int TIMEOUTS_PER_HALF = 3;
    private static final int TIMEOUTS_OVERTIME = 2;

    private int homeScore;
    private int awayScore;

    private int quarter = 1;
    private int clock = QUARTER_SECONDS;

    private Possession possession = Possession.HOME;
    private int down = 1;
    private int toGo = 10;
    private int yardline = 25;

    private int homeTimeouts = TIMEOUTS_PER_HALF;
    private int awayTimeouts = TIMEOUTS_PER_HALF;

    private int driveCount;
    private int playCount;

    // --- Score ---

    public void addPoints(Possession team, int points) {
        if (points < 0) {
            throw new IllegalArgumentException("Un score ne peut pas diminuer : " + points);
        }
        if (team == Possession.HOME) homeScore += points;
        else awayScore += points;
    }

    public int scoreOf(Possession team) {
        return team == Possession.HOME ? homeScore : awayScore;
    }

    /** Écart du point de vue de l'attaque (positif = l'attaque mène). */
    public int offenseLead() {
        return scoreOf(possession) - scoreOf(possession.opposite());
    }

    // --- Horloge ---

    public void tick(int seconds) {
        clock = Math.max(0, clock - Math.max(0, seconds));
        // Fin de 1er/3e quart-temps : le drive continue dans le quart suivant
        if (clock == 0 && (quarter == 1 || quarter == 3)) {
            quarter++;
            clock = QUARTER_SECONDS;
        }
    }

    public boolean isHalfOver() {
        return clock == 0 && (quarter == 2 || quarter == 4 || quarter == OVERTIME_QUARTER);
    }

    public int secondsLeftInHalf() {
        return (quarter == 1 || quarter == 3) ? clock + QUARTER_SECONDS : clock;
    }

    public boolean isTwoMinute(int thresholdSeconds) {
        return (quarter == 2 || quarter >= 4) && clock <= thresholdSeconds;
    }

    public boolean isOvertime() {
        return quarter == OVERTIME_QUARTER;
    }

    public void startSecondHalf() {
        quarter = 3;
        clock = QUARTER_SECONDS;
        homeTimeouts = TIMEOUTS_PER_HALF;
        awayTimeouts = TIMEOUTS_PER_HALF;
    }

    public void startOvertime() {
        quarter = OVERTIME_QUARTER;
        clock = OVERTIME_SECONDS;
        homeTimeouts = TIMEOUTS_OVERTIME;
        awayTimeouts = TIMEOUTS_OVERTIME;
    }

    public int timeoutsOf(Possession team) {
        return team == Possession.HOME ? homeTimeouts : awayTimeouts;
    }

    public boolean useTimeout(Possession team) {
        if (timeoutsOf(team) == 0) return false;
        if (team == Possession.HOME) homeTimeouts--;
        else awayTimeouts--;
        return true;
    }

    // --- Possession / terrain ---

    public void startDrive(Possession offense, int startYardline) {
        possession = offense;
        driveCount++;
        firstDown(startYardline);
    }

    public void firstDown(int atYardline) {
        yardline = atYardline;
        down = 1;
        toGo = Math.min(10, 100 - atYardline);
    }

    /**
     * Avance le ballon et gère le premier essai.
     * Ne vérifie ni touchdown ni safety : c'est au simulateur de drive de le faire.
     */
    public void advance(int yards) {
        yardline += yards;
        toGo -= yards;
        playCount++;
        if (toGo <= 0) {
            down = 1;
            toGo = Math.min(10, 100 - yardline);
        } else {
            down++;
        }
    }

    public void countPlay() {
        playCount++;
    }
}
