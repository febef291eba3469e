package com.tony.gridironSim.engine;

/**
 * Courbe de points attendus (EP) linéaire sur (position, essai, distance).
 * EPA d'une action = EP après - EP avant, du point de vue de l'attaque.
 */
public class ExpectedPointsModel {

    static final double TOUCHDOWN_VALUE = 6.95;
    static final double SAFETY_VALUE = -2.0;
    static final double FIELD_GOAL_VALUE = 3.0;

    public double value(int yardline, int down, int toGo) {
        double ep = -1.0 + 0.06 * yardline - 0.45 * (down - 1) - 0.04 * (toGo - 10);
        return Distributions.clamp(ep, -2.5, 6.5);
    }

    /** Valeur pour l'équipe qui rend le ballon, l'adversaire repartant de son propre yardline. */
    public double afterChangeOfPossession(int opponentYardline) {
        return -value(opponentYardline, 1, 10);
    }
}
