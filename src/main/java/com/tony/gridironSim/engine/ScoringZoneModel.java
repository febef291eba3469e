package com.tony.gridironSim.engine;

import com.tony.gridironSim.model.profile.LeagueBaseline;
import com.tony.gridironSim.model.profile.TeamProfile;

/**
 * Probabilité de touchdown par action dans les 20 (zone rouge) et les 5 (goal line),
 * dérivée du taux de conversion par visite de l'équipe.
 */
public class ScoringZoneModel {

    // Nombre moyen d'actions par visite, pour passer d'un taux par visite à un taux par action
    private static final double RED_ZONE_PLAYS_PER_TRIP = 4.0;
    private static final double GOAL_LINE_PLAYS_PER_TRIP = 3.0;

    public double touchdownProbability(int yardline, TeamProfile offense, TeamProfile defense) {
        double tripRate;
        double playsPerTrip;
        if (yardline >= 95) {
            tripRate = offense.getGoalLineTdRate();
            playsPerTrip = GOAL_LINE_PLAYS_PER_TRIP;
        } else if (yardline >= 80) {
            tripRate = offense.getRedZoneTdRate();
            playsPerTrip = RED_ZONE_PLAYS_PER_TRIP;
        } else {
            return 0.0;
        }
        // Défense perméable (EPA concédé > 0) = plus de touchdowns
        double defenseShift = (defense.getDefEpaPerPlay() - LeagueBaseline.EPA_PER_PLAY) * 0.5;
        tripRate = Distributions.clamp(tripRate * offense.efficiencyMultiplier() + defenseShift, 0.05, 0.95);
        return 1.0 - Math.pow(1.0 - tripRate, 1.0 / playsPerTrip);
    }
}
