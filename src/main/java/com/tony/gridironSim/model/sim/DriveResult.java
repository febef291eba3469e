package com.tony.gridironSim.model.sim;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DriveResult {

    Possession offense;
    int startYardline;
    @Singular List<PlayEvent> plays;
    DriveOutcome outcome;
    double epaTotal;
    int offensePoints;
    int defensePoints;
    boolean capped;

    // Position de départ de l'adversaire (son propre repère) si pas de coup d'envoi
    int nextStartYardline;
    boolean kickoffNext;
}
