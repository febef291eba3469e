package com.tony.gridironSim.model.sim;

public enum PredictionStatus {
    NO_PREDICTION,      // données manquantes pour une des équipes
    LOW_CONFIDENCE,     // mode proxy, batch tronqué, échantillon insuffisant ou peu fiable
    FULL_CONFIDENCE
}
