package com.tony.gridironSim.model.sim;

public enum PlayType {
    RUN, PASS, FIELD_GOAL, PUNT
}
