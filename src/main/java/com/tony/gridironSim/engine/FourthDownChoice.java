package com.tony.gridironSim.engine;

public enum FourthDownChoice {
    GO, FIELD_GOAL, PUNT
}
