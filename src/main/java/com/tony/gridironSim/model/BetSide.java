package com.tony.gridironSim.model;

public enum BetSide {
    HOME, AWAY, OVER, UNDER
}
