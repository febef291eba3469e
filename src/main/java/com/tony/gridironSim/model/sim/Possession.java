package com.tony.gridironSim.model.sim;

public enum Possession {
    HOME, AWAY;

    public Possession opposite() {
        return this == HOME ? AWAY : HOME;
    }
}
