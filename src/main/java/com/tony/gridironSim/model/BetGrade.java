package com.tony.gridironSim.model;

public enum BetGrade {
    WIN, LOSS, PUSH
}
