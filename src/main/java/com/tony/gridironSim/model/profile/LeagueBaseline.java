package com.tony.gridironSim.model.profile;

/**
 * Moyennes ligue servant de prior (Empirical Bayes) et de valeur de repli.
 */
public final class LeagueBaseline {

    private LeagueBaseline() {
    }

    public static final double EPA_PER_PLAY = 0.0;
    public static final double SUCCESS_RATE = 0.45;
    public static final double EARLY_DOWN_SUCCESS = 0.48;
    public static final double RUSH_SUCCESS_RATE = 0.40;

    public static final double COMPLETION_RATE = 0.64;
    public static final double YARDS_PER_COMPLETION = 11.0;
    public static final double YARDS_PER_CARRY = 4.3;
    public static final double EXPLOSIVE_PASS_RATE = 0.09;
    public static final double INTERCEPTION_RATE = 0.023;
    public static final double FUMBLE_RATE = 0.012;

    public static final double PRESSURE_RATE = 0.212;

    public static final double RED_ZONE_TD_RATE = 0.60;
    public static final double GOAL_LINE_TD_RATE = 0.72;
    public static final double FOURTH_DOWN_AGGRESSIVENESS = 0.0;

    public static final double FIELD_GOAL_PCT = 0.85;
    public static final double NET_PUNT_AVERAGE = 40.0;
    public static final double KICK_RETURN_START = 25.0;

    public static final double SECONDS_PER_PLAY = 28.0;
    public static final double NEUTRAL_PASS_RATE = 0.58;
}
