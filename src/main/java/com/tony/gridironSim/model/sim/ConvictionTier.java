package com.tony.gridironSim.model.sim;

public enum ConvictionTier {
    HIGH, MEDIUM, LOW;

    public static ConvictionTier max(ConvictionTier a, ConvictionTier b) {
        return a.ordinal() <= b.ordinal() ? a : b;
    }
}
