package com.tony.gridironSim.engine;

/**
 * Dérivation des graines par essai (mélange SplitMix64) :
 * le résultat d'un essai ne dépend que de (graine du batch, index), pas de l'ordonnancement.
 */
public final class TrialSeeds {

    private TrialSeeds() {
    }

    public static long forTrial(long batchSeed, int trialIndex) {
        return mix(batchSeed + 0x9E3779B97F4A7C15L * (trialIndex + 1L));
    }

    static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
