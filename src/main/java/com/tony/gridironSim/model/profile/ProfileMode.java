package com.tony.gridironSim.model.profile;

public enum ProfileMode {
    GRADED,
    PROXY   // notes avancées absentes, on s'appuie sur l'efficacité
}
