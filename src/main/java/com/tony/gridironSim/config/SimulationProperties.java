package com.tony.gridironSim.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "simulation")
@Validated
@Data
public class SimulationProperties {

    // --- Monte Carlo ---
    @Min(1)
    private int trials = 10_000;
    @Min(1)
    private int minSurvivingTrials = 1_000;
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double maxDiscardRate = 0.02;
    private Duration wallClockBudget;           // null = pas de limite
    private int workerThreads = 0;              // 0 = nombre de coeurs

    // --- Moteur ---
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double basePressureRate = 0.212;
    private double pressureBeta = 0.004;
    private double coverageBeta = 0.002;
    private double runBlockBeta = 0.05;
    @DecimalMin("0.0")
    private double maxMismatch = 25.0;
    @Min(1)
    private int maxPlaysPerDrive = 40;
    @Min(2)
    private int maxDrivesPerGame = 60;
    @DecimalMin("0.0")
    private double homeFieldPoints = 1.5;
    private double aggressivenessWeight = 0.35;
    @DecimalMin("0.0")
    private double priorGames = 4.0;

    // --- Centrage marché ---
    private boolean marketCentering = false;
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double centeringAlpha = 1.0;

    public EngineConfig toEngineConfig() {
        return EngineConfig.builder()
                .trials(trials)
                .minSurvivingTrials(minSurvivingTrials)
                .maxDiscardRate(maxDiscardRate)
                .wallClockBudget(wallClockBudget)
                .basePressureRate(basePressureRate)
                .pressureBeta(pressureBeta)
                .coverageBeta(coverageBeta)
                .runBlockBeta(runBlockBeta)
                .maxMismatch(maxMismatch)
                .maxPlaysPerDrive(maxPlaysPerDrive)
                .maxDrivesPerGame(maxDrivesPerGame)
                .homeFieldPoints(homeFieldPoints)
                .aggressivenessWeight(aggressivenessWeight)
                .priorGames(priorGames)
                .marketCentering(marketCentering)
                .centeringAlpha(centeringAlpha)
                .build();
    }
}
