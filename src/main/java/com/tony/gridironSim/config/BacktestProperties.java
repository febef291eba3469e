package com.tony.gridironSim.config;

import com.tony.gridironSim.calibration.CalibrationMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "backtest")
@Validated
@Data
public class BacktestProperties {

    // Moins d'essais qu'en live : une saison entière doit tourner en quelques minutes
    @Min(100)
    private int trials = 2_000;

    // Graine de base, combinée à l'id du match pour rejouer un backtest à l'identique
    private long seed = 20_240_905L;

    // Écart minimum (points) entre simulation et marché pour recommander un pari
    @DecimalMin("0.0")
    private double spreadEdge = 1.5;
    @DecimalMin("0.0")
    private double totalEdge = 2.0;

    // Calibration des probabilités cover / over, ajustée sur les semaines antérieures
    private CalibrationMethod probabilityCalibration = CalibrationMethod.ISOTONIC;
    @Min(2)
    private int calibrationMinSamples = 30;
    @DecimalMin("0.5")
    private double maxZScore = 3.0;
}
