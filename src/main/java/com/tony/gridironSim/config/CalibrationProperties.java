package com.tony.gridironSim.config;

import com.tony.gridironSim.model.CalibrationMetric;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "calibration")
@Validated
@Data
public class CalibrationProperties {

    // Part du biais corrigée à chaque passe (0 = rien, 1 = tout)
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double damping = 0.5;

    // Seuil |z| au-delà duquel un biais est jugé significatif
    @DecimalMin("0.0")
    private double materialityZ = 1.5;

    @Min(1)
    private int windowWeeks = 4;

    @Min(1)
    private int minHistoryWeeks = 3;

    // Bornes absolues par métrique (ex: POINTS_SCORED: 2.0)
    private Map<CalibrationMetric, Double> clamps = new EnumMap<>(CalibrationMetric.class);

    public CalibrationSettings toSettings() {
        CalibrationSettings.CalibrationSettingsBuilder builder = CalibrationSettings.builder()
                .damping(damping)
                .materialityZ(materialityZ)
                .windowWeeks(windowWeeks)
                .minHistoryWeeks(minHistoryWeeks);
        clamps.forEach(builder::clamp);
        return builder.build();
    }
}
