package com.tony.gridironSim.service;

import com.tony.gridironSim.calibration.CalibrationMethod;
import com.tony.gridironSim.calibration.CalibrationSample;
import com.tony.gridironSim.calibration.IsotonicCalibrator;
import com.tony.gridironSim.calibration.MarketCalibrators;
import com.tony.gridironSim.calibration.PlattCalibrator;
import com.tony.gridironSim.calibration.ProbabilityCalibrator;
import com.tony.gridironSim.config.BacktestProperties;
import com.tony.gridironSim.model.BacktestRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Calibration des probabilités cover / over à partir des matchs déjà joués.
 * Variable explicative : z = (moyenne simulée - ligne) / écart-type simulé, borné.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProbabilityCalibrationService {

    private static final double MIN_STD_DEV = 1e-6;

    private final BacktestProperties properties;

    /**
     * @param delta moyenne simulée moins ligne, orientée domicile / over
     */
    public double zScore(double delta, double simulatedStdDev) {
        double z = delta / Math.max(simulatedStdDev, MIN_STD_DEV);
        return Math.max(-properties.getMaxZScore(), Math.min(properties.getMaxZScore(), z));
    }

    /**
     * Ajuste les calibrateurs sur les seuls matchs strictement antérieurs à {@code week}.
     */
    public MarketCalibrators fitBefore(Collection<BacktestRecord> history, int week) {
        List<BacktestRecord> past = history.stream().filter(r -> r.getWeek() < week).toList();
        ProbabilityCalibrator spread = fitOrNull(spreadSamples(past), "écart", week);
        ProbabilityCalibrator total = fitOrNull(totalSamples(past), "total", week);
        return new MarketCalibrators(spread, total);
    }

    public ProbabilityCalibrator fit(List<CalibrationSample> samples, CalibrationMethod method) {
        return switch (method) {
            case PLATT -> PlattCalibrator.fit(samples);
            case ISOTONIC -> IsotonicCalibrator.fit(samples);
        };
    }

    /** Cover domicile ; pushes exclus. */
    public List<CalibrationSample> spreadSamples(Collection<BacktestRecord> records) {
        List<CalibrationSample> samples = new ArrayList<>();
        for (BacktestRecord r : records) {
            if (r.getSpreadZ() == null || r.getPlacedSpread() == null) continue;
            double adjusted = r.getActualHomeScore() - r.getActualAwayScore() + r.getPlacedSpread();
            if (adjusted == 0) continue;
            samples.add(new CalibrationSample(r.getSpreadZ(), adjusted > 0 ? 1.0 : 0.0));
        }
        return samples;
    }

    /** Over ; pushes exclus. */
    public List<CalibrationSample> totalSamples(Collection<BacktestRecord> records) {
        List<CalibrationSample> samples = new ArrayList<>();
        for (BacktestRecord r : records) {
            if (r.getTotalZ() == null || r.getPlacedTotal() == null) continue;
            double points = r.getActualHomeScore() + r.getActualAwayScore();
            if (points == r.getPlacedTotal()) continue;
            samples.add(new CalibrationSample(r.getTotalZ(), points > r.getPlacedTotal() ? 1.0 : 0.0));
        }
        return samples;
    }

    private ProbabilityCalibrator fitOrNull(List<CalibrationSample> samples, String market, int week) {
        if (samples.size() < properties.getCalibrationMinSamples()) {
            log.debug("Calibration {} sem. {} : {} match(s), min {} -> probabilités brutes",
                    market, week, samples.size(), properties.getCalibrationMinSamples());
            return null;
        }
        ProbabilityCalibrator calibrator = fit(samples, properties.getProbabilityCalibration());
        log.info("📐 Calibration {} sem. {} ajustée ({}) sur {} matchs", market, week,
                calibrator.method(), samples.size());
        return calibrator;
    }
}
