package com.tony.gridironSim.calibration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Régression isotonique (pool adjacent violators) : fonction en escalier croissante du z-score,
 * interpolée linéairement entre les paliers et bornée aux extrémités.
 */
public final class IsotonicCalibrator implements ProbabilityCalibrator {

    private final double[] thresholds;
    private final double[] values;

    IsotonicCalibrator(double[] thresholds, double[] values) {
        this.thresholds = thresholds;
        this.values = values;
    }

    public static IsotonicCalibrator fit(List<CalibrationSample> samples) {
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("Aucun échantillon pour ajuster la calibration");
        }
        List<CalibrationSample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparingDouble(CalibrationSample::z));

        int n = sorted.size();
        double[] weight = new double[n];
        double[] sum = new double[n];
        double[] min = new double[n];
        double[] max = new double[n];
        int blocks = 0;

        for (CalibrationSample s : sorted) {
            weight[blocks] = 1;
            sum[blocks] = s.outcome();
            min[blocks] = s.z();
            max[blocks] = s.z();
            blocks++;
            // Fusion tant que l'ordre est violé (ou que deux blocs partagent le même z)
            while (blocks > 1 && (sum[blocks - 2] / weight[blocks - 2] >= sum[blocks - 1] / weight[blocks - 1]
                    || max[blocks - 2] == min[blocks - 1])) {
                weight[blocks - 2] += weight[blocks - 1];
                sum[blocks - 2] += sum[blocks - 1];
                max[blocks - 2] = max[blocks - 1];
                blocks--;
            }
        }

        double[] x = new double[2 * blocks];
        double[] y = new double[2 * blocks];
        int points = 0;
        for (int b = 0; b < blocks; b++) {
            double v = sum[b] / weight[b];
            x[points] = min[b];
            y[points++] = v;
            if (max[b] > min[b]) {
                x[points] = max[b];
                y[points++] = v;
            }
        }
        return new IsotonicCalibrator(Arrays.copyOf(x, points), Arrays.copyOf(y, points));
    }

    @Override
    public double probability(double z) {
        if (z <= thresholds[0]) return values[0];
        int last = thresholds.length - 1;
        if (z >= thresholds[last]) return values[last];

        int i = Arrays.binarySearch(thresholds, z);
        if (i >= 0) return values[i];
        int hi = -i - 1;
        int lo = hi - 1;
        double t = (z - thresholds[lo]) / (thresholds[hi] - thresholds[lo]);
        return values[lo] + t * (values[hi] - values[lo]);
    }

    @Override
    public CalibrationMethod method() {
        return CalibrationMethod.ISOTONIC;
    }
}
