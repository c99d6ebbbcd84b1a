package org.carball.lca.analyzer;

import org.carball.lca.model.result.ConfidenceInterval;
import org.carball.lca.model.result.DistributionStats;

import java.util.Arrays;

/**
 * Summary statistics over Monte Carlo samples. Moments are population moments;
 * percentiles interpolate linearly between order statistics.
 */
public final class DistributionStatistics {

    private DistributionStatistics() {
    }

    public static DistributionStats describe(double[] samples) {
        if (samples.length == 0) {
            return new DistributionStats(0, 0, 0, 0, 0, 0, 0, 0, 0);
        }
        double[] sorted = sorted(samples);
        int n = samples.length;

        double sum = 0.0;
        for (double v : samples) {
            sum += v;
        }
        double mean = sum / n;

        double m2 = 0.0;
        double m3 = 0.0;
        double m4 = 0.0;
        for (double v : samples) {
            double d = v - mean;
            double d2 = d * d;
            m2 += d2;
            m3 += d2 * d;
            m4 += d2 * d2;
        }
        m2 /= n;
        m3 /= n;
        m4 /= n;

        double std = Math.sqrt(m2);
        double skewness = m2 > 0 ? m3 / Math.pow(m2, 1.5) : 0.0;
        double kurtosis = m2 > 0 ? m4 / (m2 * m2) - 3.0 : 0.0;
        double cv = mean != 0 ? std / mean : 0.0;
        double min = sorted[0];
        double max = sorted[n - 1];

        return new DistributionStats(mean, percentile(sorted, 50), std, cv, skewness, kurtosis, min, max, max - min);
    }

    /**
     * @param sorted   ascending samples
     * @param percent  0 to 100
     */
    public static double percentile(double[] sorted, double percent) {
        if (sorted.length == 0) {
            return 0.0;
        }
        double rank = percent / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    public static ConfidenceInterval confidenceInterval(double[] sorted, double levelPercent) {
        double tail = (100.0 - levelPercent) / 2.0;
        return new ConfidenceInterval(levelPercent, percentile(sorted, tail), percentile(sorted, 100.0 - tail));
    }

    /**
     * Share of samples at or below the target, in percent.
     */
    public static double probabilityAtOrBelow(double[] samples, double target) {
        if (samples.length == 0) {
            return 0.0;
        }
        long hits = Arrays.stream(samples).filter(v -> v <= target).count();
        return hits * 100.0 / samples.length;
    }

    public static double[] sorted(double[] samples) {
        double[] copy = samples.clone();
        Arrays.sort(copy);
        return copy;
    }
}
