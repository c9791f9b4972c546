package com.apisentinel.core.detection;

import com.apisentinel.core.config.MetricSettings;
import com.apisentinel.core.model.BaselineStat;
import com.apisentinel.core.model.Metric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * One-dimensional isolation-forest scoring against a baseline's recent
 * healthy values.
 *
 * <p>
 * Each tree repeatedly splits the sample at a random point between the
 * smallest and largest of the sample and the candidate value, following the
 * candidate's side, until the candidate is alone or the depth limit is hit.
 * Values that isolate quickly are unusual. The score is
 * {@code 2^(−E[h] / c(n))}: close to 1 for outliers, about 0.5 for typical
 * values.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * With fewer than {@value #MIN_HISTORY_SIZE} recent values the detector falls
 * back to the EWMA z-score rule. The z-score is always reported for severity.
 * </p>
 *
 * <h3>Determinism</h3>
 * <p>
 * Every call seeds its own {@link Random} from the configured seed, so the
 * same inputs always give the same score.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationScoreDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationScoreDetector.class);

    public static final String NAME = "isolation";

    static final int MIN_HISTORY_SIZE = 8;

    private static final double EULER_MASCHERONI = 0.5772156649;

    private final double scoreThreshold;
    private final int trees;
    private final long seed;
    private final EwmaZScoreDetector fallback = new EwmaZScoreDetector();

    /**
     * @param scoreThreshold score at or above which a value is anomalous, in
     *                       (0, 1)
     * @param trees          number of random trees averaged
     * @param seed           random seed
     */
    public IsolationScoreDetector(double scoreThreshold, int trees, long seed) {
        if (scoreThreshold <= 0.0 || scoreThreshold >= 1.0) {
            throw new IllegalArgumentException("scoreThreshold must be in (0, 1), got: " + scoreThreshold);
        }
        if (trees < 1) {
            throw new IllegalArgumentException("trees must be >= 1, got: " + trees);
        }
        this.scoreThreshold = scoreThreshold;
        this.trees = trees;
        this.seed = seed;
    }

    @Override
    public MetricScore score(Metric metric, double value, BaselineStat baseline, MetricSettings settings) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        List<Double> sample = baseline.getRecentValues();
        if (sample.size() < MIN_HISTORY_SIZE) {
            LOG.trace("{}: {} recent values, using z-score fallback", metric, sample.size());
            return fallback.score(metric, value, baseline, settings);
        }
        double z = Ewma.zScore(value, baseline, settings);
        double score = isolationScore(value, sample);
        return new MetricScore(metric, value, z, score, score >= scoreThreshold);
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * @param value  candidate value
     * @param sample reference sample, at least two values
     * @return isolation score in (0, 1]
     */
    double isolationScore(double value, List<Double> sample) {
        Random random = new Random(seed);
        int n = sample.size();
        int depthLimit = (int) Math.ceil(Math.log(n) / Math.log(2));
        double totalPathLength = 0.0;
        for (int t = 0; t < trees; t++) {
            totalPathLength += pathLength(value, sample, depthLimit, random);
        }
        double meanPathLength = totalPathLength / trees;
        return Math.pow(2.0, -meanPathLength / averagePathLength(n));
    }

    private static double pathLength(double value, List<Double> sample, int depthLimit, Random random) {
        List<Double> node = sample;
        int depth = 0;
        while (depth < depthLimit && node.size() > 1) {
            double min = value;
            double max = value;
            for (double v : node) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            if (max - min <= 0.0) {
                // every remaining point equals the candidate
                break;
            }
            double split = min + random.nextDouble() * (max - min);
            boolean left = value < split;
            List<Double> side = new ArrayList<>();
            for (double v : node) {
                if ((v < split) == left) {
                    side.add(v);
                }
            }
            depth++;
            if (side.isEmpty()) {
                return depth;
            }
            node = side;
        }
        return depth + averagePathLength(node.size());
    }

    /** Average unsuccessful-search path length of a binary search tree of n points. */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_MASCHERONI;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }
}
