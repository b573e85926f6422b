package de.hpi.isg.xtab.ranking;

import de.hpi.isg.xtab.significance.MeanSample;
import de.hpi.isg.xtab.significance.ProportionSample;
import de.hpi.isg.xtab.util.WeightedStatistics;
import de.hpi.isg.xtab.weighting.WeightSequence;
import de.hpi.isg.xtab.weighting.WeightingEngine;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Per-item metrics over a set of respondents of a normalized {@link RankingMatrix}. Only ranks within
 * {@code [1, numPositions]} take part; all percentages relate to the respondents that ranked the item.
 */
public class RankingMetrics {

    private RankingMetrics() {
    }

    /**
     * Determines the weighted share of respondents ranking the item first.
     *
     * @return the weighted count, the weighted base and the effective base
     */
    public static ProportionSample rankedFirst(RankingMatrix matrix, int item, IntList rows, WeightSequence weights) {
        return rankedAtMost(matrix, item, 1, rows, weights);
    }

    /**
     * Determines the weighted share of respondents ranking the item within the top {@code topN} positions. The caller
     * is responsible for clamping {@code topN} to the number of positions.
     */
    public static ProportionSample rankedTopN(RankingMatrix matrix, int item, int topN, IntList rows,
                                              WeightSequence weights) {
        return rankedAtMost(matrix, item, topN, rows, weights);
    }

    private static ProportionSample rankedAtMost(RankingMatrix matrix, int item, int maxRank, IntList rows,
                                                 WeightSequence weights) {
        double count = 0d, base = 0d;
        DoubleArrayList rankedWeights = new DoubleArrayList();
        for (int i = 0; i < rows.size(); i++) {
            int row = rows.getInt(i);
            double rank = matrix.getRank(row, item);
            if (!matrix.isInRange(rank)) continue;
            double weight = weights.get(row);
            base += weight;
            rankedWeights.add(weight);
            if (rank <= maxRank) count += weight;
        }
        double effectiveN = weights.isWeighted() ?
                WeightingEngine.roundedEffectiveN(rankedWeights.toDoubleArray()) :
                rankedWeights.size();
        return new ProportionSample(count, base, effectiveN);
    }

    /**
     * Collects the ranks of an item with their weights, e.g., for mean rank tests.
     */
    public static MeanSample ranks(RankingMatrix matrix, int item, IntList rows, WeightSequence weights) {
        DoubleArrayList values = new DoubleArrayList(), valueWeights = new DoubleArrayList();
        for (int i = 0; i < rows.size(); i++) {
            int row = rows.getInt(i);
            double rank = matrix.getRank(row, item);
            if (!matrix.isInRange(rank)) continue;
            values.add(rank);
            valueWeights.add(weights.get(row));
        }
        return new MeanSample(values, valueWeights);
    }

    /**
     * Calculates the weighted mean rank. Lower values are better.
     *
     * @return the mean rank or {@link Double#NaN} if nobody ranked the item
     */
    public static double meanRank(RankingMatrix matrix, int item, IntList rows, WeightSequence weights) {
        MeanSample sample = ranks(matrix, item, rows, weights);
        return WeightedStatistics.mean(sample.getValues(), sample.getWeights());
    }

    /**
     * Calculates the weighted population variance of the ranks.
     *
     * @return the variance or {@link Double#NaN} if fewer than two respondents ranked the item
     */
    public static double rankVariance(RankingMatrix matrix, int item, IntList rows, WeightSequence weights) {
        MeanSample sample = ranks(matrix, item, rows, weights);
        if (sample.size() < 2) return Double.NaN;
        return WeightedStatistics.variance(sample.getValues(), sample.getWeights());
    }
}
