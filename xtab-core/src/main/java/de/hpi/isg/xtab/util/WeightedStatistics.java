package de.hpi.isg.xtab.util;

import de.hpi.isg.xtab.error.CrosstabException;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Utilities for weighted descriptive statistics. All methods consider only observations with a present value and a
 * strictly positive, finite weight.
 */
public class WeightedStatistics {

    private WeightedStatistics() {
    }

    private static void checkLengths(DoubleList values, DoubleList weights) {
        if (values.size() != weights.size()) {
            throw CrosstabException.invalidArgument(String.format(
                    "values and weights must have same length (got %d and %d).", values.size(), weights.size()
            ));
        }
    }

    private static boolean isValid(double value, double weight) {
        return !Double.isNaN(value) && weight > 0 && !Double.isInfinite(weight);
    }

    /**
     * @return the weighted mean or {@link Double#NaN} if there are no valid observations
     */
    public static double mean(DoubleList values, DoubleList weights) {
        checkLengths(values, weights);
        double sum = 0d, sumOfWeights = 0d;
        for (int i = 0; i < values.size(); i++) {
            double value = values.getDouble(i), weight = weights.getDouble(i);
            if (isValid(value, weight)) {
                sum += value * weight;
                sumOfWeights += weight;
            }
        }
        return sumOfWeights > 0 ? sum / sumOfWeights : Double.NaN;
    }

    /**
     * Calculates the weighted population variance {@code Σw(v-m)² / Σw}.
     *
     * @return the variance or {@code 0} if there are fewer than two valid observations
     */
    public static double variance(DoubleList values, DoubleList weights) {
        checkLengths(values, weights);
        int numValid = 0;
        double sum = 0d, sumOfWeights = 0d;
        for (int i = 0; i < values.size(); i++) {
            double value = values.getDouble(i), weight = weights.getDouble(i);
            if (isValid(value, weight)) {
                numValid++;
                sum += value * weight;
                sumOfWeights += weight;
            }
        }
        if (numValid < 2 || sumOfWeights == 0) return 0d;
        double mean = sum / sumOfWeights;
        double squaredDeviations = 0d;
        for (int i = 0; i < values.size(); i++) {
            double value = values.getDouble(i), weight = weights.getDouble(i);
            if (isValid(value, weight)) {
                squaredDeviations += weight * (value - mean) * (value - mean);
            }
        }
        return squaredDeviations / sumOfWeights;
    }

    /**
     * Calculates the standard deviation. For unit weights, this is the sample standard deviation (with {@code n-1}
     * denominator), otherwise the weighted population standard deviation.
     *
     * @return the standard deviation or {@link Double#NaN} if there are fewer than two valid observations
     */
    public static double standardDeviation(DoubleList values, DoubleList weights) {
        checkLengths(values, weights);
        IntList valid = new IntArrayList();
        boolean isUnit = true;
        for (int i = 0; i < values.size(); i++) {
            if (isValid(values.getDouble(i), weights.getDouble(i))) {
                valid.add(i);
                isUnit &= weights.getDouble(i) == 1d;
            }
        }
        int n = valid.size();
        if (n < 2) return Double.NaN;
        if (!isUnit) return Math.sqrt(variance(values, weights));
        double mean = 0d;
        for (int i = 0; i < n; i++) mean += values.getDouble(valid.getInt(i));
        mean /= n;
        double squaredDeviations = 0d;
        for (int i = 0; i < n; i++) {
            double deviation = values.getDouble(valid.getInt(i)) - mean;
            squaredDeviations += deviation * deviation;
        }
        return Math.sqrt(squaredDeviations / (n - 1));
    }

    /**
     * Calculates the weighted median, i.e., the smallest value at which the cumulative weight reaches half of the
     * total weight. If the cumulative weight hits exactly one half, the median is the average of that value and the
     * next one.
     *
     * @return the median or {@link Double#NaN} if there are no valid observations
     */
    public static double median(DoubleList values, DoubleList weights) {
        checkLengths(values, weights);
        IntArrayList valid = new IntArrayList();
        double total = 0d;
        for (int i = 0; i < values.size(); i++) {
            if (isValid(values.getDouble(i), weights.getDouble(i))) {
                valid.add(i);
                total += weights.getDouble(i);
            }
        }
        if (valid.isEmpty()) return Double.NaN;
        valid.sort((i1, i2) -> Double.compare(values.getDouble(i1), values.getDouble(i2)));
        double half = total / 2, cumulative = 0d;
        for (int k = 0; k < valid.size(); k++) {
            int i = valid.getInt(k);
            cumulative += weights.getDouble(i);
            if (Math.abs(cumulative - half) < 1e-10 * total && k + 1 < valid.size()) {
                return (values.getDouble(i) + values.getDouble(valid.getInt(k + 1))) / 2;
            }
            if (cumulative > half) return values.getDouble(i);
        }
        return values.getDouble(valid.getInt(valid.size() - 1));
    }
}
