package de.hpi.isg.xtab.significance;

import com.google.common.base.Joiner;
import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Pearson's chi-square test of independence between box categories (rows) and banner columns (columns) on weighted
 * frequencies. Sparse categories are dropped before testing, and the test is skipped when the expected cell counts
 * are too small.
 */
public class ChiSquareTest {

    /**
     * Categories with a total below this count (or below {@link #MIN_CATEGORY_SHARE} of the grand total) are dropped.
     */
    private static final double MIN_CATEGORY_COUNT = 5;

    private static final double MIN_CATEGORY_SHARE = 0.01;

    private static final double MIN_EXPECTED = 0.5;

    private static final double MAX_LOW_EXPECTED_PCT = 40;

    private static final double LOW_EXPECTED = 5;

    /**
     * Below these thresholds, results are flagged as based on small samples.
     */
    private static final double NOTE_MIN_EXPECTED = 1, NOTE_LOW_EXPECTED_PCT = 20;

    /**
     * Runs the test.
     *
     * @param observed       weighted frequencies; {@code observed[category][column]}
     * @param categoryLabels labels of the categories
     * @param alpha          the significance level
     * @return the {@link Result}; check {@link Result#isSkipped()}
     */
    public Result test(double[][] observed, List<String> categoryLabels, double alpha) {
        Validate.isTrue(observed.length == categoryLabels.size(), "%d categories, but %d labels.",
                observed.length, categoryLabels.size());
        Validate.isTrue(alpha > 0 && alpha < 1, "alpha must be between 0 and 1, found %s.", alpha);
        if (observed.length < 2 || observed[0].length < 2) {
            return Result.skipped("fewer than 2 categories or columns");
        }
        int numColumns = observed[0].length;

        double grandTotal = 0d;
        double[] categoryTotals = new double[observed.length];
        for (int i = 0; i < observed.length; i++) {
            for (double value : observed[i]) categoryTotals[i] += value;
            grandTotal += categoryTotals[i];
        }
        double minCount = Math.max(MIN_CATEGORY_COUNT, MIN_CATEGORY_SHARE * grandTotal);
        List<double[]> kept = new ArrayList<>();
        List<String> excluded = new ArrayList<>();
        for (int i = 0; i < observed.length; i++) {
            if (categoryTotals[i] >= minCount) kept.add(observed[i]);
            else excluded.add(categoryLabels.get(i));
        }
        if (kept.size() < 2) {
            return Result.skipped("fewer than 2 categories after dropping sparse ones");
        }

        double[] rowTotals = new double[kept.size()], columnTotals = new double[numColumns];
        double total = 0d;
        for (int i = 0; i < kept.size(); i++) {
            for (int j = 0; j < numColumns; j++) {
                rowTotals[i] += kept.get(i)[j];
                columnTotals[j] += kept.get(i)[j];
            }
            total += rowTotals[i];
        }
        if (total == 0) return Result.skipped("no observations");

        double minExpected = Double.POSITIVE_INFINITY, statistic = 0d;
        int numLowExpected = 0;
        for (int i = 0; i < kept.size(); i++) {
            for (int j = 0; j < numColumns; j++) {
                double expected = rowTotals[i] * columnTotals[j] / total;
                minExpected = Math.min(minExpected, expected);
                if (expected < LOW_EXPECTED) numLowExpected++;
                if (expected > 0) {
                    double deviation = kept.get(i)[j] - expected;
                    statistic += deviation * deviation / expected;
                }
            }
        }
        double lowExpectedPct = 100d * numLowExpected / (kept.size() * numColumns);
        if (minExpected < MIN_EXPECTED || lowExpectedPct > MAX_LOW_EXPECTED_PCT) {
            return Result.skipped(String.format(
                    "expected counts too small (min %.2f, %.0f%% below %.0f)", minExpected, lowExpectedPct, LOW_EXPECTED
            ));
        }

        int df = (kept.size() - 1) * (numColumns - 1);
        double pValue = 1 - new ChiSquaredDistribution(df).cumulativeProbability(statistic);
        boolean isSmallSample = minExpected < NOTE_MIN_EXPECTED || lowExpectedPct > NOTE_LOW_EXPECTED_PCT;
        return new Result(kept.size(), statistic, df, pValue, pValue < alpha, excluded, isSmallSample, null);
    }

    /**
     * Outcome of a {@link ChiSquareTest}.
     */
    public static class Result {

        private final int numCategories;

        private final double statistic;

        private final int degreesOfFreedom;

        private final double pValue;

        private final boolean isSignificant;

        private final List<String> excludedCategories;

        private final boolean isSmallSample;

        private final String skipReason;

        private Result(int numCategories, double statistic, int degreesOfFreedom, double pValue,
                       boolean isSignificant, List<String> excludedCategories, boolean isSmallSample,
                       String skipReason) {
            this.numCategories = numCategories;
            this.statistic = statistic;
            this.degreesOfFreedom = degreesOfFreedom;
            this.pValue = pValue;
            this.isSignificant = isSignificant;
            this.excludedCategories = excludedCategories;
            this.isSmallSample = isSmallSample;
            this.skipReason = skipReason;
        }

        static Result skipped(String reason) {
            return new Result(0, Double.NaN, 0, Double.NaN, false, new ArrayList<>(), false, reason);
        }

        public boolean isSkipped() {
            return this.skipReason != null;
        }

        public String getSkipReason() {
            return this.skipReason;
        }

        public int getNumCategories() {
            return this.numCategories;
        }

        public double getStatistic() {
            return this.statistic;
        }

        public int getDegreesOfFreedom() {
            return this.degreesOfFreedom;
        }

        public double getPValue() {
            return this.pValue;
        }

        public boolean isSignificant() {
            return this.isSignificant;
        }

        public List<String> getExcludedCategories() {
            return this.excludedCategories;
        }

        public boolean isSmallSample() {
            return this.isSmallSample;
        }

        /**
         * Renders this instance as a row label.
         */
        public String toLabel() {
            if (this.isSkipped()) return "Chi-square: not tested (" + this.skipReason + ")";
            StringBuilder sb = new StringBuilder(String.format(Locale.ROOT, "Chi-square (%d categories): χ²=%.2f, df=%d, p=%.4f",
                    this.numCategories, this.statistic, this.degreesOfFreedom, this.pValue));
            if (this.isSignificant) sb.append(" **");
            if (!this.excludedCategories.isEmpty()) {
                sb.append(" [Excluded: ").append(Joiner.on(", ").join(this.excludedCategories)).append(']');
            }
            if (this.isSmallSample) sb.append(" [Note: Small sample in some cells]");
            return sb.toString();
        }
    }
}
