package de.hpi.isg.xtab.significance;

import de.hpi.isg.xtab.util.WeightedStatistics;
import de.hpi.isg.xtab.weighting.WeightingEngine;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.distribution.TDistribution;

/**
 * Welch's two-sample t-test on weighted means. Variances are weighted population variances, the sample sizes are
 * the effective sample sizes of the segments.
 */
public class WeightedTTest implements PairwiseTest<MeanSample> {

    private final double minBase;

    public WeightedTTest(double minBase) {
        Validate.isTrue(minBase >= 1, "Minimum base must be at least 1, found %s.", minBase);
        this.minBase = minBase;
    }

    /**
     * Tests whether the means of two segments differ.
     *
     * @param first  the first segment
     * @param second the second segment
     * @param alpha  the (possibly corrected) significance level
     * @return the {@link TestResult}
     */
    @Override
    public TestResult test(MeanSample first, MeanSample second, double alpha) {
        Validate.isTrue(alpha > 0 && alpha < 1, "alpha must be between 0 and 1, found %s.", alpha);
        MeanSample sample1 = analyticSample(first), sample2 = analyticSample(second);

        double n1 = WeightingEngine.roundedEffectiveN(sample1.getWeights().toDoubleArray());
        double n2 = WeightingEngine.roundedEffectiveN(sample2.getWeights().toDoubleArray());
        if (n1 < this.minBase || n2 < this.minBase) {
            return TestResult.skipped(String.format("base below %.0f (%.0f vs. %.0f)", this.minBase, n1, n2));
        }

        double mean1 = WeightedStatistics.mean(sample1.getValues(), sample1.getWeights());
        double mean2 = WeightedStatistics.mean(sample2.getValues(), sample2.getWeights());
        if (Double.isNaN(mean1) || Double.isNaN(mean2)) {
            return TestResult.skipped("undefined mean");
        }
        double var1 = WeightedStatistics.variance(sample1.getValues(), sample1.getWeights());
        double var2 = WeightedStatistics.variance(sample2.getValues(), sample2.getWeights());

        double se = Math.sqrt(var1 / n1 + var2 / n2);
        if (se == 0 || Double.isNaN(se)) {
            return TestResult.of(1d, mean1 > mean2, alpha);
        }
        double t = (mean1 - mean2) / se;
        double df = Math.pow(var1 / n1 + var2 / n2, 2) /
                (Math.pow(var1 / n1, 2) / (n1 - 1) + Math.pow(var2 / n2, 2) / (n2 - 1));
        if (Double.isNaN(df) || df <= 0) {
            return TestResult.skipped("degrees of freedom not computable");
        }
        double pValue = 2 * new TDistribution(df).cumulativeProbability(-Math.abs(t));
        return TestResult.of(pValue, mean1 > mean2, alpha);
    }

    /**
     * Keeps only the values that are present and carry a strictly positive, finite weight.
     */
    private static MeanSample analyticSample(MeanSample sample) {
        DoubleList values = new DoubleArrayList(), weights = new DoubleArrayList();
        for (int i = 0; i < sample.size(); i++) {
            double value = sample.getValues().getDouble(i), weight = sample.getWeights().getDouble(i);
            if (!Double.isNaN(value) && weight > 0 && !Double.isInfinite(weight)) {
                values.add(value);
                weights.add(weight);
            }
        }
        return new MeanSample(values, weights);
    }
}
