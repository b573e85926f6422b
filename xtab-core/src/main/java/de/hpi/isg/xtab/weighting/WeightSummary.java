package de.hpi.isg.xtab.weighting;

import java.io.Serializable;

/**
 * Descriptive statistics of a {@link WeightSequence}.
 */
public class WeightSummary implements Serializable {

    private final int numRows, numValid;

    private final double min, max, mean, sum, effectiveN, designEffect, coefficientOfVariation;

    public WeightSummary(int numRows, int numValid, double min, double max, double mean, double sum,
                         double effectiveN, double designEffect, double coefficientOfVariation) {
        this.numRows = numRows;
        this.numValid = numValid;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.sum = sum;
        this.effectiveN = effectiveN;
        this.designEffect = designEffect;
        this.coefficientOfVariation = coefficientOfVariation;
    }

    public int getNumRows() {
        return this.numRows;
    }

    /**
     * @return the number of strictly positive, finite weights
     */
    public int getNumValid() {
        return this.numValid;
    }

    public double getMin() {
        return this.min;
    }

    public double getMax() {
        return this.max;
    }

    public double getMean() {
        return this.mean;
    }

    public double getSum() {
        return this.sum;
    }

    public double getEffectiveN() {
        return this.effectiveN;
    }

    /**
     * @return the ratio of the number of valid weights to the effective sample size
     */
    public double getDesignEffect() {
        return this.designEffect;
    }

    /**
     * @return the effective sample size relative to the number of valid weights
     */
    public double getEfficiency() {
        return this.numValid == 0 ? 0d : this.effectiveN / this.numValid;
    }

    public double getCoefficientOfVariation() {
        return this.coefficientOfVariation;
    }

    @Override
    public String toString() {
        return String.format("WeightSummary[n=%d, valid=%d, min=%.3f, max=%.3f, mean=%.3f, effective n=%.1f, " +
                        "deff=%.3f, cv=%.3f]", this.numRows, this.numValid, this.min, this.max, this.mean,
                this.effectiveN, this.designEffect, this.coefficientOfVariation);
    }
}
