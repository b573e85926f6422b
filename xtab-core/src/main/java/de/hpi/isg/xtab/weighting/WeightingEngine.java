package de.hpi.isg.xtab.weighting;

import de.hpi.isg.xtab.diagnostics.Diagnostic;
import de.hpi.isg.xtab.diagnostics.Diagnostics;
import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import de.hpi.isg.xtab.model.ColumnVector;
import de.hpi.isg.xtab.model.RespondentTable;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw weight column into a {@link WeightSequence} according to a {@link WeightRepairPolicy} and provides
 * the weighting statistics, most notably Kish's effective sample size.
 */
public class WeightingEngine {

    /**
     * Share of zero weights (in percent) above which the {@link WeightRepairPolicy#EXCLUDE} policy warns.
     */
    private static final double ZERO_WEIGHT_WARNING_PCT = 5d;

    private static final double MAX_COEFFICIENT_OF_VARIATION = 1d;

    private final Logger logger = LoggerFactory.getLogger(this.getClass());

    private final Diagnostics diagnostics;

    public WeightingEngine(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Extracts and repairs the weights for a {@link RespondentTable}.
     *
     * @param table          the fully loaded table
     * @param weightVariable the weight column or {@code null} for unit weights
     * @param policy         how to treat invalid weights
     * @return the usable weights
     * @throws CrosstabException if the weights cannot be used under the given policy
     */
    public WeightSequence prepare(RespondentTable table, String weightVariable, WeightRepairPolicy policy) {
        if (weightVariable == null || weightVariable.trim().isEmpty()) {
            this.logger.info("No weight variable configured, using unit weights for {} rows.", table.getNumRows());
            return WeightSequence.unit(table.getNumRows());
        }

        ColumnVector column = table.getColumn(weightVariable);
        if (column == null) {
            throw new CrosstabException(
                    ErrorCode.WEIGHT_COLUMN_NOT_FOUND, "Weight Column Not Found",
                    String.format("Weight column '%s' is not in the data.", weightVariable),
                    "A weighted analysis was requested, so unweighted numbers would be wrong.",
                    "Check the spelling of the weight variable",
                    "Remove the weight variable to run an unweighted analysis"
            );
        }
        if (!column.isNumeric()) {
            throw new CrosstabException(
                    ErrorCode.INVALID_TYPE, "Invalid Weight Column Type",
                    String.format("Weight column '%s' must be numeric.", weightVariable),
                    "Weights must be numeric for weighted analysis calculations.",
                    "Convert weight column to numeric type",
                    "Check that weight column contains numbers, not text"
            );
        }

        double[] weights = new double[column.size()];
        for (int row = 0; row < weights.length; row++) {
            weights[row] = column.getNumber(row);
        }
        weights = this.repair(weights, weightVariable, policy);

        WeightSummary summary = summarize(weights);
        if (summary.getNumValid() == 0) {
            throw new CrosstabException(
                    ErrorCode.NO_VALID_WEIGHTS, "No Valid Weight Values",
                    String.format("Weight column '%s' has no positive finite values.", weightVariable),
                    "Cannot perform weighted analysis without at least some valid weight values.",
                    "Check weight column data quality",
                    "Ensure at least some weights are positive finite numbers"
            );
        }
        if (summary.getCoefficientOfVariation() > MAX_COEFFICIENT_OF_VARIATION) {
            this.diagnostics.warn(Diagnostic.Category.WEIGHTING,
                    "Weight column '%s' has high variability (CV = %.2f). Effective sample size will be substantially reduced.",
                    weightVariable, summary.getCoefficientOfVariation()
            );
        }
        this.logger.info("Prepared weights from '{}': {}", weightVariable, summary);
        return WeightSequence.of(weights);
    }

    /**
     * Applies a {@link WeightRepairPolicy} to raw weights.
     *
     * @param weights        the raw weights; missing weights are {@link Double#NaN}
     * @param weightVariable name of the weight column (for messages)
     * @param policy         the {@link WeightRepairPolicy}
     * @return the repaired weights (a new array)
     */
    public double[] repair(double[] weights, String weightVariable, WeightRepairPolicy policy) {
        int numMissing = 0, numZero = 0, numNegative = 0, numInfinite = 0;
        for (double weight : weights) {
            if (Double.isNaN(weight)) numMissing++;
            else if (weight < 0) numNegative++;
            else if (weight == 0) numZero++;
            else if (Double.isInfinite(weight)) numInfinite++;
        }
        int n = weights.length;
        double[] repaired = weights.clone();

        switch (policy) {
            case ERROR: {
                int numInvalid = numMissing + numZero + numNegative + numInfinite;
                if (numInvalid > 0) {
                    throw new CrosstabException(
                            numNegative > 0 ? ErrorCode.NEGATIVE_WEIGHTS : ErrorCode.INVALID_WEIGHTS,
                            "Invalid Weight Values",
                            String.format("Weight column '%s' has %d invalid values: %d missing, %d zero, %d negative, " +
                                    "%d infinite.", weightVariable, numInvalid, numMissing, numZero, numNegative, numInfinite),
                            "The weight repair policy 'error' does not allow invalid weights.",
                            "Fix the weight column data",
                            "Use repair policy 'exclude' to exclude invalid weights"
                    );
                }
                return repaired;
            }
            case EXCLUDE: {
                if (numNegative > 0) {
                    throw new CrosstabException(
                            ErrorCode.NEGATIVE_WEIGHTS, "Negative Weight Values",
                            String.format("Weight column '%s' contains %d negative values (%.1f%%).",
                                    weightVariable, numNegative, 100d * numNegative / n),
                            "Design weights cannot be negative - this indicates a data quality issue.",
                            "Fix the weight column data to remove negative values",
                            "Check weight calculation or data import process"
                    );
                }
                if (numMissing > 0) {
                    this.diagnostics.warn(Diagnostic.Category.WEIGHTING,
                            "Weight column '%s' contains %d missing values (%.1f%%). These are excluded (weight 0).",
                            weightVariable, numMissing, 100d * numMissing / n);
                }
                if (numInfinite > 0) {
                    this.diagnostics.warn(Diagnostic.Category.WEIGHTING,
                            "Weight column '%s' contains %d infinite values (%.1f%%). These are excluded (weight 0).",
                            weightVariable, numInfinite, 100d * numInfinite / n);
                }
                if (numZero > 0 && 100d * numZero / n > ZERO_WEIGHT_WARNING_PCT) {
                    this.diagnostics.warn(Diagnostic.Category.WEIGHTING,
                            "Weight column '%s' contains %d zero values (%.1f%%). These cases are excluded from weighted analysis.",
                            weightVariable, numZero, 100d * numZero / n);
                }
                for (int i = 0; i < n; i++) {
                    if (Double.isNaN(repaired[i]) || Double.isInfinite(repaired[i])) repaired[i] = 0d;
                }
                return repaired;
            }
            case COERCE_TO_ONE: {
                this.diagnostics.warn(Diagnostic.Category.WEIGHTING,
                        "Using legacy weight repair 'coerce_to_one'. This biases estimates; consider 'exclude' instead.");
                warnCoerced(weightVariable, numMissing, "missing");
                warnCoerced(weightVariable, numNegative, "negative");
                warnCoerced(weightVariable, numZero, "zero");
                warnCoerced(weightVariable, numInfinite, "infinite");
                for (int i = 0; i < n; i++) {
                    double weight = repaired[i];
                    if (Double.isNaN(weight) || weight <= 0 || Double.isInfinite(weight)) repaired[i] = 1d;
                }
                return repaired;
            }
            default:
                throw new IllegalArgumentException("Unknown weight repair policy: " + policy);
        }
    }

    private void warnCoerced(String weightVariable, int count, String what) {
        if (count > 0) {
            this.diagnostics.warn(Diagnostic.Category.WEIGHTING,
                    "Weight column '%s': Replacing %d %s values with 1. This may bias results.",
                    weightVariable, count, what);
        }
    }

    /**
     * Calculates Kish's effective sample size {@code (Σw)² / Σw²} over the strictly positive, finite weights.
     *
     * @return the effective sample size or {@code 0} if there are no such weights
     */
    public static double effectiveN(double[] weights) {
        double sum = 0d, sumOfSquares = 0d;
        for (double weight : weights) {
            if (weight > 0 && !Double.isInfinite(weight)) {
                sum += weight;
                sumOfSquares += weight * weight;
            }
        }
        return sumOfSquares > 0 ? sum * sum / sumOfSquares : 0d;
    }

    /**
     * Calculates the effective sample size rounded to an integer. Unit weights yield their count.
     */
    public static long roundedEffectiveN(double[] weights) {
        boolean isUnit = true;
        for (double weight : weights) {
            if (weight != 1d) {
                isUnit = false;
                break;
            }
        }
        if (isUnit) return weights.length;
        return Math.round(effectiveN(weights));
    }

    /**
     * Calculates the design effect, i.e., the number of positive weights divided by the effective sample size.
     *
     * @return the design effect or {@link Double#NaN} if there are no positive weights
     */
    public static double designEffect(double[] weights) {
        int numPositive = 0;
        for (double weight : weights) {
            if (weight > 0 && !Double.isInfinite(weight)) numPositive++;
        }
        double effectiveN = effectiveN(weights);
        return effectiveN > 0 ? numPositive / effectiveN : Double.NaN;
    }

    /**
     * Describes the given weights.
     */
    public static WeightSummary summarize(double[] weights) {
        DoubleArrayList valid = new DoubleArrayList();
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY, sum = 0d;
        for (double weight : weights) {
            if (weight > 0 && !Double.isInfinite(weight)) {
                valid.add(weight);
                min = Math.min(min, weight);
                max = Math.max(max, weight);
                sum += weight;
            }
        }
        if (valid.isEmpty()) {
            return new WeightSummary(weights.length, 0, Double.NaN, Double.NaN, Double.NaN, 0d, 0d, Double.NaN, Double.NaN);
        }
        double mean = sum / valid.size();
        double cv = Double.NaN;
        if (valid.size() > 1) {
            double squaredDeviations = 0d;
            for (int i = 0; i < valid.size(); i++) {
                double deviation = valid.getDouble(i) - mean;
                squaredDeviations += deviation * deviation;
            }
            cv = Math.sqrt(squaredDeviations / (valid.size() - 1)) / mean;
        }
        double effectiveN = effectiveN(weights);
        return new WeightSummary(weights.length, valid.size(), min, max, mean, sum, effectiveN,
                valid.size() / effectiveN, cv);
    }
}
