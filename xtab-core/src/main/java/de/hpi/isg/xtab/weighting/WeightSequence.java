package de.hpi.isg.xtab.weighting;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.model.RespondentTable;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Per-respondent design weights. Subsets (e.g., for segments or filtered tables) are views on the same weight array
 * and never copy it.
 */
public class WeightSequence {

    /**
     * The repaired weights of all loaded rows or {@code null} for unit weights.
     */
    private final double[] weights;

    /**
     * Maps the positions of this instance to positions in {@link #weights} or {@code null} if there is no such mapping.
     */
    private final int[] rowMapping;

    private final int size;

    private WeightSequence(double[] weights, int[] rowMapping, int size) {
        this.weights = weights;
        this.rowMapping = rowMapping;
        this.size = size;
    }

    /**
     * Creates unit weights, i.e., an unweighted analysis.
     */
    public static WeightSequence unit(int size) {
        return new WeightSequence(null, null, size);
    }

    /**
     * Wraps already repaired weights.
     */
    public static WeightSequence of(double... weights) {
        return new WeightSequence(weights, null, weights.length);
    }

    /**
     * @return whether these are real design weights rather than unit weights
     */
    public boolean isWeighted() {
        return this.weights != null;
    }

    public int size() {
        return this.size;
    }

    public double get(int position) {
        if (this.weights == null) return 1d;
        return this.weights[this.rowMapping == null ? position : this.rowMapping[position]];
    }

    /**
     * Creates a view on the given positions of this instance.
     */
    public WeightSequence select(IntList positions) {
        if (this.weights == null) return unit(positions.size());
        int[] mapping = new int[positions.size()];
        for (int i = 0; i < mapping.length; i++) {
            int position = positions.getInt(i);
            mapping[i] = this.rowMapping == null ? position : this.rowMapping[position];
        }
        return new WeightSequence(this.weights, mapping, mapping.length);
    }

    /**
     * Aligns this instance, which must cover all loaded rows, with a view on the {@link RespondentTable}.
     */
    public WeightSequence alignWith(RespondentTable table) {
        if (!table.isView()) {
            if (table.getNumRows() != this.size) {
                throw CrosstabException.invalidArgument(String.format(
                        "%d weights do not match %d rows.", this.size, table.getNumRows()
                ));
            }
            return this;
        }
        if (this.rowMapping != null) {
            throw CrosstabException.invalidArgument("Only unmapped weights can be aligned with a table view.");
        }
        if (this.weights == null) return unit(table.getNumRows());
        int[] mapping = new int[table.getNumRows()];
        for (int row = 0; row < mapping.length; row++) {
            mapping[row] = table.getOriginalRow(row);
        }
        return new WeightSequence(this.weights, mapping, mapping.length);
    }

    /**
     * Sums up the weights at the given positions.
     */
    public double sum(IntList positions) {
        if (this.weights == null) return positions.size();
        double sum = 0d;
        for (int i = 0; i < positions.size(); i++) {
            sum += this.get(positions.getInt(i));
        }
        return sum;
    }

    public double sum() {
        if (this.weights == null) return this.size;
        double sum = 0d;
        for (int i = 0; i < this.size; i++) {
            sum += this.get(i);
        }
        return sum;
    }

    /**
     * Kish's effective sample size over the given positions.
     *
     * @see WeightingEngine#effectiveN(double[])
     */
    public double effectiveN(IntList positions) {
        if (this.weights == null) return positions.size();
        double sum = 0d, sumOfSquares = 0d;
        for (int i = 0; i < positions.size(); i++) {
            double weight = this.get(positions.getInt(i));
            if (weight > 0 && !Double.isInfinite(weight)) {
                sum += weight;
                sumOfSquares += weight * weight;
            }
        }
        return sumOfSquares > 0 ? sum * sum / sumOfSquares : 0d;
    }

    /**
     * @return a copy of the weights of this instance
     */
    public double[] toArray() {
        double[] array = new double[this.size];
        for (int i = 0; i < this.size; i++) {
            array[i] = this.get(i);
        }
        return array;
    }

    @Override
    public String toString() {
        return String.format("WeightSequence[%d, %s]", this.size, this.isWeighted() ? "weighted" : "unit");
    }
}
