package de.hpi.isg.xtab.ranking;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.model.RankDirection;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rank-order responses of a ranking question in a column layout: one column per ranked item, one row per
 * respondent. Missing ranks are {@link Double#NaN}. After {@link #normalize(RankDirection)}, rank {@code 1} is
 * always the best rank.
 */
public class RankingMatrix {

    /**
     * Display labels of the ranked items.
     */
    private final List<String> items;

    /**
     * The ranks; {@code ranks[item][row]}.
     */
    private final double[][] ranks;

    private final int numRows;

    private final int numPositions;

    public RankingMatrix(List<String> items, double[][] ranks, int numRows, int numPositions) {
        Validate.isTrue(items.size() == ranks.length, "%d items but %d rank columns", items.size(), ranks.length);
        Validate.isTrue(numPositions >= 1, "Number of positions must be positive, got %d", numPositions);
        for (double[] column : ranks) {
            Validate.isTrue(column.length == numRows, "Rank column of length %d in a matrix with %d rows",
                    column.length, numRows);
        }
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
        this.ranks = ranks;
        this.numRows = numRows;
        this.numPositions = numPositions;
    }

    public List<String> getItems() {
        return this.items;
    }

    public int getNumItems() {
        return this.items.size();
    }

    public int getNumRows() {
        return this.numRows;
    }

    /**
     * @return the number of available rank positions
     */
    public int getNumPositions() {
        return this.numPositions;
    }

    public boolean isEmpty() {
        return this.numRows == 0 || this.items.isEmpty();
    }

    /**
     * @return the rank of the item in the row or {@link Double#NaN} if it was not ranked
     */
    public double getRank(int row, int item) {
        return this.ranks[item][row];
    }

    public int getItemIndex(String item) {
        int index = this.items.indexOf(item);
        if (index == -1) {
            throw CrosstabException.invalidArgument(String.format("No ranking item \"%s\" in %s.", item, this.items));
        }
        return index;
    }

    /**
     * Tells whether a rank lies within {@code [1, numPositions]}.
     */
    public boolean isInRange(double rank) {
        return !Double.isNaN(rank) && rank >= 1 && rank <= this.numPositions;
    }

    /**
     * Tells whether the given row carries at least one rank.
     */
    public boolean hasAnyRank(int row) {
        for (double[] column : this.ranks) {
            if (!Double.isNaN(column[row])) return true;
        }
        return false;
    }

    /**
     * Converts ranks given in the {@code direction} into best-to-worst ranks via
     * {@code rank' = numPositions + 1 - rank}. The transformation is its own inverse.
     *
     * @return the normalized matrix (or this instance for {@link RankDirection#BEST_TO_WORST})
     */
    public RankingMatrix normalize(RankDirection direction) {
        if (direction == RankDirection.BEST_TO_WORST) return this;
        double[][] flipped = new double[this.ranks.length][];
        for (int item = 0; item < this.ranks.length; item++) {
            flipped[item] = new double[this.numRows];
            for (int row = 0; row < this.numRows; row++) {
                double rank = this.ranks[item][row];
                flipped[item][row] = Double.isNaN(rank) ? Double.NaN : this.numPositions + 1 - rank;
            }
        }
        return new RankingMatrix(this.items, flipped, this.numRows, this.numPositions);
    }

    /**
     * Undoes {@link #normalize(RankDirection)}.
     */
    public RankingMatrix denormalize(RankDirection direction) {
        return this.normalize(direction);
    }

    @Override
    public String toString() {
        return String.format("RankingMatrix[%d rows x %s, %d positions]", this.numRows, this.items, this.numPositions);
    }
}
