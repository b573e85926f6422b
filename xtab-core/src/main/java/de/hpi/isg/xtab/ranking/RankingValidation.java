package de.hpi.isg.xtab.ranking;

import com.google.common.base.Joiner;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Data quality figures of a {@link RankingMatrix} together with the issues that exceed the configured thresholds.
 */
public class RankingValidation {

    private final int numOutOfRange, numNonInteger;

    private final double outOfRangePct, completePct, tiesPct, gapsPct;

    private final List<String> issues;

    RankingValidation(int numOutOfRange, double outOfRangePct, int numNonInteger, double completePct,
                      double tiesPct, double gapsPct, List<String> issues) {
        this.numOutOfRange = numOutOfRange;
        this.outOfRangePct = outOfRangePct;
        this.numNonInteger = numNonInteger;
        this.completePct = completePct;
        this.tiesPct = tiesPct;
        this.gapsPct = gapsPct;
        this.issues = Collections.unmodifiableList(issues);
    }

    public int getNumOutOfRange() {
        return this.numOutOfRange;
    }

    public double getOutOfRangePct() {
        return this.outOfRangePct;
    }

    public int getNumNonInteger() {
        return this.numNonInteger;
    }

    /**
     * @return the percentage of non-missing cells in the matrix
     */
    public double getCompletePct() {
        return this.completePct;
    }

    /**
     * @return the percentage of respondents that gave the same rank to several items
     */
    public double getTiesPct() {
        return this.tiesPct;
    }

    /**
     * @return the percentage of respondents whose ranks are not contiguous from {@code 1}
     */
    public double getGapsPct() {
        return this.gapsPct;
    }

    public boolean hasIssues() {
        return !this.issues.isEmpty();
    }

    public List<String> getIssues() {
        return this.issues;
    }

    public String getSummary() {
        if (this.hasIssues()) {
            return "Data quality issues detected: " + Joiner.on("; ").join(this.issues);
        }
        return String.format(Locale.ROOT, "Data quality: %.1f%% complete, %.1f%% ties, %.1f%% gaps",
                this.completePct, this.tiesPct, this.gapsPct);
    }

    @Override
    public String toString() {
        return "RankingValidation[" + this.getSummary() + "]";
    }
}
