package de.hpi.isg.xtab.model;

import java.io.Serializable;

/**
 * Sample size of a segment: the number of respondents, their summed weight and the effective sample size.
 */
public class BaseSize implements Serializable {

    public static final BaseSize EMPTY = new BaseSize(0, 0d, 0d);

    private final int unweighted;

    private final double weighted, effective;

    public BaseSize(int unweighted, double weighted, double effective) {
        this.unweighted = unweighted;
        this.weighted = weighted;
        this.effective = effective;
    }

    public int getUnweighted() {
        return this.unweighted;
    }

    public double getWeighted() {
        return this.weighted;
    }

    public double getEffective() {
        return this.effective;
    }

    public boolean isEmpty() {
        return this.unweighted == 0;
    }

    @Override
    public String toString() {
        return String.format("BaseSize[n=%d, weighted=%.2f, effective=%.2f]",
                this.unweighted, this.weighted, this.effective);
    }
}
