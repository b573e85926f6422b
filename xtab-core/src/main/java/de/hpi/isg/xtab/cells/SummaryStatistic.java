package de.hpi.isg.xtab.cells;

import de.hpi.isg.xtab.model.RowKind;
import de.hpi.isg.xtab.significance.MeanSample;
import it.unimi.dsi.fastutil.doubles.DoubleList;

/**
 * A summary value of a question within a segment (e.g., a mean rating) together with the individual values it is
 * based on, which are needed for significance tests.
 */
public class SummaryStatistic {

    private final String name;

    private final RowKind kind;

    private final double value;

    private final MeanSample sample;

    public SummaryStatistic(String name, RowKind kind, double value, DoubleList values, DoubleList weights) {
        this.name = name;
        this.kind = kind;
        this.value = value;
        this.sample = new MeanSample(values, weights);
    }

    /**
     * @return the row label, e.g., {@code Mean} or {@code NPS Score}
     */
    public String getName() {
        return this.name;
    }

    public RowKind getKind() {
        return this.kind;
    }

    public double getValue() {
        return this.value;
    }

    public MeanSample getSample() {
        return this.sample;
    }

    @Override
    public String toString() {
        return String.format("%s=%.3f (n=%d)", this.name, this.value, this.sample.size());
    }
}
