package de.hpi.isg.xtab.significance;

import de.hpi.isg.xtab.error.CrosstabException;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;

/**
 * The data of a segment for a test on means: the individual values and their weights.
 */
public class MeanSample {

    private final DoubleList values, weights;

    public MeanSample(DoubleList values, DoubleList weights) {
        if (values.size() != weights.size()) {
            throw CrosstabException.invalidArgument(String.format(
                    "%d values and %d weights have different lengths.", values.size(), weights.size()
            ));
        }
        this.values = values;
        this.weights = weights;
    }

    public static MeanSample unweighted(double... values) {
        DoubleList weights = new DoubleArrayList(values.length);
        for (int i = 0; i < values.length; i++) weights.add(1d);
        return new MeanSample(new DoubleArrayList(values), weights);
    }

    public DoubleList getValues() {
        return this.values;
    }

    public DoubleList getWeights() {
        return this.weights;
    }

    public int size() {
        return this.values.size();
    }

    @Override
    public String toString() {
        return String.format("MeanSample[%d values]", this.values.size());
    }
}
