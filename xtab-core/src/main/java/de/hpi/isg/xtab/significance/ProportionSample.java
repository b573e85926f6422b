package de.hpi.isg.xtab.significance;

/**
 * The data of a segment for a proportion test: the weighted count of the row, the weighted base and the effective
 * base of the segment.
 */
public class ProportionSample {

    private final double count, base, effectiveN;

    public ProportionSample(double count, double base, double effectiveN) {
        this.count = count;
        this.base = base;
        this.effectiveN = effectiveN;
    }

    public double getCount() {
        return this.count;
    }

    public double getBase() {
        return this.base;
    }

    /**
     * @return the effective base or {@link Double#NaN} if it is unknown
     */
    public double getEffectiveN() {
        return this.effectiveN;
    }

    @Override
    public String toString() {
        return String.format("ProportionSample[%.2f/%.2f, effective n=%.2f]", this.count, this.base, this.effectiveN);
    }
}
