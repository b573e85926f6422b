package de.hpi.isg.xtab.significance;

/**
 * Outcome of a pairwise significance test.
 */
public class TestResult {

    public enum Status {
        SIGNIFICANT, NOT_SIGNIFICANT, SKIPPED
    }

    private final Status status;

    private final double pValue;

    /**
     * Whether the first sample has the higher proportion or mean.
     */
    private final boolean isFirstHigher;

    /**
     * Why the test was skipped or {@code null}.
     */
    private final String reason;

    private TestResult(Status status, double pValue, boolean isFirstHigher, String reason) {
        this.status = status;
        this.pValue = pValue;
        this.isFirstHigher = isFirstHigher;
        this.reason = reason;
    }

    /**
     * Creates a result for a test that could not be performed.
     */
    public static TestResult skipped(String reason) {
        return new TestResult(Status.SKIPPED, Double.NaN, false, reason);
    }

    /**
     * Creates a result for a performed test.
     */
    public static TestResult of(double pValue, boolean isFirstHigher, double alpha) {
        Status status = !Double.isNaN(pValue) && pValue < alpha ? Status.SIGNIFICANT : Status.NOT_SIGNIFICANT;
        return new TestResult(status, pValue, isFirstHigher, null);
    }

    public Status getStatus() {
        return this.status;
    }

    public boolean isSignificant() {
        return this.status == Status.SIGNIFICANT;
    }

    public boolean isSkipped() {
        return this.status == Status.SKIPPED;
    }

    public double getPValue() {
        return this.pValue;
    }

    public boolean isFirstHigher() {
        return this.isFirstHigher;
    }

    public String getReason() {
        return this.reason;
    }

    @Override
    public String toString() {
        return this.isSkipped() ?
                String.format("TestResult[skipped: %s]", this.reason) :
                String.format("TestResult[%s, p=%.4f, first higher=%s]", this.status, this.pValue, this.isFirstHigher);
    }
}
