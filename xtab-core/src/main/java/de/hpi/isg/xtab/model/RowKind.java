package de.hpi.isg.xtab.model;

/**
 * Tags the rows of a {@link QuestionTable} with the kind of statistic they carry.
 */
public enum RowKind {

    FREQUENCY("Frequency", false),
    COLUMN_PERCENT("Column %", false),
    ROW_PERCENT("Row %", false),
    AVERAGE("Average", false),
    INDEX("Index", false),
    SCORE("Score", false),
    MEDIAN("Median", false),
    STANDARD_DEVIATION("StdDev", false),
    VARIANCE("Variance", false),
    BASE("Base", false),
    SIGNIFICANCE("Sig.", true),
    CHI_SQUARE("ChiSquare", true);

    private final String label;

    /**
     * Whether rows of this kind carry texts rather than numbers.
     */
    private final boolean isTextual;

    RowKind(String label, boolean isTextual) {
        this.label = label;
        this.isTextual = isTextual;
    }

    public String getLabel() {
        return this.label;
    }

    public boolean isTextual() {
        return this.isTextual;
    }

    @Override
    public String toString() {
        return this.label;
    }
}
