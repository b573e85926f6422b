package de.hpi.isg.xtab.model;

/**
 * Read access to the values of one {@link Column} within a {@link RespondentTable}.
 */
public interface ColumnVector {

    Column getColumn();

    /**
     * Whether the column was loaded as a numeric column.
     */
    boolean isNumeric();

    int size();

    /**
     * @return the text representation of the value in the given row or {@code null} if it is missing
     */
    String getText(int row);

    /**
     * @return the numeric value in the given row or {@link Double#NaN} if it is missing or not numeric
     */
    double getNumber(int row);

    default boolean isMissing(int row) {
        return this.getText(row) == null;
    }

}
