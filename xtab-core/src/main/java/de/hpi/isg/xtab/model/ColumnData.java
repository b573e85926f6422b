package de.hpi.isg.xtab.model;

/**
 * Comprises the data of a {@link Column}. Values are stored both as texts and as numbers so that matching against
 * option texts and numeric aggregation do not need to reparse them.
 */
public class ColumnData implements ColumnVector {

    /**
     * The {@link Column} whose data is being stored by this instance.
     */
    private final Column column;

    private final String[] texts;

    private final double[] numbers;

    private final boolean isNumeric;

    private ColumnData(Column column, String[] texts, double[] numbers, boolean isNumeric) {
        this.column = column;
        this.texts = texts;
        this.numbers = numbers;
        this.isNumeric = isNumeric;
    }

    static ColumnData ofTexts(Column column, String[] values) {
        double[] numbers = new double[values.length];
        for (int row = 0; row < values.length; row++) {
            numbers[row] = Values.parseNumber(values[row]);
        }
        return new ColumnData(column, values.clone(), numbers, false);
    }

    static ColumnData ofNumbers(Column column, Double[] values) {
        String[] texts = new String[values.length];
        double[] numbers = new double[values.length];
        for (int row = 0; row < values.length; row++) {
            Double value = values[row];
            numbers[row] = value == null ? Double.NaN : value;
            texts[row] = Values.format(numbers[row]);
        }
        return new ColumnData(column, texts, numbers, true);
    }

    @Override
    public Column getColumn() {
        return this.column;
    }

    @Override
    public boolean isNumeric() {
        return this.isNumeric;
    }

    @Override
    public int size() {
        return this.texts.length;
    }

    @Override
    public String getText(int row) {
        return this.texts[row];
    }

    @Override
    public double getNumber(int row) {
        return this.numbers[row];
    }

    @Override
    public String toString() {
        return "Data for " + this.column;
    }
}
