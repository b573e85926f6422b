package de.hpi.isg.xtab.model;

import de.hpi.isg.xtab.error.CrosstabException;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.List;

/**
 * Column-oriented survey data. An instance either holds all loaded rows or is a view on a subset of the rows of
 * another instance (e.g., after applying a base filter). Views share the {@link ColumnData} and only keep a mapping
 * to the original rows.
 */
public class RespondentTable {

    private final TableSchema schema;

    /**
     * {@link ColumnData} objects aligned with the {@link Column}s in the {@link #schema}.
     */
    private final ColumnData[] columnData;

    /**
     * Maps the rows of this instance to rows of the {@link #columnData} or {@code null} if there is no such
     * mapping.
     */
    private final int[] rowMapping;

    private final int numRows;

    private RespondentTable(TableSchema schema, ColumnData[] columnData, int[] rowMapping, int numRows) {
        this.schema = schema;
        this.columnData = columnData;
        this.rowMapping = rowMapping;
        this.numRows = numRows;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public TableSchema getSchema() {
        return this.schema;
    }

    public int getNumRows() {
        return this.numRows;
    }

    public boolean hasColumn(String name) {
        return this.schema.hasColumn(name);
    }

    /**
     * Provides the values of a column, aligned with the rows of this instance.
     *
     * @return the {@link ColumnVector} or {@code null} if there is no such column
     */
    public ColumnVector getColumn(String name) {
        Column column = this.schema.getColumn(name);
        if (column == null) return null;
        ColumnData data = this.columnData[column.getIndex()];
        return this.rowMapping == null ? data : new MappedColumn(data, this.rowMapping);
    }

    /**
     * Translates a row of this instance into the row of the fully loaded table.
     */
    public int getOriginalRow(int row) {
        return this.rowMapping == null ? row : this.rowMapping[row];
    }

    /**
     * @return whether this instance is a view on some other instance
     */
    public boolean isView() {
        return this.rowMapping != null;
    }

    /**
     * Creates a view on the given rows of this instance.
     *
     * @param rows rows of this instance in ascending order
     */
    public RespondentTable select(IntList rows) {
        int[] mapping = new int[rows.size()];
        int lastRow = -1;
        for (int i = 0; i < mapping.length; i++) {
            int row = rows.getInt(i);
            if (row <= lastRow || row >= this.numRows) {
                throw CrosstabException.invalidArgument(String.format("Illegal row selection at %d (row %d).", i, row));
            }
            mapping[i] = this.getOriginalRow(row);
            lastRow = row;
        }
        return new RespondentTable(this.schema, this.columnData, mapping, mapping.length);
    }

    @Override
    public String toString() {
        return String.format("%s[%d rows%s]", this.schema.getName(), this.numRows, this.isView() ? ", view" : "");
    }

    /**
     * {@link ColumnVector} on a subset of the rows of some {@link ColumnData}.
     */
    private static final class MappedColumn implements ColumnVector {

        private final ColumnData data;

        private final int[] rowMapping;

        private MappedColumn(ColumnData data, int[] rowMapping) {
            this.data = data;
            this.rowMapping = rowMapping;
        }

        @Override
        public Column getColumn() {
            return this.data.getColumn();
        }

        @Override
        public boolean isNumeric() {
            return this.data.isNumeric();
        }

        @Override
        public int size() {
            return this.rowMapping.length;
        }

        @Override
        public String getText(int row) {
            return this.data.getText(this.rowMapping[row]);
        }

        @Override
        public double getNumber(int row) {
            return this.data.getNumber(this.rowMapping[row]);
        }
    }

    /**
     * Assembles a {@link RespondentTable} column by column. All columns must have the same number of rows.
     */
    public static class Builder {

        private final TableSchema schema;

        private final List<ColumnData> columnData = new ArrayList<>();

        private int numRows = -1;

        private Builder(String name) {
            this.schema = new TableSchema(name);
        }

        /**
         * Adds a text column; {@code null} entries are missing values.
         */
        public Builder addTextColumn(String name, String... values) {
            this.checkNumRows(name, values.length);
            Column column = this.schema.appendColumn(name);
            this.columnData.add(ColumnData.ofTexts(column, values));
            return this;
        }

        /**
         * Adds a numeric column; {@code null} and {@link Double#NaN} entries are missing values.
         */
        public Builder addNumericColumn(String name, Double... values) {
            this.checkNumRows(name, values.length);
            Column column = this.schema.appendColumn(name);
            this.columnData.add(ColumnData.ofNumbers(column, values));
            return this;
        }

        public Builder addNumericColumn(String name, double[] values) {
            Double[] boxed = new Double[values.length];
            for (int i = 0; i < values.length; i++) {
                boxed[i] = values[i];
            }
            return this.addNumericColumn(name, boxed);
        }

        private void checkNumRows(String name, int numRows) {
            if (this.numRows == -1) {
                this.numRows = numRows;
            } else if (this.numRows != numRows) {
                throw CrosstabException.invalidArgument(String.format(
                        "Column \"%s\" has %d rows, but previous columns have %d.", name, numRows, this.numRows
                ));
            }
        }

        public RespondentTable build() {
            return new RespondentTable(
                    this.schema,
                    this.columnData.toArray(new ColumnData[0]),
                    null,
                    Math.max(this.numRows, 0)
            );
        }
    }
}
