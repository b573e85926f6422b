package de.hpi.isg.xtab.banner;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import de.hpi.isg.xtab.model.ColumnVector;
import de.hpi.isg.xtab.model.RespondentTable;
import de.hpi.isg.xtab.model.Values;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Membership test of a banner column: a respondent belongs to the column if any of the {@link #columnNames} holds
 * any of the {@link #optionTexts}. This covers single-choice columns (one column, one option), multi-mention columns
 * (several columns, one option) and box categories (several options).
 */
public class OptionPredicate implements Serializable {

    private final List<String> columnNames;

    private final Set<String> optionTexts;

    /**
     * Whether it suffices that some of the {@link #columnNames} exist in the data.
     */
    private final boolean isAllowingMissingColumns;

    public OptionPredicate(List<String> columnNames, Set<String> optionTexts, boolean isAllowingMissingColumns) {
        this.columnNames = new ArrayList<>(columnNames);
        this.optionTexts = new LinkedHashSet<>();
        for (String optionText : optionTexts) {
            if (optionText != null) this.optionTexts.add(optionText.trim());
        }
        this.isAllowingMissingColumns = isAllowingMissingColumns;
    }

    public List<String> getColumnNames() {
        return Collections.unmodifiableList(this.columnNames);
    }

    public Set<String> getOptionTexts() {
        return Collections.unmodifiableSet(this.optionTexts);
    }

    /**
     * Evaluates this instance for every row of the given table.
     *
     * @return a row mask
     * @throws CrosstabException if the required columns are not in the table
     */
    public boolean[] evaluate(RespondentTable table) {
        List<ColumnVector> columns = new ArrayList<>();
        List<String> missingColumns = new ArrayList<>();
        for (String columnName : this.columnNames) {
            ColumnVector column = table.getColumn(columnName);
            if (column == null) missingColumns.add(columnName);
            else columns.add(column);
        }
        if (columns.isEmpty() || (!this.isAllowingMissingColumns && !missingColumns.isEmpty())) {
            throw new CrosstabException(
                    ErrorCode.BANNER_COLUMN_NOT_FOUND, "Banner Column Not Found",
                    String.format("Banner column(s) %s not found in data.", missingColumns),
                    "Banner segments cannot be computed, so all crosstab columns would be wrong.",
                    "Check that the banner question code matches the data column name",
                    "Check the number of columns of multi-mention banner questions"
            );
        }

        boolean[] mask = new boolean[table.getNumRows()];
        for (ColumnVector column : columns) {
            for (int row = 0; row < mask.length; row++) {
                if (mask[row]) continue;
                String value = column.getText(row);
                if (value != null && this.optionTexts.contains(value.trim())) {
                    mask[row] = true;
                }
            }
        }
        return mask;
    }

    /**
     * Tests a single value against the option texts of this instance.
     */
    public boolean matches(String value) {
        for (String optionText : this.optionTexts) {
            if (Values.matches(value, optionText)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format("%s in %s", this.columnNames, this.optionTexts);
    }
}
