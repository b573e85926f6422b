package de.hpi.isg.xtab.filter;

import de.hpi.isg.xtab.diagnostics.Diagnostic;
import de.hpi.isg.xtab.diagnostics.Diagnostics;
import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import de.hpi.isg.xtab.model.RespondentTable;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A parsed base filter that restricts the respondents a question is tabulated for. Respondents for whom the filter
 * is unknown (e.g., due to missing values) are excluded.
 */
public class BaseFilter {

    private final String expression;

    /**
     * The syntax tree or {@code null} if the filter retains all respondents.
     */
    private final FilterNode root;

    private BaseFilter(String expression, FilterNode root) {
        this.expression = expression;
        this.root = root;
    }

    /**
     * Parses a filter expression. A blank expression retains all respondents.
     *
     * @throws CrosstabException if the expression is unsafe or malformed
     */
    public static BaseFilter parse(String expression) {
        if (StringUtils.isBlank(expression)) return new BaseFilter("", null);
        String cleaned = FilterLexer.clean(expression);
        FilterLexer.checkSafety(cleaned);
        return new BaseFilter(cleaned, new FilterParser(cleaned).parse());
    }

    public String getExpression() {
        return this.expression;
    }

    public boolean isRetainingAll() {
        return this.root == null;
    }

    /**
     * @return the names of the columns the filter refers to
     */
    public Set<String> getColumns() {
        Set<String> columns = new LinkedHashSet<>();
        if (this.root != null) this.root.collectColumns(columns);
        return columns;
    }

    /**
     * Evaluates the filter for every respondent.
     *
     * @return a row mask over the {@code table}
     * @throws CrosstabException if the filter refers to columns that the {@code table} lacks
     */
    public boolean[] evaluate(RespondentTable table) {
        boolean[] mask = new boolean[table.getNumRows()];
        if (this.root == null) {
            Arrays.fill(mask, true);
            return mask;
        }
        List<String> missingColumns = new ArrayList<>();
        for (String column : this.getColumns()) {
            if (!table.hasColumn(column)) missingColumns.add(column);
        }
        if (!missingColumns.isEmpty()) {
            throw new CrosstabException(
                    ErrorCode.FILTER_COLUMN_NOT_FOUND, "Filter Column Not Found",
                    String.format("Filter '%s' refers to unknown column(s) %s.", this.expression, missingColumns),
                    "The filter cannot be evaluated without the data it refers to.",
                    "Check the spelling of the column names in the base filter"
            );
        }
        for (int row = 0; row < mask.length; row++) {
            mask[row] = Boolean.TRUE.equals(this.root.evaluate(table, row));
        }
        return mask;
    }

    /**
     * Restricts a table to the respondents passing the filter.
     *
     * @return a view on the {@code table} (or the {@code table} itself if the filter retains everybody)
     */
    public RespondentTable apply(RespondentTable table, Diagnostics diagnostics) {
        if (this.root == null) return table;
        boolean[] mask = this.evaluate(table);
        IntArrayList rows = new IntArrayList();
        for (int row = 0; row < mask.length; row++) {
            if (mask[row]) rows.add(row);
        }
        if (rows.isEmpty()) {
            diagnostics.warn(Diagnostic.Category.FILTER, "Filter retains 0 rows (filters out all data): '%s'",
                    this.expression);
        }
        return table.select(rows);
    }

    @Override
    public String toString() {
        return this.root == null ? "BaseFilter[all]" : "BaseFilter[" + this.root + "]";
    }
}
