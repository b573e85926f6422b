package de.hpi.isg.xtab.cells;

import de.hpi.isg.xtab.banner.BannerGroup;
import de.hpi.isg.xtab.banner.BannerStructure;
import de.hpi.isg.xtab.banner.RowIndexMap;
import de.hpi.isg.xtab.model.BaseSize;
import de.hpi.isg.xtab.model.ColumnVector;
import de.hpi.isg.xtab.model.QuestionRow;
import de.hpi.isg.xtab.model.QuestionTable;
import de.hpi.isg.xtab.model.RespondentTable;
import de.hpi.isg.xtab.model.RowKind;
import de.hpi.isg.xtab.model.SegmentKey;
import de.hpi.isg.xtab.model.Values;
import de.hpi.isg.xtab.weighting.WeightSequence;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted counts and percentages per segment.
 */
public class CellCalculator {

    /**
     * Calculates {@code count / base * 100}.
     *
     * @return the percentage or {@link Double#NaN} if the base is zero or undefined
     */
    public static double percentage(double count, double base) {
        if (Double.isNaN(base) || base == 0 || Double.isNaN(count)) return Double.NaN;
        return count / base * 100;
    }

    /**
     * Sums up the weights of the respondents of each segment whose response matches any of the given option texts.
     * For several (mention) columns, the matches of all columns are summed up, i.e., a respondent mentioning the same
     * option in two columns is counted twice.
     *
     * @param table       the (possibly filtered) respondents
     * @param columnNames the response columns; columns not in the {@code table} are ignored
     * @param optionTexts the option texts to count
     * @param rowIndices  the segmentation of the {@code table}
     * @param weights     the weights aligned with the {@code table}
     * @return the weighted counts in the order of the segmentation
     */
    public Map<SegmentKey, Double> rowCounts(RespondentTable table, List<String> columnNames,
                                             Collection<String> optionTexts, RowIndexMap rowIndices,
                                             WeightSequence weights) {
        List<ColumnVector> columns = new ArrayList<>();
        for (String name : columnNames) {
            ColumnVector column = table.getColumn(name);
            if (column != null) columns.add(column);
        }
        Map<SegmentKey, Double> counts = new LinkedHashMap<>();
        for (SegmentKey key : rowIndices.getKeys()) {
            IntList rows = rowIndices.get(key);
            double count = 0d;
            for (ColumnVector column : columns) {
                for (int i = 0; i < rows.size(); i++) {
                    int row = rows.getInt(i);
                    if (matchesAny(column.getText(row), optionTexts)) count += weights.get(row);
                }
            }
            counts.put(key, count);
        }
        return counts;
    }

    private static boolean matchesAny(String value, Collection<String> optionTexts) {
        if (value == null) return false;
        for (String optionText : optionTexts) {
            if (Values.matches(value, optionText)) return true;
        }
        return false;
    }

    /**
     * Appends a row with the weighted counts.
     */
    public QuestionRow addFrequencyRow(QuestionTable.Builder table, String label, Map<SegmentKey, Double> counts) {
        QuestionRow row = table.addRow(label, RowKind.FREQUENCY);
        for (Map.Entry<SegmentKey, Double> entry : counts.entrySet()) {
            row.setValue(entry.getKey(), entry.getValue());
        }
        return row;
    }

    /**
     * Appends a row with the counts relative to the weighted (or, if not available, unweighted) segment bases.
     */
    public QuestionRow addColumnPercentRow(QuestionTable.Builder table, String label, Map<SegmentKey, Double> counts,
                                           Map<SegmentKey, BaseSize> bases) {
        QuestionRow row = table.addRow(label, RowKind.COLUMN_PERCENT);
        for (Map.Entry<SegmentKey, Double> entry : counts.entrySet()) {
            BaseSize base = bases.get(entry.getKey());
            double baseValue = base == null ? Double.NaN :
                    Double.isNaN(base.getWeighted()) ? base.getUnweighted() : base.getWeighted();
            row.setValue(entry.getKey(), percentage(entry.getValue(), baseValue));
        }
        return row;
    }

    /**
     * Appends a row with the counts relative to their sum within each {@link BannerGroup}. The total column reports
     * 100 unless its count is zero.
     *
     * @param isZeroDivisionBlank whether divisions by zero yield undefined values rather than 0
     */
    public QuestionRow addRowPercentRow(QuestionTable.Builder table, String label, Map<SegmentKey, Double> counts,
                                        BannerStructure structure, boolean isZeroDivisionBlank) {
        QuestionRow row = table.addRow(label, RowKind.ROW_PERCENT);
        double zeroDivisionValue = isZeroDivisionBlank ? Double.NaN : 0d;
        Double totalCount = counts.get(SegmentKey.TOTAL);
        if (totalCount != null) {
            row.setValue(SegmentKey.TOTAL, totalCount == 0 ? zeroDivisionValue : 100d);
        }
        for (BannerGroup group : structure.getGroups()) {
            double groupTotal = 0d;
            for (SegmentKey key : group.getKeys()) {
                Double count = counts.get(key);
                if (count != null && !Double.isNaN(count)) groupTotal += count;
            }
            for (SegmentKey key : group.getKeys()) {
                Double count = counts.get(key);
                if (count == null) continue;
                row.setValue(key, groupTotal == 0 ? zeroDivisionValue : percentage(count, groupTotal));
            }
        }
        return row;
    }

    /**
     * Appends a row with one value per segment.
     */
    public QuestionRow addValueRow(QuestionTable.Builder table, String label, RowKind kind,
                                   Map<SegmentKey, Double> values) {
        QuestionRow row = table.addRow(label, kind);
        for (Map.Entry<SegmentKey, Double> entry : values.entrySet()) {
            row.setValue(entry.getKey(), entry.getValue() == null ? Double.NaN : entry.getValue());
        }
        return row;
    }
}
