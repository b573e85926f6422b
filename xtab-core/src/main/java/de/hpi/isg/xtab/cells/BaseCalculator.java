package de.hpi.isg.xtab.cells;

import de.hpi.isg.xtab.banner.RowIndexMap;
import de.hpi.isg.xtab.model.BaseSize;
import de.hpi.isg.xtab.model.ColumnVector;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.RespondentTable;
import de.hpi.isg.xtab.model.SegmentKey;
import de.hpi.isg.xtab.model.Values;
import de.hpi.isg.xtab.model.VariableType;
import de.hpi.isg.xtab.weighting.WeightSequence;
import de.hpi.isg.xtab.weighting.WeightingEngine;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calculates the sample sizes of segments, either over all respondents of a segment (banner bases) or over the
 * respondents of a segment who answered a certain question (question bases).
 */
public class BaseCalculator {

    /**
     * Calculates the bases over all respondents of each segment. The effective base is not rounded.
     *
     * @param rowIndices the segmentation
     * @param weights    the weights aligned with the segmented table
     * @return the {@link BaseSize}s in the order of the segmentation
     */
    public Map<SegmentKey, BaseSize> bannerBases(RowIndexMap rowIndices, WeightSequence weights) {
        Map<SegmentKey, BaseSize> bases = new LinkedHashMap<>();
        for (SegmentKey key : rowIndices.getKeys()) {
            IntList rows = rowIndices.get(key);
            bases.put(key, new BaseSize(rows.size(), weights.sum(rows), weights.effectiveN(rows)));
        }
        return bases;
    }

    /**
     * Calculates the bases over the respondents of each segment who answered the given question. The effective base
     * is rounded to an integer.
     *
     * @param question   the question
     * @param table      the (possibly filtered) respondents
     * @param rowIndices the segmentation of the {@code table}
     * @param weights    the weights aligned with the {@code table}
     * @return the {@link BaseSize}s in the order of the segmentation
     */
    public Map<SegmentKey, BaseSize> questionBases(QuestionDefinition question, RespondentTable table,
                                                   RowIndexMap rowIndices, WeightSequence weights) {
        boolean[] hasAnswered = this.answered(question, table);
        Map<SegmentKey, BaseSize> bases = new LinkedHashMap<>();
        for (SegmentKey key : rowIndices.getKeys()) {
            bases.put(key, this.base(rowIndices.get(key), hasAnswered, weights));
        }
        return bases;
    }

    /**
     * Calculates the base over those of the given rows that pass a row mask.
     */
    public BaseSize base(IntList rows, boolean[] mask, WeightSequence weights) {
        int count = 0;
        double sum = 0d;
        DoubleArrayList selectedWeights = new DoubleArrayList();
        for (int i = 0; i < rows.size(); i++) {
            int row = rows.getInt(i);
            if (!mask[row]) continue;
            double weight = weights.get(row);
            count++;
            sum += weight;
            selectedWeights.add(weight);
        }
        double effective = weights.isWeighted() ?
                WeightingEngine.roundedEffectiveN(selectedWeights.toDoubleArray()) :
                count;
        return new BaseSize(count, sum, effective);
    }

    /**
     * Determines which respondents answered a question.
     *
     * @return a row mask over the {@code table}
     */
    public boolean[] answered(QuestionDefinition question, RespondentTable table) {
        boolean[] mask = new boolean[table.getNumRows()];
        VariableType type = question.getType();
        List<ColumnVector> columns = new ArrayList<>();
        if (type == VariableType.RANKING) {
            for (String name : table.getSchema().findColumnNames(name -> name.startsWith(question.getCode() + "_"))) {
                columns.add(table.getColumn(name));
            }
            for (ColumnVector column : columns) {
                for (int row = 0; row < mask.length; row++) {
                    mask[row] |= !column.isMissing(row);
                }
            }
            return mask;
        }

        for (String name : question.getColumnNames()) {
            ColumnVector column = table.getColumn(name);
            if (column != null) columns.add(column);
        }
        for (ColumnVector column : columns) {
            for (int row = 0; row < mask.length; row++) {
                if (mask[row]) continue;
                if (column.isNumeric()) {
                    double value = column.getNumber(row);
                    boolean isZeroAllowed = type.hasSummaryStatistic();
                    mask[row] = !Double.isNaN(value) && (isZeroAllowed || value != 0);
                } else {
                    mask[row] = !Values.isBlank(column.getText(row));
                }
            }
        }
        return mask;
    }
}
