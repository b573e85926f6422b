package de.hpi.isg.xtab.tables;

import de.hpi.isg.xtab.cells.BaseCalculator;
import de.hpi.isg.xtab.cells.CellCalculator;
import de.hpi.isg.xtab.diagnostics.Diagnostic;
import de.hpi.isg.xtab.model.BaseSize;
import de.hpi.isg.xtab.model.ColumnVector;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.QuestionRow;
import de.hpi.isg.xtab.model.QuestionTable;
import de.hpi.isg.xtab.model.ResponseOption;
import de.hpi.isg.xtab.model.RowKind;
import de.hpi.isg.xtab.model.SegmentKey;
import de.hpi.isg.xtab.significance.MeanSample;
import de.hpi.isg.xtab.util.WeightedStatistics;
import de.hpi.isg.xtab.weighting.WeightSequence;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Tabulates numeric questions: optional bin rows, then mean, median and standard deviation per segment and the
 * significance row of the means. Values outside the declared range of the question are excluded.
 */
public class NumericQuestionProcessor implements QuestionProcessor {

    private final BaseCalculator baseCalculator = new BaseCalculator();

    private final CellCalculator cellCalculator = new CellCalculator();

    @Override
    public QuestionTable process(QuestionDefinition question, TableContext context) {
        StandardQuestionProcessor.resolveColumns(question, context);
        ColumnVector column = context.getTable().getColumn(question.getCode());
        WeightSequence weights = context.getWeights();

        Map<SegmentKey, BaseSize> bases = this.baseCalculator.questionBases(
                question, context.getTable(), context.getRowIndices(), weights
        );
        QuestionTable.Builder table = QuestionTable.builder(question.getCode(), question.getText(),
                context.getRowIndices().getKeys())
                .setBaseFilter(question.getBaseFilter())
                .setBases(bases);

        // Bins.
        List<ResponseOption> bins = question.getOptions().stream()
                .filter(ResponseOption::isBin)
                .sorted(Comparator.comparingInt(ResponseOption::getDisplayOrder))
                .collect(Collectors.toList());
        for (ResponseOption bin : bins) {
            Map<SegmentKey, Double> counts = new LinkedHashMap<>();
            for (SegmentKey key : table.getKeys()) {
                IntList rows = context.getRowIndices().get(key);
                double count = 0d;
                for (int i = 0; i < rows.size(); i++) {
                    int row = rows.getInt(i);
                    if (bin.containsNumber(column.getNumber(row))) count += weights.get(row);
                }
                counts.put(key, count);
            }
            if (context.getConfiguration().showFrequency) {
                this.cellCalculator.addFrequencyRow(table, bin.getDisplayText(), counts);
            }
            if (context.getConfiguration().showColumnPercent) {
                this.cellCalculator.addColumnPercentRow(table, bin.getDisplayText(), counts, bases);
            }
        }

        // Per-segment samples.
        Map<SegmentKey, MeanSample> samples = new LinkedHashMap<>();
        int numOutOfRange = 0;
        for (SegmentKey key : table.getKeys()) {
            IntList rows = context.getRowIndices().get(key);
            DoubleArrayList values = new DoubleArrayList(), valueWeights = new DoubleArrayList();
            for (int i = 0; i < rows.size(); i++) {
                int row = rows.getInt(i);
                double value = column.getNumber(row);
                if (Double.isNaN(value)) continue;
                if (!isInRange(question, value)) {
                    if (key.isTotal()) numOutOfRange++;
                    continue;
                }
                values.add(value);
                valueWeights.add(weights.get(row));
            }
            samples.put(key, new MeanSample(values, valueWeights));
        }
        if (numOutOfRange > 0) {
            context.getDiagnostics().warn(Diagnostic.Category.QUESTION,
                    "%d value(s) of %s lie outside [%s, %s] and are excluded from the statistics.",
                    numOutOfRange, question.getCode(), question.getMinValue(), question.getMaxValue());
        }

        QuestionRow meanRow = table.addRow("Mean", RowKind.AVERAGE);
        QuestionRow medianRow = context.getConfiguration().showNumericMedian ? table.addRow("Median", RowKind.MEDIAN) : null;
        QuestionRow sdRow = table.addRow("Standard Deviation", RowKind.STANDARD_DEVIATION);
        for (Map.Entry<SegmentKey, MeanSample> entry : samples.entrySet()) {
            MeanSample sample = entry.getValue();
            meanRow.setValue(entry.getKey(), WeightedStatistics.mean(sample.getValues(), sample.getWeights()));
            if (medianRow != null) {
                medianRow.setValue(entry.getKey(), WeightedStatistics.median(sample.getValues(), sample.getWeights()));
            }
            sdRow.setValue(entry.getKey(), WeightedStatistics.standardDeviation(sample.getValues(), sample.getWeights()));
        }

        if (context.isSignificanceTesting()) {
            Map<SegmentKey, MeanSample> testSamples = new LinkedHashMap<>(samples);
            testSamples.remove(SegmentKey.TOTAL);
            context.getSignificanceTester().addRow(table, "Mean",
                    context.getSignificanceTester().testMeans(testSamples));
            context.getSignificanceTester().reportSkippedComparisons();
        }
        return table.build();
    }

    private static boolean isInRange(QuestionDefinition question, double value) {
        return (Double.isNaN(question.getMinValue()) || value >= question.getMinValue()) &&
                (Double.isNaN(question.getMaxValue()) || value <= question.getMaxValue());
    }
}
