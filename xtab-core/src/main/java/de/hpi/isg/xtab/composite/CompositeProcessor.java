package de.hpi.isg.xtab.composite;

import de.hpi.isg.xtab.cells.BaseCalculator;
import de.hpi.isg.xtab.model.BaseSize;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.QuestionRow;
import de.hpi.isg.xtab.model.QuestionTable;
import de.hpi.isg.xtab.model.RowKind;
import de.hpi.isg.xtab.model.SegmentKey;
import de.hpi.isg.xtab.significance.MeanSample;
import de.hpi.isg.xtab.tables.TableContext;
import de.hpi.isg.xtab.util.WeightedStatistics;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tabulates a composite metric like a regular mean question: one row with the weighted mean composite value per
 * segment followed by the significance row of the means.
 */
public class CompositeProcessor {

    private final Logger logger = LoggerFactory.getLogger(this.getClass());

    private final CompositeCalculator calculator = new CompositeCalculator();

    private final BaseCalculator baseCalculator = new BaseCalculator();

    /**
     * Tabulates a validated composite.
     *
     * @param composite the composite
     * @param questions the declared questions by their codes
     * @param context   the respondents with their segmentation
     * @return the composite table
     * @throws de.hpi.isg.xtab.error.CrosstabException if no respondent has a composite value
     */
    public QuestionTable process(CompositeDefinition composite, Map<String, QuestionDefinition> questions,
                                 TableContext context) {
        double[] values = this.calculator.calculate(composite, questions, context.getTable());
        boolean[] hasValue = new boolean[values.length];
        for (int row = 0; row < values.length; row++) {
            hasValue[row] = !Double.isNaN(values[row]);
        }

        Map<SegmentKey, BaseSize> bases = new LinkedHashMap<>();
        Map<SegmentKey, MeanSample> samples = new LinkedHashMap<>();
        for (SegmentKey key : context.getRowIndices().getKeys()) {
            IntList rows = context.getRowIndices().get(key);
            bases.put(key, this.baseCalculator.base(rows, hasValue, context.getWeights()));
            DoubleArrayList segmentValues = new DoubleArrayList(), segmentWeights = new DoubleArrayList();
            for (int i = 0; i < rows.size(); i++) {
                int row = rows.getInt(i);
                if (!hasValue[row]) continue;
                segmentValues.add(values[row]);
                segmentWeights.add(context.getWeights().get(row));
            }
            samples.put(key, new MeanSample(segmentValues, segmentWeights));
        }

        QuestionTable.Builder table = QuestionTable.builder(composite.getCode(), composite.getLabel(),
                context.getRowIndices().getKeys())
                .setBases(bases);
        QuestionRow valueRow = table.addRow(composite.getLabel(), getRowKind(composite, questions));
        for (Map.Entry<SegmentKey, MeanSample> entry : samples.entrySet()) {
            MeanSample sample = entry.getValue();
            valueRow.setValue(entry.getKey(), WeightedStatistics.mean(sample.getValues(), sample.getWeights()));
        }

        if (context.isSignificanceTesting()) {
            Map<SegmentKey, MeanSample> testSamples = new LinkedHashMap<>(samples);
            testSamples.remove(SegmentKey.TOTAL);
            context.getSignificanceTester().addRow(table, composite.getLabel(),
                    context.getSignificanceTester().testMeans(testSamples));
            context.getSignificanceTester().reportSkippedComparisons();
        }

        QuestionTable result = table.build();
        this.logger.debug("Tabulated composite {}.", result);
        return result;
    }

    /**
     * Likert composites are indices, Rating and Numeric composites are averages.
     */
    static RowKind getRowKind(CompositeDefinition composite, Map<String, QuestionDefinition> questions) {
        QuestionDefinition firstSource = questions.get(composite.getSourceQuestions().get(0));
        switch (firstSource.getType()) {
            case RATING:
            case NUMERIC:
                return RowKind.AVERAGE;
            case LIKERT:
                return RowKind.INDEX;
            default:
                return RowKind.SCORE;
        }
    }
}
