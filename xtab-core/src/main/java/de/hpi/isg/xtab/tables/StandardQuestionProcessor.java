package de.hpi.isg.xtab.tables;

import de.hpi.isg.xtab.banner.RowIndexMap;
import de.hpi.isg.xtab.cells.BaseCalculator;
import de.hpi.isg.xtab.cells.CellCalculator;
import de.hpi.isg.xtab.cells.SummaryCalculator;
import de.hpi.isg.xtab.cells.SummaryStatistic;
import de.hpi.isg.xtab.config.AnalysisConfiguration;
import de.hpi.isg.xtab.diagnostics.Diagnostic;
import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import de.hpi.isg.xtab.model.BaseSize;
import de.hpi.isg.xtab.model.ColumnVector;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.QuestionRow;
import de.hpi.isg.xtab.model.QuestionTable;
import de.hpi.isg.xtab.model.ResponseOption;
import de.hpi.isg.xtab.model.RowKind;
import de.hpi.isg.xtab.model.SegmentKey;
import de.hpi.isg.xtab.model.VariableType;
import de.hpi.isg.xtab.significance.ChiSquareTest;
import de.hpi.isg.xtab.significance.MeanSample;
import de.hpi.isg.xtab.significance.ProportionSample;
import de.hpi.isg.xtab.util.WeightedStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Tabulates single-choice, multi-mention, Rating, Likert and NPS questions. The rows are, in this order: per shown
 * option the frequency, column % and row % rows with a proportion significance row; per box category the same;
 * the chi-square row; the net positive row; and finally the summary statistic with its standard deviation and its
 * significance row.
 */
public class StandardQuestionProcessor implements QuestionProcessor {

    /**
     * Box categories that do not count as the bottom of a scale.
     */
    private static final Pattern NON_SUBSTANTIVE_CATEGORY =
            Pattern.compile("\\b(DK|NA|Don't Know|Not Applicable)\\b", Pattern.CASE_INSENSITIVE);

    private final Logger logger = LoggerFactory.getLogger(this.getClass());

    private final BaseCalculator baseCalculator = new BaseCalculator();

    private final CellCalculator cellCalculator = new CellCalculator();

    private final SummaryCalculator summaryCalculator = new SummaryCalculator();

    private final ChiSquareTest chiSquareTest = new ChiSquareTest();

    @Override
    public QuestionTable process(QuestionDefinition question, TableContext context) {
        List<String> columns = resolveColumns(question, context);
        RowIndexMap rowIndices = context.getRowIndices();
        AnalysisConfiguration configuration = context.getConfiguration();

        Map<SegmentKey, BaseSize> bases = this.baseCalculator.questionBases(
                question, context.getTable(), rowIndices, context.getWeights()
        );
        QuestionTable.Builder table = QuestionTable.builder(question.getCode(), question.getText(), rowIndices.getKeys())
                .setBaseFilter(question.getBaseFilter())
                .setBases(bases);

        for (ResponseOption option : question.getOutputOptions()) {
            Map<SegmentKey, Double> counts = this.cellCalculator.rowCounts(
                    context.getTable(), columns, Collections.singleton(option.getOptionText()),
                    rowIndices, context.getWeights()
            );
            this.addCountRows(table, option.getDisplayText(), counts, bases, context,
                    configuration.showFrequency, configuration.showColumnPercent, configuration.showRowPercent);
        }

        List<String> categories = question.getBoxCategories();
        Map<String, Map<SegmentKey, Double>> categoryCounts = new LinkedHashMap<>();
        for (String category : categories) {
            List<String> optionTexts = question.getOptionsInBoxCategory(category).stream()
                    .map(ResponseOption::getOptionText)
                    .collect(Collectors.toList());
            Map<SegmentKey, Double> counts = this.cellCalculator.rowCounts(
                    context.getTable(), columns, optionTexts, rowIndices, context.getWeights()
            );
            categoryCounts.put(category, counts);
            this.addCountRows(table, category, counts, bases, context, configuration.boxCategoryFrequency,
                    configuration.boxCategoryColumnPercent, configuration.boxCategoryRowPercent);
        }

        if (configuration.enableChiSquare && categoryCounts.size() >= 2) {
            this.addChiSquareRow(table, categoryCounts, context);
        }
        if (configuration.showNetPositive) {
            this.addNetPositiveRow(table, categories, categoryCounts, bases);
        }
        if (question.isCreateIndex() && question.getType().hasSummaryStatistic()) {
            this.addSummaryRows(table, question, columns.get(0), context);
        }

        if (context.isSignificanceTesting()) {
            context.getSignificanceTester().reportSkippedComparisons();
        }
        QuestionTable result = table.build();
        this.logger.debug("Tabulated {}.", result);
        return result;
    }

    /**
     * Determines the response columns of a question that exist in the data.
     */
    static List<String> resolveColumns(QuestionDefinition question, TableContext context) {
        List<String> columns = new ArrayList<>();
        for (String name : question.getColumnNames()) {
            if (context.getTable().hasColumn(name)) columns.add(name);
        }
        if (columns.isEmpty()) {
            throw new CrosstabException(
                    ErrorCode.QUESTION_COLUMN_NOT_FOUND, "Question Column Not Found",
                    String.format("No data column(s) %s found for question %s.", question.getColumnNames(), question.getCode()),
                    "The question cannot be tabulated without its responses.",
                    "Check that the question code matches the data column name",
                    "For multi-mention questions, check the number of columns"
            );
        }
        return columns;
    }

    private void addCountRows(QuestionTable.Builder table, String label, Map<SegmentKey, Double> counts,
                              Map<SegmentKey, BaseSize> bases, TableContext context,
                              boolean isShowFrequency, boolean isShowColumnPercent, boolean isShowRowPercent) {
        if (isShowFrequency) {
            this.cellCalculator.addFrequencyRow(table, label, counts);
        }
        if (isShowColumnPercent) {
            this.cellCalculator.addColumnPercentRow(table, label, counts, bases);
        }
        if (isShowRowPercent) {
            this.cellCalculator.addRowPercentRow(table, label, counts, context.getStructure(),
                    context.getConfiguration().zeroDivisionAsBlank);
        }
        if (isShowColumnPercent && context.isSignificanceTesting()) {
            Map<SegmentKey, ProportionSample> samples = new LinkedHashMap<>();
            for (Map.Entry<SegmentKey, Double> entry : counts.entrySet()) {
                if (entry.getKey().isTotal()) continue;
                BaseSize base = bases.get(entry.getKey());
                samples.put(entry.getKey(), new ProportionSample(entry.getValue(), base.getWeighted(), base.getEffective()));
            }
            context.getSignificanceTester().addRow(table, label,
                    context.getSignificanceTester().testProportions(samples));
        }
    }

    private void addChiSquareRow(QuestionTable.Builder table, Map<String, Map<SegmentKey, Double>> categoryCounts,
                                 TableContext context) {
        List<SegmentKey> keys = table.getKeys().stream().filter(key -> !key.isTotal()).collect(Collectors.toList());
        if (keys.size() < 2) return;
        List<String> labels = new ArrayList<>(categoryCounts.keySet());
        double[][] observed = new double[labels.size()][keys.size()];
        for (int i = 0; i < labels.size(); i++) {
            Map<SegmentKey, Double> counts = categoryCounts.get(labels.get(i));
            for (int j = 0; j < keys.size(); j++) {
                observed[i][j] = counts.get(keys.get(j));
            }
        }
        ChiSquareTest.Result result = this.chiSquareTest.test(observed, labels, context.getConfiguration().alpha);
        if (result.isSkipped()) {
            context.getDiagnostics().warn(Diagnostic.Category.CHI_SQUARE, "Chi-square test skipped: %s.",
                    result.getSkipReason());
            return;
        }
        if (!result.getExcludedCategories().isEmpty()) {
            context.getDiagnostics().info(Diagnostic.Category.CHI_SQUARE,
                    "Sparse categories excluded from chi-square test: %s.", result.getExcludedCategories());
        }
        table.addRow(result.toLabel(), RowKind.CHI_SQUARE);
    }

    /**
     * Adds the column % of the last substantive box category minus the one of the first box category.
     */
    private void addNetPositiveRow(QuestionTable.Builder table, List<String> categories,
                                   Map<String, Map<SegmentKey, Double>> categoryCounts,
                                   Map<SegmentKey, BaseSize> bases) {
        if (categories.size() < 2) return;
        String top = categories.get(0);
        List<String> substantive = categories.stream()
                .filter(category -> !NON_SUBSTANTIVE_CATEGORY.matcher(category).find())
                .collect(Collectors.toList());
        String bottom = substantive.size() < 2 ? categories.get(categories.size() - 1) : substantive.get(substantive.size() - 1);
        if (top.equals(bottom)) return;

        QuestionRow row = table.addRow(String.format("NET POSITIVE (%s - %s)", bottom, top), RowKind.COLUMN_PERCENT);
        for (SegmentKey key : table.getKeys()) {
            double base = bases.get(key).getWeighted();
            double topPercent = CellCalculator.percentage(categoryCounts.get(top).get(key), base);
            double bottomPercent = CellCalculator.percentage(categoryCounts.get(bottom).get(key), base);
            row.setValue(key, bottomPercent - topPercent);
        }
    }

    private void addSummaryRows(QuestionTable.Builder table, QuestionDefinition question, String columnName,
                                TableContext context) {
        ColumnVector column = context.getTable().getColumn(columnName);
        if (question.getType() == VariableType.NPS) {
            int numInvalid = this.summaryCalculator.countInvalidNpsScores(
                    column, context.getRowIndices().get(SegmentKey.TOTAL));
            if (numInvalid > 0) {
                context.getDiagnostics().warn(Diagnostic.Category.QUESTION,
                        "%d value(s) of %s lie outside [0, 10] and are excluded from the NPS score.",
                        numInvalid, question.getCode());
            }
        }
        Map<SegmentKey, SummaryStatistic> statistics = new LinkedHashMap<>();
        for (SegmentKey key : table.getKeys()) {
            statistics.put(key, this.summaryCalculator.calculate(
                    question, column, context.getRowIndices().get(key), context.getWeights()
            ));
        }
        SummaryStatistic total = statistics.get(SegmentKey.TOTAL);
        if (total == null) {
            context.getDiagnostics().info(Diagnostic.Category.QUESTION,
                    "No valid responses for the %s of %s.", question.getType(), question.getCode());
            return;
        }

        QuestionRow summaryRow = table.addRow(total.getName(), total.getKind());
        for (Map.Entry<SegmentKey, SummaryStatistic> entry : statistics.entrySet()) {
            if (entry.getValue() != null) summaryRow.setValue(entry.getKey(), entry.getValue().getValue());
        }

        if (context.getConfiguration().showStandardDeviation) {
            QuestionRow sdRow = table.addRow("Standard Deviation", RowKind.STANDARD_DEVIATION);
            for (Map.Entry<SegmentKey, SummaryStatistic> entry : statistics.entrySet()) {
                if (entry.getValue() == null) continue;
                MeanSample sample = entry.getValue().getSample();
                sdRow.setValue(entry.getKey(), WeightedStatistics.standardDeviation(sample.getValues(), sample.getWeights()));
            }
        }

        if (context.isSignificanceTesting()) {
            Map<SegmentKey, MeanSample> samples = new LinkedHashMap<>();
            for (Map.Entry<SegmentKey, SummaryStatistic> entry : statistics.entrySet()) {
                if (!entry.getKey().isTotal() && entry.getValue() != null) {
                    samples.put(entry.getKey(), entry.getValue().getSample());
                }
            }
            context.getSignificanceTester().addRow(table, total.getName(),
                    context.getSignificanceTester().testMeans(samples));
        }
    }
}
