package de.hpi.isg.xtab.ranking;

import de.hpi.isg.xtab.banner.RowIndexMap;
import de.hpi.isg.xtab.cells.BaseCalculator;
import de.hpi.isg.xtab.cells.CellCalculator;
import de.hpi.isg.xtab.config.AnalysisConfiguration;
import de.hpi.isg.xtab.diagnostics.Diagnostic;
import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import de.hpi.isg.xtab.model.BaseSize;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.QuestionRow;
import de.hpi.isg.xtab.model.QuestionTable;
import de.hpi.isg.xtab.model.RowKind;
import de.hpi.isg.xtab.model.SegmentKey;
import de.hpi.isg.xtab.significance.MeanSample;
import de.hpi.isg.xtab.significance.ProportionSample;
import de.hpi.isg.xtab.significance.SignificanceTester;
import de.hpi.isg.xtab.tables.QuestionProcessor;
import de.hpi.isg.xtab.tables.TableContext;
import de.hpi.isg.xtab.weighting.WeightSequence;
import it.unimi.dsi.fastutil.ints.IntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tabulates ranking questions: Extract, normalize, validate, then aggregate and test. Per item, the table holds
 * the % ranked first, the mean rank (lower = better) and the % in the top N, each followed by its significance row.
 */
public class RankingQuestionProcessor implements QuestionProcessor {

    private final Logger logger = LoggerFactory.getLogger(this.getClass());

    private final RankingExtractor extractor = new RankingExtractor();

    private final BaseCalculator baseCalculator = new BaseCalculator();

    @Override
    public QuestionTable process(QuestionDefinition question, TableContext context) {
        RankingResult result = this.analyze(question, context);
        for (RankingContext.PartialFailure failure : result.getContext().getPartialFailures()) {
            context.getDiagnostics().error(Diagnostic.Category.RANKING, "Ranking section failed: %s", failure);
        }
        return result.getTable();
    }

    /**
     * Tabulates a ranking question and returns the table along with the sections that failed.
     *
     * @throws CrosstabException if the ranking data cannot be extracted or violates the quality thresholds under
     *                           strict validation
     */
    public RankingResult analyze(QuestionDefinition question, TableContext context) {
        AnalysisConfiguration configuration = context.getConfiguration();
        RankingContext rankingContext = new RankingContext(question.getCode());

        RankingMatrix matrix = this.extractor.extract(question, context.getTable(), context.getDiagnostics());
        RankingValidation validation = new RankingValidator(configuration).validate(matrix);
        rankingContext.setValidation(validation);
        if (validation.hasIssues()) {
            if (configuration.rankingStrictValidation) {
                throw new CrosstabException(
                        ErrorCode.RANKING_QUALITY_THRESHOLD, "Ranking Data Quality Below Threshold",
                        String.format("Question %s: %s", question.getCode(), validation.getSummary()),
                        "Strict ranking validation is enabled, so metrics on low-quality rankings are not reported.",
                        "Review the ranking data for ties, gaps and out-of-range values",
                        "Relax the ranking thresholds or disable strict ranking validation"
                );
            }
            context.getDiagnostics().warn(Diagnostic.Category.RANKING, "Question %s: %s",
                    question.getCode(), validation.getSummary());
        }

        int topN = configuration.rankingTopN;
        if (topN > matrix.getNumPositions()) {
            context.getDiagnostics().warn(Diagnostic.Category.RANKING,
                    "top_n (%d) exceeds available positions (%d), clamping to %d",
                    topN, matrix.getNumPositions(), matrix.getNumPositions());
            topN = matrix.getNumPositions();
        }
        rankingContext.setTopN(topN);

        RowIndexMap rowIndices = context.getRowIndices();
        boolean[] hasRanked = new boolean[matrix.getNumRows()];
        for (int row = 0; row < hasRanked.length; row++) {
            hasRanked[row] = matrix.hasAnyRank(row);
        }
        Map<SegmentKey, BaseSize> bases = new LinkedHashMap<>();
        for (SegmentKey key : rowIndices.getKeys()) {
            bases.put(key, this.baseCalculator.base(rowIndices.get(key), hasRanked, context.getWeights()));
        }
        QuestionTable.Builder table = QuestionTable.builder(question.getCode(), question.getText(), rowIndices.getKeys())
                .setBaseFilter(question.getBaseFilter())
                .setBases(bases);

        for (int item = 0; item < matrix.getNumItems(); item++) {
            String itemLabel = matrix.getItems().get(item);
            String stage = "percent_ranked_first";
            try {
                this.addShareRows(table, itemLabel + " - % Ranked 1st", matrix, item, 1, context);
                stage = "mean_rank";
                this.addMeanRankRows(table, itemLabel, matrix, item, context);
                if (configuration.rankingShowTopN) {
                    stage = "percent_top_n";
                    this.addShareRows(table, String.format("%s - %% Top %d", itemLabel, topN), matrix, item, topN, context);
                }
            } catch (CrosstabException e) {
                this.logger.debug("Ranking section {} of {} failed.", itemLabel, question.getCode(), e);
                rankingContext.recordPartialFailure(itemLabel, stage, e.getMessage());
            }
        }

        if (context.isSignificanceTesting()) {
            context.getSignificanceTester().reportSkippedComparisons();
        }
        return new RankingResult(table.build(), rankingContext);
    }

    private void addShareRows(QuestionTable.Builder table, String label, RankingMatrix matrix, int item, int maxRank,
                              TableContext context) {
        WeightSequence weights = context.getWeights();
        Map<SegmentKey, ProportionSample> shares = new LinkedHashMap<>();
        QuestionRow row = table.addRow(label, RowKind.COLUMN_PERCENT);
        for (SegmentKey key : table.getKeys()) {
            IntList rows = context.getRowIndices().get(key);
            ProportionSample share = maxRank == 1 ?
                    RankingMetrics.rankedFirst(matrix, item, rows, weights) :
                    RankingMetrics.rankedTopN(matrix, item, maxRank, rows, weights);
            row.setValue(key, CellCalculator.percentage(share.getCount(), share.getBase()));
            if (!key.isTotal()) shares.put(key, share);
        }
        if (context.isSignificanceTesting()) {
            SignificanceTester tester = context.getSignificanceTester();
            tester.addRow(table, label, tester.testProportions(shares));
        }
    }

    private void addMeanRankRows(QuestionTable.Builder table, String itemLabel, RankingMatrix matrix, int item,
                                 TableContext context) {
        String label = itemLabel + " - Mean Rank (Lower = Better)";
        Map<SegmentKey, MeanSample> samples = new LinkedHashMap<>();
        QuestionRow meanRow = table.addRow(label, RowKind.AVERAGE);
        for (SegmentKey key : table.getKeys()) {
            IntList rows = context.getRowIndices().get(key);
            meanRow.setValue(key, RankingMetrics.meanRank(matrix, item, rows, context.getWeights()));
            if (!key.isTotal()) samples.put(key, RankingMetrics.ranks(matrix, item, rows, context.getWeights()));
        }
        if (context.isSignificanceTesting()) {
            SignificanceTester tester = context.getSignificanceTester();
            tester.addRow(table, label, tester.testMeanRanks(samples));
        }

        if (context.getConfiguration().showStandardDeviation) {
            QuestionRow varianceRow = table.addRow(itemLabel + " - Rank Variance", RowKind.VARIANCE);
            for (SegmentKey key : table.getKeys()) {
                varianceRow.setValue(key, RankingMetrics.rankVariance(
                        matrix, item, context.getRowIndices().get(key), context.getWeights()
                ));
            }
        }
    }
}
