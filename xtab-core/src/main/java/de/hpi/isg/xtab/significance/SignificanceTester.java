package de.hpi.isg.xtab.significance;

import de.hpi.isg.xtab.banner.BannerColumn;
import de.hpi.isg.xtab.banner.BannerGroup;
import de.hpi.isg.xtab.banner.BannerStructure;
import de.hpi.isg.xtab.config.AnalysisConfiguration;
import de.hpi.isg.xtab.diagnostics.Diagnostic;
import de.hpi.isg.xtab.diagnostics.Diagnostics;
import de.hpi.isg.xtab.model.QuestionRow;
import de.hpi.isg.xtab.model.RowKind;
import de.hpi.isg.xtab.model.SegmentKey;
import de.hpi.isg.xtab.model.QuestionTable;
import org.apache.commons.math3.util.CombinatoricsUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs pairwise tests between the columns of each {@link BannerGroup} and renders the results as letters: a column
 * receives the letter of every column of its group that it is significantly higher than. The total column is never
 * tested and marked with {@link BannerStructure#TOTAL_LETTER}.
 */
public class SignificanceTester {

    private final Logger logger = LoggerFactory.getLogger(this.getClass());

    private final BannerStructure structure;

    private final double alpha;

    private final boolean isBonferroniCorrection;

    private final ProportionZTest proportionTest;

    private final WeightedTTest meanTest;

    private final Diagnostics diagnostics;

    /**
     * Number of comparisons that have been skipped so far.
     */
    private int numSkippedComparisons = 0;

    public SignificanceTester(BannerStructure structure, AnalysisConfiguration configuration, boolean isWeighted,
                              Diagnostics diagnostics) {
        this.structure = structure;
        this.alpha = configuration.alpha;
        this.isBonferroniCorrection = configuration.bonferroniCorrection;
        this.proportionTest = new ProportionZTest(isWeighted, configuration.significanceMinBase);
        this.meanTest = new WeightedTTest(configuration.significanceMinBase);
        this.diagnostics = diagnostics;
    }

    /**
     * Tests proportions (e.g., of a response option or a top box).
     *
     * @param samples the test data of the segments; the total column and segments without data are ignored
     * @return the letters per {@link SegmentKey}
     */
    public Map<SegmentKey, String> testProportions(Map<SegmentKey, ProportionSample> samples) {
        return this.test(samples, this.proportionTest);
    }

    /**
     * Tests means (e.g., of ratings or composite scores).
     *
     * @param samples the test data of the segments; the total column and segments without data are ignored
     * @return the letters per {@link SegmentKey}
     */
    public Map<SegmentKey, String> testMeans(Map<SegmentKey, MeanSample> samples) {
        return this.test(samples, this.meanTest);
    }

    /**
     * Tests mean ranks, for which lower values are better: a column receives the letters of the columns whose mean
     * rank is significantly higher, i.e., worse.
     *
     * @param samples the ranks of the segments; the total column and segments without data are ignored
     * @return the letters per {@link SegmentKey}
     */
    public Map<SegmentKey, String> testMeanRanks(Map<SegmentKey, MeanSample> samples) {
        return this.test(samples, (first, second, alpha) -> {
            TestResult result = this.meanTest.test(first, second, alpha);
            if (result.isSkipped()) return result;
            return TestResult.of(result.getPValue(), !result.isFirstHigher(), alpha);
        });
    }

    /**
     * Runs a {@link PairwiseTest} within each {@link BannerGroup}.
     *
     * @return the letters for all keys of the {@link BannerStructure}
     */
    public <T> Map<SegmentKey, String> test(Map<SegmentKey, T> samples, PairwiseTest<T> test) {
        Map<SegmentKey, String> letters = new LinkedHashMap<>();
        for (SegmentKey key : this.structure.getKeys()) {
            letters.put(key, key.isTotal() ? BannerStructure.TOTAL_LETTER : "");
        }

        for (BannerGroup group : this.structure.getGroups()) {
            List<BannerColumn> columns = new ArrayList<>();
            for (BannerColumn column : group.getColumns()) {
                if (samples.get(column.getKey()) != null) columns.add(column);
            }
            int k = columns.size();
            if (k < 2) continue;

            double groupAlpha = this.alpha;
            if (this.isBonferroniCorrection) {
                groupAlpha /= CombinatoricsUtils.binomialCoefficientDouble(k, 2);
            }

            for (BannerColumn column : columns) {
                StringBuilder higherThan = new StringBuilder();
                for (BannerColumn other : columns) {
                    if (other == column) continue;
                    TestResult result = test.test(samples.get(column.getKey()), samples.get(other.getKey()), groupAlpha);
                    if (result.isSkipped()) {
                        this.numSkippedComparisons++;
                        this.logger.debug("Skipped {} vs. {}: {}", column.getKey(), other.getKey(), result.getReason());
                    } else if (result.isSignificant() && result.isFirstHigher()) {
                        higherThan.append(other.getLetter());
                    }
                }
                letters.put(column.getKey(), higherThan.toString());
            }
        }
        return letters;
    }

    /**
     * Appends a significance row with the given letters to a table.
     */
    public QuestionRow addRow(QuestionTable.Builder table, String label, Map<SegmentKey, String> letters) {
        QuestionRow row = table.addRow(label, RowKind.SIGNIFICANCE);
        for (Map.Entry<SegmentKey, String> entry : letters.entrySet()) {
            row.setText(entry.getKey(), entry.getValue());
        }
        return row;
    }

    /**
     * Reports the comparisons skipped since the last call (if any) as a {@link Diagnostic} and resets the counter.
     *
     * @return the number of skipped comparisons
     */
    public int reportSkippedComparisons() {
        int numSkipped = this.numSkippedComparisons;
        if (numSkipped > 0) {
            this.diagnostics.warn(Diagnostic.Category.SIGNIFICANCE,
                    "%d pairwise significance comparison(s) were skipped (base below minimum or untestable data).",
                    numSkipped);
        }
        this.numSkippedComparisons = 0;
        return numSkipped;
    }

    public double getAlpha() {
        return this.alpha;
    }
}
