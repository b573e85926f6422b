package de.hpi.isg.xtab.ranking;

import de.hpi.isg.xtab.config.AnalysisConfiguration;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleOpenHashSet;
import it.unimi.dsi.fastutil.doubles.DoubleSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Checks the data quality of a {@link RankingMatrix}: out-of-range and non-integer ranks, completeness, ties and
 * gaps. Each check has its own threshold.
 */
public class RankingValidator {

    private final double tieThresholdPct, gapThresholdPct, completenessThresholdPct;

    public RankingValidator(double tieThresholdPct, double gapThresholdPct, double completenessThresholdPct) {
        this.tieThresholdPct = tieThresholdPct;
        this.gapThresholdPct = gapThresholdPct;
        this.completenessThresholdPct = completenessThresholdPct;
    }

    public RankingValidator(AnalysisConfiguration configuration) {
        this(configuration.rankingTieThresholdPct, configuration.rankingGapThresholdPct,
                configuration.rankingCompletenessThresholdPct);
    }

    public RankingValidation validate(RankingMatrix matrix) {
        int numPositions = matrix.getNumPositions();
        int numValues = 0, numOutOfRange = 0, numNonInteger = 0, numMissing = 0;
        int numRowsWithTies = 0, numRowsWithGaps = 0;

        for (int row = 0; row < matrix.getNumRows(); row++) {
            DoubleArrayList rowRanks = new DoubleArrayList();
            for (int item = 0; item < matrix.getNumItems(); item++) {
                double rank = matrix.getRank(row, item);
                if (Double.isNaN(rank)) {
                    numMissing++;
                    continue;
                }
                numValues++;
                rowRanks.add(rank);
                if (rank < 1 || rank > numPositions) numOutOfRange++;
                if (rank != Math.floor(rank)) numNonInteger++;
            }
            if (hasTie(rowRanks)) numRowsWithTies++;
            if (hasGap(rowRanks)) numRowsWithGaps++;
        }

        int numCells = matrix.getNumRows() * matrix.getNumItems();
        double outOfRangePct = numValues == 0 ? 0d : 100d * numOutOfRange / numValues;
        double completePct = numCells == 0 ? 0d : 100d * (1 - (double) numMissing / numCells);
        double tiesPct = matrix.getNumRows() == 0 ? 0d : 100d * numRowsWithTies / matrix.getNumRows();
        double gapsPct = matrix.getNumRows() == 0 ? 0d : 100d * numRowsWithGaps / matrix.getNumRows();

        List<String> issues = new ArrayList<>();
        if (numOutOfRange > 0) {
            issues.add(String.format(Locale.ROOT, "%d values (%.1f%%) out of valid range [1, %d]",
                    numOutOfRange, outOfRangePct, numPositions));
        }
        if (numNonInteger > 0) {
            issues.add(String.format("%d non-integer rank values", numNonInteger));
        }
        if (tiesPct > this.tieThresholdPct) {
            issues.add(String.format(Locale.ROOT, "%.1f%% of respondents have tied ranks (threshold: %.0f%%)",
                    tiesPct, this.tieThresholdPct));
        }
        if (gapsPct > this.gapThresholdPct) {
            issues.add(String.format(Locale.ROOT, "%.1f%% of respondents have gaps in rankings (threshold: %.0f%%)",
                    gapsPct, this.gapThresholdPct));
        }
        if (completePct < this.completenessThresholdPct) {
            issues.add(String.format(Locale.ROOT, "Only %.1f%% complete (threshold: %.0f%%)",
                    completePct, this.completenessThresholdPct));
        }
        return new RankingValidation(numOutOfRange, outOfRangePct, numNonInteger, completePct, tiesPct, gapsPct, issues);
    }

    private static boolean hasTie(DoubleArrayList ranks) {
        DoubleSet seen = new DoubleOpenHashSet(ranks.size());
        for (int i = 0; i < ranks.size(); i++) {
            if (!seen.add(ranks.getDouble(i))) return true;
        }
        return false;
    }

    /**
     * A row has a gap if its sorted ranks are not exactly {@code 1, 2, ..., k}.
     */
    private static boolean hasGap(DoubleArrayList ranks) {
        if (ranks.size() < 2) return false;
        double[] sorted = ranks.toDoubleArray();
        Arrays.sort(sorted);
        for (int i = 0; i < sorted.length; i++) {
            if (sorted[i] != i + 1) return true;
        }
        return false;
    }
}
