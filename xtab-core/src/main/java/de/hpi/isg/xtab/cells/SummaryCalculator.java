package de.hpi.isg.xtab.cells;

import de.hpi.isg.xtab.model.ColumnVector;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.ResponseOption;
import de.hpi.isg.xtab.model.RowKind;
import de.hpi.isg.xtab.model.Values;
import de.hpi.isg.xtab.weighting.WeightSequence;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Calculates the summary statistic of Rating (mean), Likert (index) and NPS (score) questions.
 */
public class SummaryCalculator {

    /**
     * Responses that are not part of the NPS base.
     */
    private static final Set<String> NPS_NON_RESPONSES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "DK", "Don't know", "Not applicable", "NA"
    )));

    private static final double NPS_MIN_SCORE = 0, NPS_MAX_SCORE = 10;

    /**
     * Calculates the summary statistic of a question over some respondents.
     *
     * @param question the question
     * @param column   the response column
     * @param rows     the respondents
     * @param weights  the weights aligned with the {@code column}
     * @return the {@link SummaryStatistic} or {@code null} if it is undefined (e.g., no valid responses) or the
     * question type has no summary statistic
     */
    public SummaryStatistic calculate(QuestionDefinition question, ColumnVector column, IntList rows,
                                      WeightSequence weights) {
        switch (question.getType()) {
            case RATING:
                return this.ratingMean(question, column, rows, weights);
            case LIKERT:
                return this.likertIndex(question, column, rows, weights);
            case NPS:
                return this.npsScore(column, rows, weights);
            default:
                return null;
        }
    }

    /**
     * Weighted mean of the numeric values of the options that are not excluded from the index.
     */
    public SummaryStatistic ratingMean(QuestionDefinition question, ColumnVector column, IntList rows,
                                       WeightSequence weights) {
        DoubleArrayList values = new DoubleArrayList(), valueWeights = new DoubleArrayList();
        double weightedSum = 0d, totalWeight = 0d;
        for (int i = 0; i < rows.size(); i++) {
            int row = rows.getInt(i);
            String response = column.getText(row);
            if (Values.isBlank(response)) continue;
            for (ResponseOption option : question.getOptions()) {
                if (option.isExcludeFromIndex() || !Values.matches(response, option.getOptionText())) continue;
                double value = option.getNumericValue();
                if (!Double.isNaN(value)) {
                    double weight = weights.get(row);
                    values.add(value);
                    valueWeights.add(weight);
                    weightedSum += value * weight;
                    totalWeight += weight;
                }
                break;
            }
        }
        if (values.isEmpty() || totalWeight <= 0) return null;
        return new SummaryStatistic("Mean", RowKind.AVERAGE, weightedSum / totalWeight, values, valueWeights);
    }

    /**
     * Weighted mean of the index weights of the options that carry one.
     */
    public SummaryStatistic likertIndex(QuestionDefinition question, ColumnVector column, IntList rows,
                                        WeightSequence weights) {
        DoubleArrayList values = new DoubleArrayList(), valueWeights = new DoubleArrayList();
        double weightedSum = 0d, totalWeight = 0d;
        for (int i = 0; i < rows.size(); i++) {
            int row = rows.getInt(i);
            String response = column.getText(row);
            for (ResponseOption option : question.getOptions()) {
                if (Double.isNaN(option.getIndexWeight()) || !Values.matches(response, option.getOptionText())) continue;
                double weight = weights.get(row);
                values.add(option.getIndexWeight());
                valueWeights.add(weight);
                weightedSum += option.getIndexWeight() * weight;
                totalWeight += weight;
                break;
            }
        }
        if (totalWeight <= 0) return null;
        return new SummaryStatistic("Index", RowKind.INDEX, weightedSum / totalWeight, values, valueWeights);
    }

    /**
     * Net promoter score: weighted share of promoters (9-10) minus the share of detractors (0-6), in percent.
     * Numeric responses outside of {@code [0, 10]} are not counted; see {@link #countInvalidNpsScores}.
     */
    public SummaryStatistic npsScore(ColumnVector column, IntList rows, WeightSequence weights) {
        DoubleArrayList values = new DoubleArrayList(), valueWeights = new DoubleArrayList();
        double promoters = 0d, detractors = 0d, totalWeight = 0d;
        for (int i = 0; i < rows.size(); i++) {
            int row = rows.getInt(i);
            String response = column.getText(row);
            if (Values.isBlank(response) || NPS_NON_RESPONSES.contains(response.trim())) continue;
            double score = Values.parseNumber(response);
            if (!isValidNpsScore(score)) continue;
            double weight = weights.get(row);
            values.add(score);
            valueWeights.add(weight);
            totalWeight += weight;
            if (score >= 9) promoters += weight;
            else if (score <= 6) detractors += weight;
        }
        if (values.isEmpty() || totalWeight <= 0) return null;
        double score = (promoters - detractors) / totalWeight * 100;
        return new SummaryStatistic("NPS Score", RowKind.SCORE, score, values, valueWeights);
    }

    /**
     * Counts the numeric responses that are no valid NPS score, i.e., are infinite or lie outside of {@code [0, 10]}.
     */
    public int countInvalidNpsScores(ColumnVector column, IntList rows) {
        int numInvalid = 0;
        for (int i = 0; i < rows.size(); i++) {
            String response = column.getText(rows.getInt(i));
            if (Values.isBlank(response) || NPS_NON_RESPONSES.contains(response.trim())) continue;
            double score = Values.parseNumber(response);
            if (!Double.isNaN(score) && !isValidNpsScore(score)) numInvalid++;
        }
        return numInvalid;
    }

    private static boolean isValidNpsScore(double score) {
        return score >= NPS_MIN_SCORE && score <= NPS_MAX_SCORE;
    }
}
