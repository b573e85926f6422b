package de.hpi.isg.xtab.composite;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import de.hpi.isg.xtab.model.ColumnVector;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.RespondentTable;
import de.hpi.isg.xtab.model.ResponseOption;
import de.hpi.isg.xtab.model.Values;
import it.unimi.dsi.fastutil.doubles.DoubleList;

import java.util.List;
import java.util.Map;

/**
 * Calculates the per-respondent values of a {@link CompositeDefinition}. Missing source values are skipped; a
 * respondent without any source value has no composite value.
 */
public class CompositeCalculator {

    /**
     * Calculates the composite value of every respondent.
     *
     * @param composite a validated composite
     * @param questions the declared questions by their codes
     * @param table     the respondents
     * @return the composite values aligned with the {@code table}; {@link Double#NaN} marks missing values
     * @throws CrosstabException if no respondent has a composite value
     */
    public double[] calculate(CompositeDefinition composite, Map<String, QuestionDefinition> questions,
                              RespondentTable table) {
        List<String> sources = composite.getSourceQuestions();
        double[][] sourceValues = new double[sources.size()][];
        for (int i = 0; i < sources.size(); i++) {
            sourceValues[i] = sourceValues(questions.get(sources.get(i)), table.getColumn(sources.get(i)));
        }

        double[] values = new double[table.getNumRows()];
        double[] respondentValues = new double[sources.size()];
        boolean isAnyDefined = false;
        for (int row = 0; row < values.length; row++) {
            for (int i = 0; i < sources.size(); i++) {
                respondentValues[i] = sourceValues[i][row];
            }
            values[row] = combine(respondentValues, composite.getCalculationType(), composite.getWeights());
            isAnyDefined |= !Double.isNaN(values[row]);
        }

        if (!isAnyDefined && values.length > 0) {
            throw new CrosstabException(
                    ErrorCode.COMPOSITE_ALL_MISSING, "Composite Without Values",
                    String.format("Composite '%s': all source values are missing for every respondent.", composite.getCode()),
                    "A composite without any values cannot be tabulated.",
                    "Check that the source questions contain numeric responses"
            );
        }
        return values;
    }

    /**
     * Combines the source values of a single respondent.
     *
     * @param sourceValues the source values; {@link Double#NaN} marks missing values
     * @param type         the {@link CalculationType}
     * @param weights      the per-source weights for {@link CalculationType#WEIGHTED_MEAN}
     * @return the composite value or {@link Double#NaN} if all source values are missing
     */
    public static double combine(double[] sourceValues, CalculationType type, DoubleList weights) {
        double sum = 0d, weightSum = 0d;
        int numValid = 0;
        for (int i = 0; i < sourceValues.length; i++) {
            double value = sourceValues[i];
            if (Double.isNaN(value)) continue;
            numValid++;
            switch (type) {
                case MEAN:
                case SUM:
                    sum += value;
                    break;
                case WEIGHTED_MEAN:
                    double weight = weights.getDouble(i);
                    sum += value * weight;
                    weightSum += weight;
                    break;
                default:
                    throw new IllegalStateException("Unknown calculation type: " + type);
            }
        }
        if (numValid == 0) return Double.NaN;
        switch (type) {
            case MEAN:
                return sum / numValid;
            case SUM:
                return sum;
            case WEIGHTED_MEAN:
                return sum / weightSum;
            default:
                throw new IllegalStateException("Unknown calculation type: " + type);
        }
    }

    /**
     * Reads the numeric values of a source question. Texts matching an option are mapped to its numeric value,
     * options excluded from the index become missing.
     */
    private static double[] sourceValues(QuestionDefinition question, ColumnVector column) {
        double[] values = new double[column.size()];
        for (int row = 0; row < values.length; row++) {
            String text = column.getText(row);
            double value = Double.NaN;
            if (!Values.isBlank(text)) {
                ResponseOption option = findOption(question, text);
                if (option == null) {
                    value = column.getNumber(row);
                } else if (!option.isExcludeFromIndex()) {
                    value = option.getNumericValue();
                }
            }
            values[row] = value;
        }
        return values;
    }

    private static ResponseOption findOption(QuestionDefinition question, String text) {
        if (question == null) return null;
        for (ResponseOption option : question.getOptions()) {
            if (Values.matches(text, option.getOptionText())) return option;
        }
        return null;
    }
}
