package de.hpi.isg.xtab.composite;

import com.google.common.base.Splitter;
import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Declares a composite metric, i.e., a virtual question whose per-respondent value is derived from several source
 * questions.
 */
public class CompositeDefinition implements Serializable {

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final String code;

    private final String label;

    private final CalculationType calculationType;

    private final List<String> sourceQuestions;

    /**
     * Per-source weights for {@link CalculationType#WEIGHTED_MEAN} or an empty list.
     */
    private final DoubleList weights;

    public CompositeDefinition(String code, String label, CalculationType calculationType,
                               List<String> sourceQuestions, DoubleList weights) {
        Validate.notBlank(code, "Composite code must not be blank.");
        Validate.notNull(calculationType, "Composite %s has no calculation type.", code);
        this.code = code.trim();
        this.label = label;
        this.calculationType = calculationType;
        this.sourceQuestions = Collections.unmodifiableList(new ArrayList<>(sourceQuestions));
        this.weights = weights == null ? DoubleLists.EMPTY_LIST : DoubleLists.unmodifiable(new DoubleArrayList(weights));
    }

    /**
     * Creates an instance from its textual declaration, in which source questions and weights are comma-separated.
     *
     * @param weights the weights or {@code null}/blank if there are none
     * @throws CrosstabException if the calculation type is unknown or a weight is not numeric
     */
    public static CompositeDefinition parse(String code, String label, String calculationType,
                                            String sourceQuestions, String weights) {
        List<String> sources = sourceQuestions == null ?
                Collections.emptyList() :
                LIST_SPLITTER.splitToList(sourceQuestions);
        DoubleList parsedWeights = new DoubleArrayList();
        if (!StringUtils.isBlank(weights)) {
            for (String weight : LIST_SPLITTER.split(weights)) {
                try {
                    parsedWeights.add(Double.parseDouble(weight));
                } catch (NumberFormatException e) {
                    throw new CrosstabException(
                            ErrorCode.INVALID_COMPOSITE, "Invalid Composite Weights",
                            String.format("Composite '%s' has non-numeric weights: %s", code, weights),
                            "Weighted means need one numeric weight per source question.",
                            e,
                            "Provide comma-separated numbers, e.g., 1, 1, 2"
                    );
                }
            }
        }
        return new CompositeDefinition(code, label, CalculationType.parse(calculationType), sources, parsedWeights);
    }

    public String getCode() {
        return this.code;
    }

    /**
     * @return the label or, if there is none, the code
     */
    public String getLabel() {
        return StringUtils.isBlank(this.label) ? this.code : this.label;
    }

    public CalculationType getCalculationType() {
        return this.calculationType;
    }

    public List<String> getSourceQuestions() {
        return this.sourceQuestions;
    }

    public DoubleList getWeights() {
        return this.weights;
    }

    @Override
    public String toString() {
        return String.format("CompositeDefinition[%s = %s%s]", this.code, this.calculationType, this.sourceQuestions);
    }
}
