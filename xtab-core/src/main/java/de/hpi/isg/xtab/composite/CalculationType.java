package de.hpi.isg.xtab.composite;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;

/**
 * How the source values of a respondent are combined into a composite value.
 */
public enum CalculationType {

    MEAN("Mean"),
    SUM("Sum"),
    WEIGHTED_MEAN("WeightedMean");

    private final String label;

    CalculationType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return this.label;
    }

    public static CalculationType parse(String label) {
        for (CalculationType type : values()) {
            if (type.label.equals(label == null ? null : label.trim())) return type;
        }
        throw new CrosstabException(
                ErrorCode.INVALID_CALCULATION_TYPE, "Invalid Calculation Type",
                String.format("Unknown calculation type '%s'. Must be one of Mean, Sum, WeightedMean.", label),
                "The calculation type determines how source questions are combined.",
                "Set the calculation type to Mean, Sum or WeightedMean"
        );
    }

    @Override
    public String toString() {
        return this.label;
    }
}
