package de.hpi.isg.xtab.model;

import java.util.Locale;

/**
 * The type of a survey question, which determines how its responses are tabulated.
 */
public enum VariableType {

    SINGLE_RESPONSE("Single_Response"),
    MULTI_MENTION("Multi_Mention"),
    RATING("Rating"),
    LIKERT("Likert"),
    NPS("NPS"),
    NUMERIC("Numeric"),
    RANKING("Ranking");

    private final String label;

    VariableType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return this.label;
    }

    /**
     * Whether questions of this type can be summarized in a mean/index/score row.
     */
    public boolean hasSummaryStatistic() {
        return this == RATING || this == LIKERT || this == NPS;
    }

    /**
     * Parses the label of a {@link VariableType} case-insensitively.
     *
     * @return the {@link VariableType} or {@code null} if the label is not known
     */
    public static VariableType parse(String label) {
        if (label == null) return null;
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (VariableType type : values()) {
            if (type.label.toLowerCase(Locale.ROOT).equals(normalized)) return type;
        }
        return null;
    }

    @Override
    public String toString() {
        return this.label;
    }
}
