package de.hpi.isg.xtab.weighting;

import java.util.Locale;

/**
 * Describes how invalid design weights (missing, zero, negative, infinite) are handled.
 */
public enum WeightRepairPolicy {

    /**
     * Missing and infinite weights become 0, zeros are kept, negative weights fail.
     */
    EXCLUDE,

    /**
     * All invalid weights become 1. This biases estimates and exists for legacy reasons only.
     */
    COERCE_TO_ONE,

    /**
     * Any invalid weight fails.
     */
    ERROR;

    /**
     * Parses policies like {@code exclude} or {@code coerce_to_one}.
     *
     * @return the {@link WeightRepairPolicy} or {@code null} if the text is not known
     */
    public static WeightRepairPolicy parse(String text) {
        if (text == null) return null;
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return this.name().toLowerCase(Locale.ROOT);
    }
}
