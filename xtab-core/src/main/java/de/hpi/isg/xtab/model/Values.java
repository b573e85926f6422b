package de.hpi.isg.xtab.model;

/**
 * Defines once how cell values are compared and converted. A missing value is represented as {@code null} (texts)
 * or {@link Double#NaN} (numbers); it never equals anything, not even the text {@code "NA"}.
 */
public class Values {

    private Values() {
    }

    /**
     * Whether a text value is missing.
     */
    public static boolean isMissing(String value) {
        return value == null;
    }

    /**
     * Whether a text value is missing or consists only of whitespace.
     */
    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    /**
     * Tests whether a response equals an option text. Both sides are trimmed and compared case-sensitively.
     */
    public static boolean matches(String value, String optionText) {
        if (value == null || optionText == null) return false;
        return value.trim().equals(optionText.trim());
    }

    /**
     * Parses a number from the given text.
     *
     * @return the number or {@link Double#NaN} if the text is missing or not numeric
     */
    public static double parseNumber(String value) {
        if (value == null) return Double.NaN;
        String trimmed = value.trim();
        if (trimmed.isEmpty()) return Double.NaN;
        switch (trimmed) {
            case "Inf":
            case "Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Inf":
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    /**
     * Renders a number the way it is matched against option texts, i.e., integral values without decimals.
     *
     * @return the text or {@code null} for {@link Double#NaN}
     */
    public static String format(double number) {
        if (Double.isNaN(number)) return null;
        if (Double.isInfinite(number)) return number > 0 ? "Inf" : "-Inf";
        if (number == Math.rint(number) && Math.abs(number) < 1e15) {
            return Long.toString((long) number);
        }
        return Double.toString(number);
    }

    /**
     * Whether a number is present, i.e., not {@link Double#NaN}.
     */
    public static boolean isPresent(double number) {
        return !Double.isNaN(number);
    }

}
