package de.hpi.isg.xtab.model;

import java.io.Serializable;

/**
 * A declared answer option of a question. Responses are matched against the {@link #getOptionText() option text},
 * whereas outputs are labelled with the {@link #getDisplayText() display text}.
 */
public class ResponseOption implements Serializable {

    private final String optionText;

    private String displayText;

    /**
     * Explicit numeric value of the option or {@link Double#NaN}.
     */
    private double optionValue = Double.NaN;

    /**
     * Weight of the option in a Likert index or {@link Double#NaN}.
     */
    private double indexWeight = Double.NaN;

    private boolean excludeFromIndex = false;

    private String boxCategory;

    private boolean showInOutput = true;

    private int displayOrder = Integer.MAX_VALUE;

    /**
     * Bounds (inclusive) of a bin of a numeric question or {@link Double#NaN}.
     */
    private double binMin = Double.NaN, binMax = Double.NaN;

    public ResponseOption(String optionText) {
        this.optionText = optionText;
    }

    public String getOptionText() {
        return this.optionText;
    }

    /**
     * @return the display text or, if not set, the option text
     */
    public String getDisplayText() {
        return this.displayText == null || this.displayText.trim().isEmpty() ? this.optionText : this.displayText;
    }

    public ResponseOption setDisplayText(String displayText) {
        this.displayText = displayText;
        return this;
    }

    public double getOptionValue() {
        return this.optionValue;
    }

    public ResponseOption setOptionValue(double optionValue) {
        this.optionValue = optionValue;
        return this;
    }

    /**
     * The numeric value of this option: the explicit option value if present, otherwise the parsed option text.
     *
     * @return the value or {@link Double#NaN} if there is none
     */
    public double getNumericValue() {
        return Double.isNaN(this.optionValue) ? Values.parseNumber(this.optionText) : this.optionValue;
    }

    public double getIndexWeight() {
        return this.indexWeight;
    }

    public ResponseOption setIndexWeight(double indexWeight) {
        this.indexWeight = indexWeight;
        return this;
    }

    public boolean isExcludeFromIndex() {
        return this.excludeFromIndex;
    }

    public ResponseOption setExcludeFromIndex(boolean excludeFromIndex) {
        this.excludeFromIndex = excludeFromIndex;
        return this;
    }

    public String getBoxCategory() {
        return this.boxCategory;
    }

    public boolean hasBoxCategory() {
        return !Values.isBlank(this.boxCategory);
    }

    public ResponseOption setBoxCategory(String boxCategory) {
        this.boxCategory = boxCategory;
        return this;
    }

    public boolean isShowInOutput() {
        return this.showInOutput;
    }

    public ResponseOption setShowInOutput(boolean showInOutput) {
        this.showInOutput = showInOutput;
        return this;
    }

    public int getDisplayOrder() {
        return this.displayOrder;
    }

    public ResponseOption setDisplayOrder(int displayOrder) {
        this.displayOrder = displayOrder;
        return this;
    }

    public double getBinMin() {
        return this.binMin;
    }

    public double getBinMax() {
        return this.binMax;
    }

    /**
     * Whether this option is a bin of a numeric question.
     */
    public boolean isBin() {
        return !Double.isNaN(this.binMin) || !Double.isNaN(this.binMax);
    }

    public ResponseOption setBinRange(double binMin, double binMax) {
        this.binMin = binMin;
        this.binMax = binMax;
        return this;
    }

    /**
     * Whether a number falls into the bin of this option. Missing bounds are open.
     */
    public boolean containsNumber(double number) {
        if (Double.isNaN(number) || !this.isBin()) return false;
        return (Double.isNaN(this.binMin) || number >= this.binMin) && (Double.isNaN(this.binMax) || number <= this.binMax);
    }

    @Override
    public String toString() {
        return "ResponseOption[" + this.optionText + ']';
    }
}
