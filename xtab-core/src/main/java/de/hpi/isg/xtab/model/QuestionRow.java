package de.hpi.isg.xtab.model;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import org.apache.commons.lang3.Validate;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An output row of a {@link QuestionTable}: one value per {@link SegmentKey}. Numeric rows store
 * {@link Double#NaN} for undefined values (e.g., percentages over an empty base). Textual rows (significance letters,
 * chi-square results) store texts instead.
 * <p>Rows handed out by a built {@link QuestionTable} are read-only copies.</p>
 */
public class QuestionRow implements Serializable {

    private final String label;

    private final RowKind kind;

    private final List<SegmentKey> keys;

    private final double[] values;

    private final String[] texts;

    private final boolean isReadOnly;

    public QuestionRow(String label, RowKind kind, List<SegmentKey> keys) {
        this.label = label;
        this.kind = kind;
        this.keys = new ArrayList<>(keys);
        this.values = new double[keys.size()];
        Arrays.fill(this.values, Double.NaN);
        this.texts = new String[keys.size()];
        Arrays.fill(this.texts, "");
        this.isReadOnly = false;
    }

    private QuestionRow(QuestionRow original) {
        this.label = original.label;
        this.kind = original.kind;
        this.keys = new ArrayList<>(original.keys);
        this.values = original.values.clone();
        this.texts = original.texts.clone();
        this.isReadOnly = true;
    }

    /**
     * @return a copy of this instance that rejects modifications
     */
    QuestionRow toReadOnly() {
        return this.isReadOnly ? this : new QuestionRow(this);
    }

    public boolean isReadOnly() {
        return this.isReadOnly;
    }

    public String getLabel() {
        return this.label;
    }

    public RowKind getKind() {
        return this.kind;
    }

    public List<SegmentKey> getKeys() {
        return Collections.unmodifiableList(this.keys);
    }

    private int indexOf(SegmentKey key) {
        int index = this.keys.indexOf(key);
        if (index == -1) {
            throw new CrosstabException(
                    ErrorCode.SEGMENT_KEY_MISMATCH, "Segment Key Mismatch",
                    String.format("Row \"%s\" has no value for %s.", this.label, key),
                    "Every row must be keyed by exactly the banner keys.",
                    "This is an internal error - check how the row was assembled"
            );
        }
        return index;
    }

    private void checkWritable() {
        Validate.validState(!this.isReadOnly, "Row \"%s\" belongs to a built table and cannot be modified.", this.label);
    }

    public QuestionRow setValue(SegmentKey key, double value) {
        this.checkWritable();
        this.values[this.indexOf(key)] = value;
        return this;
    }

    /**
     * @return the value for the given key or {@link Double#NaN} if it is undefined
     */
    public double getValue(SegmentKey key) {
        return this.values[this.indexOf(key)];
    }

    public QuestionRow setText(SegmentKey key, String text) {
        this.checkWritable();
        this.texts[this.indexOf(key)] = text == null ? "" : text;
        return this;
    }

    public String getText(SegmentKey key) {
        return this.texts[this.indexOf(key)];
    }

    /**
     * Whether the value for the given key is defined.
     */
    public boolean isDefined(SegmentKey key) {
        return !Double.isNaN(this.getValue(key));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(this.label).append(" (").append(this.kind).append("):");
        for (int i = 0; i < this.keys.size(); i++) {
            sb.append(' ').append(this.keys.get(i)).append('=');
            if (this.kind.isTextual()) sb.append('"').append(this.texts[i]).append('"');
            else sb.append(Double.isNaN(this.values[i]) ? "NA" : String.format("%.2f", this.values[i]));
        }
        return sb.toString();
    }
}
