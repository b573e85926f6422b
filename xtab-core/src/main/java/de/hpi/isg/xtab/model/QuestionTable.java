package de.hpi.isg.xtab.model;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The tabulation of a single question (or composite) against all banner columns: the bases of the segments followed
 * by the data rows and the supplementary rows. Instances are immutable: {@link Builder#build()} takes read-only
 * copies of the rows.
 */
public class QuestionTable implements Serializable {

    private final String questionCode, questionText;

    private final String baseFilter;

    private final List<SegmentKey> keys;

    private final LinkedHashMap<SegmentKey, BaseSize> bases;

    private final ArrayList<QuestionRow> rows;

    private QuestionTable(Builder builder) {
        this.questionCode = builder.questionCode;
        this.questionText = builder.questionText;
        this.baseFilter = builder.baseFilter;
        this.keys = new ArrayList<>(builder.keys);
        this.bases = new LinkedHashMap<>(builder.bases);
        this.rows = new ArrayList<>(builder.rows.size());
        for (QuestionRow row : builder.rows) this.rows.add(row.toReadOnly());
    }

    public static Builder builder(String questionCode, String questionText, List<SegmentKey> keys) {
        return new Builder(questionCode, questionText, keys);
    }

    public String getQuestionCode() {
        return this.questionCode;
    }

    public String getQuestionText() {
        return this.questionText;
    }

    /**
     * @return the base filter expression that was applied or {@code null}
     */
    public String getBaseFilter() {
        return this.baseFilter;
    }

    public List<SegmentKey> getKeys() {
        return Collections.unmodifiableList(this.keys);
    }

    public BaseSize getBase(SegmentKey key) {
        BaseSize base = this.bases.get(key);
        return base == null ? BaseSize.EMPTY : base;
    }

    public Map<SegmentKey, BaseSize> getBases() {
        return Collections.unmodifiableMap(this.bases);
    }

    public List<QuestionRow> getRows() {
        return Collections.unmodifiableList(this.rows);
    }

    /**
     * Looks up the first row with the given label and kind.
     *
     * @return the {@link QuestionRow} or {@code null} if there is none
     */
    public QuestionRow findRow(String label, RowKind kind) {
        for (QuestionRow row : this.rows) {
            if (row.getKind() == kind && row.getLabel().equals(label)) return row;
        }
        return null;
    }

    public List<QuestionRow> getRows(RowKind kind) {
        List<QuestionRow> result = new ArrayList<>();
        for (QuestionRow row : this.rows) {
            if (row.getKind() == kind) result.add(row);
        }
        return result;
    }

    @Override
    public String toString() {
        return String.format("QuestionTable[%s, %d rows]", this.questionCode, this.rows.size());
    }

    /**
     * Assembles a {@link QuestionTable}.
     */
    public static class Builder {

        private final String questionCode, questionText;

        private final List<SegmentKey> keys;

        private final Map<SegmentKey, BaseSize> bases = new LinkedHashMap<>();

        private final List<QuestionRow> rows = new ArrayList<>();

        private String baseFilter;

        private Builder(String questionCode, String questionText, List<SegmentKey> keys) {
            this.questionCode = questionCode;
            this.questionText = questionText;
            this.keys = new ArrayList<>(keys);
        }

        public List<SegmentKey> getKeys() {
            return Collections.unmodifiableList(this.keys);
        }

        public Builder setBaseFilter(String baseFilter) {
            this.baseFilter = baseFilter;
            return this;
        }

        public Builder setBases(Map<SegmentKey, BaseSize> bases) {
            this.bases.clear();
            this.bases.putAll(bases);
            return this;
        }

        /**
         * Creates a new row keyed by the keys of this instance and appends it.
         */
        public QuestionRow addRow(String label, RowKind kind) {
            QuestionRow row = new QuestionRow(label, kind, this.keys);
            this.rows.add(row);
            return row;
        }

        public Builder addRow(QuestionRow row) {
            if (!row.getKeys().equals(this.keys)) {
                throw new CrosstabException(
                        ErrorCode.SEGMENT_KEY_MISMATCH, "Segment Key Mismatch",
                        String.format("Row \"%s\" is not keyed by the banner keys of %s.", row.getLabel(), this.questionCode),
                        "Every row must be keyed by exactly the banner keys.",
                        "This is an internal error - check how the row was assembled"
                );
            }
            this.rows.add(row);
            return this;
        }

        public int getNumRows() {
            return this.rows.size();
        }

        public QuestionTable build() {
            return new QuestionTable(this);
        }
    }
}
