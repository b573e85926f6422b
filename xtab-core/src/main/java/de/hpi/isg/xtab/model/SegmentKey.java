package de.hpi.isg.xtab.model;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identifies a banner column (i.e., a population segment). The textual form is {@code TOTAL::Total} for the total
 * column, {@code Question::Display} for standard and multi-mention segments and {@code Question::BOXCAT::Category}
 * for box-category segments.
 */
public final class SegmentKey implements Serializable, Comparable<SegmentKey> {

    public static final String SEPARATOR = "::";

    private static final String BOX_CATEGORY_MARKER = "BOXCAT";

    public enum Kind {
        TOTAL, OPTION, BOX_CATEGORY
    }

    public static final SegmentKey TOTAL = new SegmentKey(Kind.TOTAL, "TOTAL", "Total");

    private final Kind kind;

    private final String questionCode, value;

    private SegmentKey(Kind kind, String questionCode, String value) {
        this.kind = kind;
        this.questionCode = questionCode;
        this.value = value;
    }

    /**
     * Creates the key of a segment defined by a single option.
     */
    public static SegmentKey ofOption(String questionCode, String displayText) {
        checkPart(questionCode, "question code");
        checkPart(displayText, "display text");
        if ("TOTAL".equals(questionCode)) {
            throw invalid(questionCode + SEPARATOR + displayText, "the question code TOTAL is reserved");
        }
        if (displayText.startsWith(BOX_CATEGORY_MARKER + SEPARATOR)) {
            throw invalid(questionCode + SEPARATOR + displayText,
                    "display texts starting with " + BOX_CATEGORY_MARKER + SEPARATOR + " are reserved for box categories");
        }
        return new SegmentKey(Kind.OPTION, questionCode, displayText);
    }

    /**
     * Creates the key of a segment defined by a box category.
     */
    public static SegmentKey ofBoxCategory(String questionCode, String category) {
        checkPart(questionCode, "question code");
        checkPart(category, "box category");
        return new SegmentKey(Kind.BOX_CATEGORY, questionCode, category);
    }

    /**
     * Parses the textual form of a key.
     *
     * @throws CrosstabException if the text is not a well-formed key
     */
    public static SegmentKey parse(String text) {
        if (text == null) throw invalid("null", "the key is missing");
        if (TOTAL.toString().equals(text)) return TOTAL;
        int firstSeparator = text.indexOf(SEPARATOR);
        if (firstSeparator <= 0) throw invalid(text, "no question code prefix");
        String questionCode = text.substring(0, firstSeparator);
        String rest = text.substring(firstSeparator + SEPARATOR.length());
        String boxPrefix = BOX_CATEGORY_MARKER + SEPARATOR;
        if (rest.startsWith(boxPrefix)) {
            return ofBoxCategory(questionCode, rest.substring(boxPrefix.length()));
        }
        return ofOption(questionCode, rest);
    }

    private static void checkPart(String part, String what) {
        if (part == null || part.trim().isEmpty()) {
            throw invalid(String.valueOf(part), "the " + what + " is empty");
        }
    }

    private static CrosstabException invalid(String text, String reason) {
        return new CrosstabException(
                ErrorCode.INVALID_SEGMENT_KEY, "Invalid Segment Key",
                String.format("Segment key \"%s\" is malformed: %s.", text, reason),
                "Segment keys join banner columns with their computed values.",
                "Check the banner question codes and option labels"
        );
    }

    public Kind getKind() {
        return this.kind;
    }

    public boolean isTotal() {
        return this.kind == Kind.TOTAL;
    }

    public String getQuestionCode() {
        return this.questionCode;
    }

    /**
     * @return the display text or box category of this key
     */
    public String getValue() {
        return this.value;
    }

    @Override
    public String toString() {
        return this.kind == Kind.BOX_CATEGORY ?
                this.questionCode + SEPARATOR + BOX_CATEGORY_MARKER + SEPARATOR + this.value :
                this.questionCode + SEPARATOR + this.value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SegmentKey that = (SegmentKey) o;
        return this.kind == that.kind &&
                Objects.equals(this.questionCode, that.questionCode) &&
                Objects.equals(this.value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.kind, this.questionCode, this.value);
    }

    @Override
    public int compareTo(SegmentKey that) {
        return this.toString().compareTo(that.toString());
    }
}
