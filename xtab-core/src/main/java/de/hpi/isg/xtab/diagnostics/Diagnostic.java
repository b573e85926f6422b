package de.hpi.isg.xtab.diagnostics;

import java.io.Serializable;
import java.util.Objects;

/**
 * A structured, non-fatal finding, e.g., a weight repair action or a skipped significance test.
 */
public class Diagnostic implements Serializable {

    public enum Severity {
        INFO, WARNING, ERROR
    }

    /**
     * What part of the processing a {@link Diagnostic} stems from.
     */
    public enum Category {
        WEIGHTING, BANNER, SIGNIFICANCE, CHI_SQUARE, RANKING, COMPOSITE, FILTER, QUESTION
    }

    private final Severity severity;

    private final Category category;

    /**
     * The question the finding relates to or {@code null} if it applies to the whole run.
     */
    private final String questionCode;

    private final String message;

    public Diagnostic(Severity severity, Category category, String questionCode, String message) {
        this.severity = severity;
        this.category = category;
        this.questionCode = questionCode;
        this.message = message;
    }

    public Severity getSeverity() {
        return this.severity;
    }

    public Category getCategory() {
        return this.category;
    }

    public String getQuestionCode() {
        return this.questionCode;
    }

    public String getMessage() {
        return this.message;
    }

    @Override
    public String toString() {
        return String.format("%s/%s%s: %s",
                this.severity, this.category,
                this.questionCode == null ? "" : " [" + this.questionCode + "]",
                this.message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return severity == that.severity &&
                category == that.category &&
                Objects.equals(questionCode, that.questionCode) &&
                Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, category, questionCode, message);
    }
}
