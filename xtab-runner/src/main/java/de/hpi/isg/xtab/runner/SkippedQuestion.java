package de.hpi.isg.xtab.runner;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;

import java.io.Serializable;

/**
 * Records that a question (or composite) could not be tabulated in a run.
 */
public class SkippedQuestion implements Serializable {

    /**
     * The processing step in which a question failed.
     */
    public enum Stage {
        FILTER, SEGMENTATION, TABULATION, COMPOSITE
    }

    private final String questionCode;

    private final Stage stage;

    /**
     * The {@link ErrorCode} of the failure or {@code null} if it was unexpected.
     */
    private final ErrorCode errorCode;

    private final String reason;

    public SkippedQuestion(String questionCode, Stage stage, ErrorCode errorCode, String reason) {
        this.questionCode = questionCode;
        this.stage = stage;
        this.errorCode = errorCode;
        this.reason = reason;
    }

    static SkippedQuestion of(String questionCode, Stage stage, RuntimeException e) {
        if (e instanceof CrosstabException) {
            CrosstabException ce = (CrosstabException) e;
            return new SkippedQuestion(questionCode, stage, ce.getCode(), ce.getTitle() + ": " + ce.getProblem());
        }
        return new SkippedQuestion(questionCode, stage, null, "Unexpected error: " + e);
    }

    public String getQuestionCode() {
        return this.questionCode;
    }

    public Stage getStage() {
        return this.stage;
    }

    public ErrorCode getErrorCode() {
        return this.errorCode;
    }

    public String getReason() {
        return this.reason;
    }

    @Override
    public String toString() {
        return String.format("%s (%s%s): %s", this.questionCode, this.stage,
                this.errorCode == null ? "" : ", " + this.errorCode, this.reason);
    }
}
