package de.hpi.isg.xtab.ranking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accompanies the analysis of a single ranking question: its data quality and the sections that could not be
 * calculated. Sections failing do not fail the whole question.
 */
public class RankingContext {

    /**
     * Describes a section of a ranking table that could not be calculated.
     */
    public static class PartialFailure {

        private final String section, stage, error;

        public PartialFailure(String section, String stage, String error) {
            this.section = section;
            this.stage = stage;
            this.error = error;
        }

        public String getSection() {
            return this.section;
        }

        public String getStage() {
            return this.stage;
        }

        public String getError() {
            return this.error;
        }

        @Override
        public String toString() {
            return String.format("%s (%s): %s", this.section, this.stage, this.error);
        }
    }

    private final String questionCode;

    private final List<PartialFailure> partialFailures = new ArrayList<>();

    private RankingValidation validation;

    /**
     * The number of top positions actually aggregated, i.e., after clamping to the number of positions.
     */
    private int topN = -1;

    public RankingContext(String questionCode) {
        this.questionCode = questionCode;
    }

    public String getQuestionCode() {
        return this.questionCode;
    }

    public void recordPartialFailure(String section, String stage, String error) {
        this.partialFailures.add(new PartialFailure(section, stage, error));
    }

    public List<PartialFailure> getPartialFailures() {
        return Collections.unmodifiableList(this.partialFailures);
    }

    public boolean hasPartialFailures() {
        return !this.partialFailures.isEmpty();
    }

    public RankingValidation getValidation() {
        return this.validation;
    }

    void setValidation(RankingValidation validation) {
        this.validation = validation;
    }

    public int getTopN() {
        return this.topN;
    }

    void setTopN(int topN) {
        this.topN = topN;
    }
}
