package de.hpi.isg.xtab.runner;

import de.hpi.isg.xtab.diagnostics.Diagnostic;
import de.hpi.isg.xtab.model.QuestionTable;
import de.hpi.isg.xtab.weighting.WeightSummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of a run: the tables, the itemized list of everything that was skipped and the overall
 * {@link Status}.
 */
public class RunReport {

    public enum Status {
        /**
         * All questions were tabulated with all requested tests.
         */
        COMPLETE,
        /**
         * Some questions were skipped or some tests omitted.
         */
        PARTIAL
    }

    private final List<QuestionTable> tables;

    private final List<SkippedQuestion> skippedQuestions;

    private final List<Diagnostic> diagnostics;

    /**
     * Summary of the design weights or {@code null} if the run was unweighted.
     */
    private final WeightSummary weightSummary;

    private final int numResumedQuestions;

    public RunReport(List<QuestionTable> tables, List<SkippedQuestion> skippedQuestions,
                     List<Diagnostic> diagnostics, WeightSummary weightSummary, int numResumedQuestions) {
        this.tables = new ArrayList<>(tables);
        this.skippedQuestions = new ArrayList<>(skippedQuestions);
        this.diagnostics = new ArrayList<>(diagnostics);
        this.weightSummary = weightSummary;
        this.numResumedQuestions = numResumedQuestions;
    }

    public Status getStatus() {
        return this.skippedQuestions.isEmpty() && this.getOmissions().isEmpty() ? Status.COMPLETE : Status.PARTIAL;
    }

    public List<QuestionTable> getTables() {
        return Collections.unmodifiableList(this.tables);
    }

    /**
     * @return the table for the given question or composite code or {@code null} if there is none
     */
    public QuestionTable getTable(String questionCode) {
        for (QuestionTable table : this.tables) {
            if (table.getQuestionCode().equals(questionCode)) return table;
        }
        return null;
    }

    public List<SkippedQuestion> getSkippedQuestions() {
        return Collections.unmodifiableList(this.skippedQuestions);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(this.diagnostics);
    }

    /**
     * @return the diagnostics about omitted significance or chi-square tests and failed table sections
     */
    public List<Diagnostic> getOmissions() {
        List<Diagnostic> omissions = new ArrayList<>();
        for (Diagnostic diagnostic : this.diagnostics) {
            if (isOmission(diagnostic)) omissions.add(diagnostic);
        }
        return omissions;
    }

    private static boolean isOmission(Diagnostic diagnostic) {
        if (diagnostic.getSeverity() == Diagnostic.Severity.ERROR) return true;
        if (diagnostic.getSeverity() != Diagnostic.Severity.WARNING) return false;
        return diagnostic.getCategory() == Diagnostic.Category.SIGNIFICANCE
                || diagnostic.getCategory() == Diagnostic.Category.CHI_SQUARE;
    }

    public WeightSummary getWeightSummary() {
        return this.weightSummary;
    }

    /**
     * @return the number of tables that were restored from a checkpoint rather than calculated in this run
     */
    public int getNumResumedQuestions() {
        return this.numResumedQuestions;
    }

    /**
     * Renders the status along with the itemized skips and omissions.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Run status: ").append(this.getStatus()).append('\n');
        sb.append(String.format("Tables: %d (%d resumed from checkpoint)%n", this.tables.size(), this.numResumedQuestions));
        if (this.weightSummary != null) {
            sb.append("Weights: ").append(this.weightSummary).append('\n');
        }
        if (!this.skippedQuestions.isEmpty()) {
            sb.append(String.format("Skipped questions (%d):%n", this.skippedQuestions.size()));
            for (SkippedQuestion skippedQuestion : this.skippedQuestions) {
                sb.append("  - ").append(skippedQuestion).append('\n');
            }
        }
        List<Diagnostic> omissions = this.getOmissions();
        if (!omissions.isEmpty()) {
            sb.append(String.format("Omitted tests and sections (%d):%n", omissions.size()));
            for (Diagnostic omission : omissions) {
                sb.append("  - ").append(omission).append('\n');
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("RunReport[%s, %d tables, %d skipped]",
                this.getStatus(), this.tables.size(), this.skippedQuestions.size());
    }
}
