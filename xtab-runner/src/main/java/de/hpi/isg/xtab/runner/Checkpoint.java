package de.hpi.isg.xtab.runner;

import de.hpi.isg.xtab.model.QuestionTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The progress of a run: the completed tables and the codes of the questions they belong to.
 */
public class Checkpoint {

    private final ArrayList<QuestionTable> tables = new ArrayList<>();

    private final ArrayList<String> processedCodes = new ArrayList<>();

    public void add(String questionCode, QuestionTable table) {
        this.processedCodes.add(questionCode);
        this.tables.add(table);
    }

    public List<QuestionTable> getTables() {
        return Collections.unmodifiableList(this.tables);
    }

    public List<String> getProcessedCodes() {
        return Collections.unmodifiableList(this.processedCodes);
    }

    public boolean isProcessed(String questionCode) {
        return this.processedCodes.contains(questionCode);
    }

    public int size() {
        return this.processedCodes.size();
    }

    @Override
    public String toString() {
        return String.format("Checkpoint[%d questions]", this.processedCodes.size());
    }
}
