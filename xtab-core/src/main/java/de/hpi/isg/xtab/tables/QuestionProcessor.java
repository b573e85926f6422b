package de.hpi.isg.xtab.tables;

import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.QuestionTable;

/**
 * Tabulates questions of certain {@link de.hpi.isg.xtab.model.VariableType}s.
 */
public interface QuestionProcessor {

    /**
     * Tabulates a question against all banner columns.
     *
     * @param question the question
     * @param context  the respondents, their segmentation and the settings
     * @return the {@link QuestionTable}
     * @throws de.hpi.isg.xtab.error.CrosstabException if the question cannot be tabulated
     */
    QuestionTable process(QuestionDefinition question, TableContext context);

}
