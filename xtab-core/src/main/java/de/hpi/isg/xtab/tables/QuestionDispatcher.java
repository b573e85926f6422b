package de.hpi.isg.xtab.tables;

import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.QuestionTable;
import de.hpi.isg.xtab.model.VariableType;
import de.hpi.isg.xtab.ranking.RankingQuestionProcessor;

/**
 * Routes each question to the {@link QuestionProcessor} for its {@link VariableType}.
 */
public class QuestionDispatcher implements QuestionProcessor {

    private final QuestionProcessor standardProcessor = new StandardQuestionProcessor();

    private final QuestionProcessor numericProcessor = new NumericQuestionProcessor();

    private final QuestionProcessor rankingProcessor = new RankingQuestionProcessor();

    @Override
    public QuestionTable process(QuestionDefinition question, TableContext context) {
        return this.getProcessor(question.getType()).process(question, context);
    }

    public QuestionProcessor getProcessor(VariableType type) {
        switch (type) {
            case SINGLE_RESPONSE:
            case MULTI_MENTION:
            case RATING:
            case LIKERT:
            case NPS:
                return this.standardProcessor;
            case NUMERIC:
                return this.numericProcessor;
            case RANKING:
                return this.rankingProcessor;
            default:
                throw new IllegalStateException("Unknown variable type: " + type);
        }
    }
}
