package de.hpi.isg.xtab.ranking;

import de.hpi.isg.xtab.model.QuestionTable;

/**
 * The table of a ranking question together with its {@link RankingContext}.
 */
public class RankingResult {

    private final QuestionTable table;

    private final RankingContext context;

    public RankingResult(QuestionTable table, RankingContext context) {
        this.table = table;
        this.context = context;
    }

    public QuestionTable getTable() {
        return this.table;
    }

    public RankingContext getContext() {
        return this.context;
    }
}
