package de.hpi.isg.xtab.ranking;

import com.google.common.base.Joiner;
import com.google.common.collect.Iterables;
import de.hpi.isg.xtab.diagnostics.Diagnostic;
import de.hpi.isg.xtab.diagnostics.Diagnostics;
import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import de.hpi.isg.xtab.model.ColumnVector;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.RespondentTable;
import de.hpi.isg.xtab.model.ResponseOption;
import de.hpi.isg.xtab.model.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the responses of a ranking question into a {@link RankingMatrix} and normalizes its rank direction.
 * <p>Two layouts are supported:</p>
 * <ul>
 * <li>{@link de.hpi.isg.xtab.model.RankingFormat#POSITION}: one column per item (named like the option text,
 * optionally prefixed with {@code <code>_}) holding the rank of that item;</li>
 * <li>{@link de.hpi.isg.xtab.model.RankingFormat#ITEM}: one column per rank position (named
 * {@code <code>_Rank<position>}) holding the option text of the item at that rank. The position is always taken
 * from the column name, so that sparse rank columns are not misnumbered.</li>
 * </ul>
 */
public class RankingExtractor {

    private static final Pattern RANK_COLUMN_SUFFIX = Pattern.compile("_Rank(.*)$");

    private final Logger logger = LoggerFactory.getLogger(this.getClass());

    /**
     * Extracts the normalized {@link RankingMatrix} of a ranking question.
     *
     * @param question    a ranking question
     * @param table       the (possibly filtered) respondents
     * @param diagnostics receives data quality warnings
     * @return the {@link RankingMatrix} with rank {@code 1} being the best rank
     * @throws CrosstabException if the format is invalid or no ranking columns are found
     */
    public RankingMatrix extract(QuestionDefinition question, RespondentTable table, Diagnostics diagnostics) {
        if (question.getRankingFormat() == null) {
            throw new CrosstabException(
                    ErrorCode.INVALID_RANKING_FORMAT, "Missing Ranking Format",
                    String.format("Question %s does not declare whether its data is in Position or Item format.",
                            question.getCode()),
                    "The ranking format determines how ranks are read from the data.",
                    "Set the ranking format of the question to Position or Item"
            );
        }
        if (question.getOptions().isEmpty()) {
            throw new CrosstabException(
                    ErrorCode.INVALID_RANKING_FORMAT, "Missing Ranking Items",
                    String.format("Question %s has no options defined.", question.getCode()),
                    "The options define which items are being ranked.",
                    "Add the ranked items as options of the question"
            );
        }
        int numPositions = getNumPositions(question);

        RankingMatrix matrix;
        switch (question.getRankingFormat()) {
            case POSITION:
                matrix = this.extractPositionFormat(question, table, numPositions);
                break;
            case ITEM:
                matrix = this.extractItemFormat(question, table, numPositions, diagnostics);
                break;
            default:
                throw new IllegalStateException("Unknown ranking format: " + question.getRankingFormat());
        }
        if (matrix.isEmpty()) {
            throw new CrosstabException(
                    ErrorCode.EMPTY_RANKING_MATRIX, "Empty Ranking Data",
                    String.format("Question %s has no respondents or no ranked items.", question.getCode()),
                    "Ranking metrics cannot be calculated without any rankings.",
                    "Check the base filter of the question",
                    "Check that the data contains responses for this question"
            );
        }
        this.logger.debug("Extracted {} for {}.", matrix, question.getCode());
        return matrix.normalize(question.getRankDirection());
    }

    /**
     * Determines the number of rank positions: the declared number or, if not declared, the number of items.
     */
    public static int getNumPositions(QuestionDefinition question) {
        return question.getRankingPositions() > 0 ? question.getRankingPositions() : question.getOptions().size();
    }

    private RankingMatrix extractPositionFormat(QuestionDefinition question, RespondentTable table, int numPositions) {
        List<ResponseOption> options = question.getOptions();
        List<String> columnNames = new ArrayList<>();
        boolean isAnyUnprefixed = options.stream().anyMatch(option -> table.hasColumn(option.getOptionText().trim()));
        for (ResponseOption option : options) {
            String itemCode = option.getOptionText().trim();
            columnNames.add(isAnyUnprefixed ? itemCode : question.getCode() + "_" + itemCode);
        }

        List<String> items = new ArrayList<>();
        List<double[]> columns = new ArrayList<>();
        for (int i = 0; i < options.size(); i++) {
            ColumnVector column = table.getColumn(columnNames.get(i));
            if (column == null) continue;
            double[] ranks = new double[table.getNumRows()];
            for (int row = 0; row < ranks.length; row++) {
                ranks[row] = column.getNumber(row);
            }
            items.add(options.get(i).getDisplayText().trim());
            columns.add(ranks);
        }
        if (columns.isEmpty()) {
            throw new CrosstabException(
                    ErrorCode.RANKING_COLUMNS_NOT_FOUND, "Ranking Columns Not Found",
                    String.format("Question %s: no ranking columns found in data.", question.getCode()),
                    "Without ranking columns, no ranking data can be extracted for analysis.",
                    String.format("Expected columns: %s", columnNames.subList(0, Math.min(5, columnNames.size()))),
                    "Check that data column names match the option codes"
            );
        }
        return new RankingMatrix(items, columns.toArray(new double[0][]), table.getNumRows(), numPositions);
    }

    private RankingMatrix extractItemFormat(QuestionDefinition question, RespondentTable table, int numPositions,
                                            Diagnostics diagnostics) {
        String prefix = question.getCode() + "_Rank";
        List<String> rankColumns = table.getSchema().findColumnNames(name -> name.startsWith(prefix));
        if (rankColumns.isEmpty()) {
            throw new CrosstabException(
                    ErrorCode.RANKING_COLUMNS_NOT_FOUND, "Ranking Columns Not Found",
                    String.format("Question %s: no ranking columns found in data.", question.getCode()),
                    "Without ranking columns, no ranking data can be extracted for Item format analysis.",
                    String.format("Expected columns: %s1 to %s%d", prefix, prefix, numPositions),
                    "Check that data has columns matching the pattern QuestionCode_Rank1, QuestionCode_Rank2, ..."
            );
        }

        List<ResponseOption> options = question.getOptions();
        List<String> items = new ArrayList<>();
        for (ResponseOption option : options) {
            items.add(option.getDisplayText().trim());
        }
        double[][] ranks = new double[options.size()][table.getNumRows()];
        for (double[] column : ranks) {
            Arrays.fill(column, Double.NaN);
        }

        int numUnmatched = 0;
        Set<String> unmatched = new TreeSet<>();
        for (String columnName : rankColumns) {
            int position = parseRankPosition(question.getCode(), columnName, numPositions);
            ColumnVector column = table.getColumn(columnName);
            for (int row = 0; row < table.getNumRows(); row++) {
                String response = column.getText(row);
                if (Values.isBlank(response)) continue;
                boolean isMatched = false;
                for (int item = 0; item < options.size(); item++) {
                    if (Values.matches(response, options.get(item).getOptionText())) {
                        ranks[item][row] = position;
                        isMatched = true;
                        break;
                    }
                }
                if (!isMatched) {
                    numUnmatched++;
                    unmatched.add(response.trim());
                }
            }
        }
        if (numUnmatched > 0) {
            diagnostics.warn(Diagnostic.Category.RANKING,
                    "Question %s: %d ranked response(s) match no option and were ignored (e.g., %s).",
                    question.getCode(), numUnmatched, Joiner.on(", ").join(Iterables.limit(unmatched, 5)));
        }
        return new RankingMatrix(items, ranks, table.getNumRows(), numPositions);
    }

    /**
     * Parses the rank position from a column named {@code <code>_Rank<position>}.
     */
    static int parseRankPosition(String questionCode, String columnName, int numPositions) {
        Matcher matcher = RANK_COLUMN_SUFFIX.matcher(columnName);
        int position = -1;
        if (matcher.find()) {
            String digits = matcher.group(1).replaceAll("\\D", "");
            if (!digits.isEmpty() && digits.length() < 10) position = Integer.parseInt(digits);
        }
        if (position < 1 || position > numPositions) {
            throw new CrosstabException(
                    ErrorCode.INVALID_RANKING_FORMAT, "Invalid Rank Column Name",
                    String.format("Question %s: cannot parse a rank position between 1 and %d from column name '%s'.",
                            questionCode, numPositions, columnName),
                    "Item format ranking requires column names matching the pattern QuestionCode_Rank# to determine rank positions.",
                    "Ensure ranking columns follow the pattern: QuestionCode_Rank1, QuestionCode_Rank2, etc.",
                    String.format("Expected rank position between 1 and %d", numPositions)
            );
        }
        return position;
    }
}
