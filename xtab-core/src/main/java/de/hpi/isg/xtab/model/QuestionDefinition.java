package de.hpi.isg.xtab.model;

import org.apache.commons.lang3.Validate;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Describes a survey question as declared in the survey structure.
 */
public class QuestionDefinition implements Serializable {

    private final String code;

    private final String text;

    private final VariableType type;

    private final List<ResponseOption> options = new ArrayList<>();

    /**
     * Number of physical columns ({@code Q_1..Q_k}) of a multi-mention question.
     */
    private int numColumns = 1;

    private boolean createIndex = false;

    private String baseFilter;

    private String bannerLabel;

    ////////////////////
    // Numeric bounds //
    ////////////////////

    private double minValue = Double.NaN, maxValue = Double.NaN;

    /////////////
    // Ranking //
    /////////////

    private RankingFormat rankingFormat;

    private RankDirection rankDirection = RankDirection.BEST_TO_WORST;

    private int rankingPositions = -1;

    public QuestionDefinition(String code, String text, VariableType type) {
        Validate.notBlank(code, "Question code must not be blank.");
        Validate.notNull(type, "Question %s has no variable type.", code);
        this.code = code;
        this.text = text;
        this.type = type;
    }

    public String getCode() {
        return this.code;
    }

    /**
     * @return the question text or the code if there is no text
     */
    public String getText() {
        return this.text == null || this.text.trim().isEmpty() ? this.code : this.text;
    }

    public VariableType getType() {
        return this.type;
    }

    public QuestionDefinition addOption(ResponseOption option) {
        if (option.getDisplayOrder() == Integer.MAX_VALUE) {
            option.setDisplayOrder(this.options.size() + 1);
        }
        this.options.add(option);
        return this;
    }

    public QuestionDefinition addOptions(String... optionTexts) {
        for (String optionText : optionTexts) {
            this.addOption(new ResponseOption(optionText));
        }
        return this;
    }

    /**
     * @return all declared options in declaration order
     */
    public List<ResponseOption> getOptions() {
        return Collections.unmodifiableList(this.options);
    }

    /**
     * @return the options to be shown in output, ordered by their display order
     */
    public List<ResponseOption> getOutputOptions() {
        return this.options.stream()
                .filter(ResponseOption::isShowInOutput)
                .sorted(Comparator.comparingInt(ResponseOption::getDisplayOrder))
                .collect(Collectors.toList());
    }

    /**
     * @return the distinct box categories in the order of the first option (by display order) carrying them
     */
    public List<String> getBoxCategories() {
        Set<String> categories = new LinkedHashSet<>();
        this.options.stream()
                .sorted(Comparator.comparingInt(ResponseOption::getDisplayOrder))
                .filter(ResponseOption::hasBoxCategory)
                .forEach(option -> categories.add(option.getBoxCategory().trim()));
        return new ArrayList<>(categories);
    }

    /**
     * @return the options that belong to the given box category
     */
    public List<ResponseOption> getOptionsInBoxCategory(String category) {
        return this.options.stream()
                .filter(option -> option.hasBoxCategory() && option.getBoxCategory().trim().equals(category))
                .collect(Collectors.toList());
    }

    public int getNumColumns() {
        return this.numColumns;
    }

    public QuestionDefinition setNumColumns(int numColumns) {
        Validate.isTrue(numColumns >= 1, "Question %s must have at least one column.", this.code);
        this.numColumns = numColumns;
        return this;
    }

    /**
     * Names of the data columns of this question. Multi-mention questions span {@code Q_1..Q_k}, all other
     * questions live in a column named like the question code. Ranking columns are resolved separately.
     */
    public List<String> getColumnNames() {
        if (this.type != VariableType.MULTI_MENTION) {
            return Collections.singletonList(this.code);
        }
        List<String> names = new ArrayList<>(this.numColumns);
        for (int i = 1; i <= this.numColumns; i++) {
            names.add(this.code + "_" + i);
        }
        return names;
    }

    public boolean isCreateIndex() {
        return this.createIndex;
    }

    public QuestionDefinition setCreateIndex(boolean createIndex) {
        this.createIndex = createIndex;
        return this;
    }

    public String getBaseFilter() {
        return this.baseFilter;
    }

    public QuestionDefinition setBaseFilter(String baseFilter) {
        this.baseFilter = baseFilter;
        return this;
    }

    /**
     * @return the label to use when this question defines banner columns
     */
    public String getBannerLabel() {
        return this.bannerLabel == null || this.bannerLabel.trim().isEmpty() ? this.getText() : this.bannerLabel;
    }

    public QuestionDefinition setBannerLabel(String bannerLabel) {
        this.bannerLabel = bannerLabel;
        return this;
    }

    public double getMinValue() {
        return this.minValue;
    }

    public double getMaxValue() {
        return this.maxValue;
    }

    public QuestionDefinition setValueRange(double minValue, double maxValue) {
        this.minValue = minValue;
        this.maxValue = maxValue;
        return this;
    }

    public RankingFormat getRankingFormat() {
        return this.rankingFormat;
    }

    public QuestionDefinition setRankingFormat(RankingFormat rankingFormat) {
        this.rankingFormat = rankingFormat;
        return this;
    }

    public RankDirection getRankDirection() {
        return this.rankDirection;
    }

    public QuestionDefinition setRankDirection(RankDirection rankDirection) {
        this.rankDirection = rankDirection;
        return this;
    }

    /**
     * @return the number of rank positions or {@code -1} if it is to be derived from the items
     */
    public int getRankingPositions() {
        return this.rankingPositions;
    }

    public QuestionDefinition setRankingPositions(int rankingPositions) {
        this.rankingPositions = rankingPositions;
        return this;
    }

    @Override
    public String toString() {
        return String.format("QuestionDefinition[%s, %s]", this.code, this.type);
    }
}
