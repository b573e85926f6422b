package de.hpi.isg.xtab.banner;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.ResponseOption;
import de.hpi.isg.xtab.model.SegmentKey;
import de.hpi.isg.xtab.util.Letters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the {@link BannerStructure} from a {@link BannerSpecification}. This happens once per run.
 */
public class BannerBuilder {

    private final Logger logger = LoggerFactory.getLogger(this.getClass());

    /**
     * @throws CrosstabException if a banner question cannot be turned into columns
     */
    public BannerStructure build(BannerSpecification specification) {
        if (specification.isEmpty()) {
            this.logger.info("No banner questions configured, using the total column only.");
            return BannerStructure.totalOnly();
        }
        List<BannerGroup> groups = new ArrayList<>();
        for (BannerSpecification.Entry entry : specification.getEntries()) {
            BannerGroup group = this.buildGroup(entry);
            this.logger.debug("Created {} for banner question {}.", group, entry.getQuestion().getCode());
            groups.add(group);
        }
        BannerStructure structure = new BannerStructure(groups);
        this.logger.info("Created {}.", structure);
        return structure;
    }

    private BannerGroup buildGroup(BannerSpecification.Entry entry) {
        QuestionDefinition question = entry.getQuestion();
        SegmentationKind kind = entry.getKind();
        List<String> columnNames = question.getColumnNames();
        boolean isAllowingMissingColumns = columnNames.size() > 1;
        List<BannerColumn> columns = new ArrayList<>();

        if (kind == SegmentationKind.BOX_CATEGORY) {
            List<String> categories = question.getBoxCategories();
            if (categories.isEmpty()) {
                throw new CrosstabException(
                        ErrorCode.BANNER_NO_BOX_CATEGORY, "No BoxCategory Values for Banner: " + question.getCode(),
                        String.format("Banner '%s' is configured as BoxCategory but no BoxCategory values are defined.",
                                question.getCode()),
                        "BoxCategory banners require BoxCategory values to create column groups.",
                        "Add BoxCategory values to the options of this question",
                        "Or configure the banner to use its options instead"
                );
            }
            for (String category : categories) {
                Set<String> optionTexts = new LinkedHashSet<>();
                for (ResponseOption option : question.getOptionsInBoxCategory(category)) {
                    optionTexts.add(option.getOptionText());
                }
                columns.add(new BannerColumn(
                        SegmentKey.ofBoxCategory(question.getCode(), category),
                        category,
                        Letters.of(columns.size()),
                        new OptionPredicate(columnNames, optionTexts, isAllowingMissingColumns)
                ));
            }
        } else {
            List<ResponseOption> options = question.getOutputOptions();
            if (options.isEmpty()) {
                throw new CrosstabException(
                        ErrorCode.BANNER_NO_OPTIONS, "No Options for Banner: " + question.getCode(),
                        String.format("Banner question '%s' has no response options defined.", question.getCode()),
                        "Banner columns cannot be created without response options.",
                        "Add response options for this question",
                        "Ensure the options you want as banner columns are shown in output"
                );
            }
            for (ResponseOption option : options) {
                columns.add(new BannerColumn(
                        SegmentKey.ofOption(question.getCode(), option.getDisplayText()),
                        option.getDisplayText(),
                        Letters.of(columns.size()),
                        new OptionPredicate(columnNames, Collections.singleton(option.getOptionText()),
                                isAllowingMissingColumns)
                ));
            }
        }
        return new BannerGroup(question.getCode(), entry.getLabel(), kind, columns);
    }
}
