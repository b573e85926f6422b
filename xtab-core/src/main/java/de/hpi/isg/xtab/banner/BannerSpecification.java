package de.hpi.isg.xtab.banner;

import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.VariableType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Declares which questions segment the population and how.
 */
public class BannerSpecification {

    private final List<Entry> entries = new ArrayList<>();

    /**
     * Adds a banner question.
     *
     * @param question         the banner question
     * @param useBoxCategories whether to create one column per box category rather than per option
     * @param label            the banner header or {@code null} to use the question's banner label
     * @param displayOrder     position of the banner question or {@code null} to keep the declaration order
     * @return this instance
     */
    public BannerSpecification add(QuestionDefinition question, boolean useBoxCategories, String label,
                                   Integer displayOrder) {
        this.entries.add(new Entry(question, useBoxCategories, label, displayOrder, this.entries.size()));
        return this;
    }

    public BannerSpecification add(QuestionDefinition question) {
        return this.add(question, false, null, null);
    }

    /**
     * @return the entries ordered by display order; entries without display order come last
     */
    public List<Entry> getEntries() {
        return this.entries.stream()
                .sorted(Comparator
                        .comparing((Entry entry) -> entry.displayOrder, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparingInt(entry -> entry.declarationIndex))
                .collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return this.entries.isEmpty();
    }

    /**
     * A single banner question.
     */
    public static class Entry {

        private final QuestionDefinition question;

        private final boolean useBoxCategories;

        private final String label;

        private final Integer displayOrder;

        private final int declarationIndex;

        private Entry(QuestionDefinition question, boolean useBoxCategories, String label, Integer displayOrder,
                      int declarationIndex) {
            this.question = question;
            this.useBoxCategories = useBoxCategories;
            this.label = label;
            this.displayOrder = displayOrder;
            this.declarationIndex = declarationIndex;
        }

        public QuestionDefinition getQuestion() {
            return this.question;
        }

        public SegmentationKind getKind() {
            if (this.useBoxCategories) return SegmentationKind.BOX_CATEGORY;
            return this.question.getType() == VariableType.MULTI_MENTION ?
                    SegmentationKind.MULTI_MENTION :
                    SegmentationKind.STANDARD;
        }

        /**
         * @return the banner header
         */
        public String getLabel() {
            return this.label == null || this.label.trim().isEmpty() ? this.question.getBannerLabel() : this.label;
        }
    }

    public List<QuestionDefinition> getQuestions() {
        return Collections.unmodifiableList(
                this.getEntries().stream().map(Entry::getQuestion).collect(Collectors.toList())
        );
    }
}
