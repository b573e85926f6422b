package de.hpi.isg.xtab.banner;

import de.hpi.isg.xtab.model.SegmentKey;

import java.io.Serializable;

/**
 * A population segment against which questions are tabulated.
 */
public class BannerColumn implements Serializable {

    private final SegmentKey key;

    private final String label;

    /**
     * Identifies the column in significance results within its {@link BannerGroup}.
     */
    private final String letter;

    /**
     * Decides membership in this column or {@code null} for the total column, which contains all respondents.
     */
    private final OptionPredicate predicate;

    public BannerColumn(SegmentKey key, String label, String letter, OptionPredicate predicate) {
        this.key = key;
        this.label = label;
        this.letter = letter;
        this.predicate = predicate;
    }

    public SegmentKey getKey() {
        return this.key;
    }

    public String getLabel() {
        return this.label;
    }

    public String getLetter() {
        return this.letter;
    }

    public OptionPredicate getPredicate() {
        return this.predicate;
    }

    public boolean isTotal() {
        return this.key.isTotal();
    }

    @Override
    public String toString() {
        return String.format("BannerColumn[%s (%s)]", this.key, this.letter);
    }
}
