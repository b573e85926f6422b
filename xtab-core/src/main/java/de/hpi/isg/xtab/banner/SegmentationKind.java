package de.hpi.isg.xtab.banner;

/**
 * How a banner question is turned into banner columns.
 */
public enum SegmentationKind {

    /**
     * One column per shown option of a single-choice question.
     */
    STANDARD,

    /**
     * One column per shown option of a question spanning several mention columns.
     */
    MULTI_MENTION,

    /**
     * One column per box category, i.e., per group of options.
     */
    BOX_CATEGORY
}
