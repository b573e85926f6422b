package de.hpi.isg.xtab.model;

/**
 * How rank-order responses are laid out in the data.
 */
public enum RankingFormat {

    /**
     * One column per item holding the rank that the item received.
     */
    POSITION,

    /**
     * One column per rank position holding the item that was given that rank.
     */
    ITEM
}
