package de.hpi.isg.xtab.model;

/**
 * Whether rank 1 denotes the best or the worst item.
 */
public enum RankDirection {

    BEST_TO_WORST,

    WORST_TO_BEST
}
