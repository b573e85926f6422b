package de.hpi.isg.xtab.significance;

/**
 * Compares the data of two segments.
 *
 * @param <T> the type of the segment data
 */
@FunctionalInterface
public interface PairwiseTest<T> {

    TestResult test(T first, T second, double alpha);

}
