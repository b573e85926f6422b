package de.hpi.isg.xtab.ranking;

import de.hpi.isg.xtab.model.RankDirection;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

/**
 * Test suite for the {@link RankingMatrix} class.
 */
public class RankingMatrixTest {

    private static RankingMatrix createMatrix() {
        return new RankingMatrix(
                Arrays.asList("A", "B"),
                new double[][]{{1, 2, 3, 4, 5}, {5, Double.NaN, 1, 2, 3}},
                5, 5
        );
    }

    @Test
    public void testFlipWorstToBest() {
        RankingMatrix matrix = createMatrix();
        RankingMatrix normalized = matrix.normalize(RankDirection.WORST_TO_BEST);
        Assert.assertEquals(5d, normalized.getRank(0, 0), 0);
        Assert.assertEquals(1d, normalized.getRank(4, 0), 0);
        Assert.assertEquals(3d, normalized.getRank(2, 0), 0);
        Assert.assertTrue(Double.isNaN(normalized.getRank(1, 1)));

        RankingMatrix restored = normalized.denormalize(RankDirection.WORST_TO_BEST);
        for (int row = 0; row < matrix.getNumRows(); row++) {
            for (int item = 0; item < matrix.getNumItems(); item++) {
                Assert.assertEquals(matrix.getRank(row, item), restored.getRank(row, item), 0);
            }
        }
    }

    @Test
    public void testBestToWorstIsUnchanged() {
        RankingMatrix matrix = createMatrix();
        Assert.assertSame(matrix, matrix.normalize(RankDirection.BEST_TO_WORST));
    }

    @Test
    public void testRanges() {
        RankingMatrix matrix = createMatrix();
        Assert.assertTrue(matrix.isInRange(1));
        Assert.assertTrue(matrix.isInRange(5));
        Assert.assertFalse(matrix.isInRange(0));
        Assert.assertFalse(matrix.isInRange(6));
        Assert.assertFalse(matrix.isInRange(Double.NaN));
        Assert.assertTrue(matrix.hasAnyRank(1));
        Assert.assertEquals(1, matrix.getItemIndex("B"));
        Assert.assertFalse(matrix.isEmpty());
    }
}
