package de.hpi.isg.xtab.ranking;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

/**
 * Test suite for the {@link RankingValidator} class.
 */
public class RankingValidatorTest {

    private final RankingValidator validator = new RankingValidator(5, 5, 80);

    @Test
    public void testCleanRankings() {
        RankingMatrix matrix = new RankingMatrix(
                Arrays.asList("A", "B", "C"),
                new double[][]{{1, 2, 3}, {2, 3, 1}, {3, 1, 2}},
                3, 3
        );
        RankingValidation validation = this.validator.validate(matrix);
        Assert.assertFalse(validation.hasIssues());
        Assert.assertEquals(100d, validation.getCompletePct(), 0);
        Assert.assertEquals(0d, validation.getTiesPct(), 0);
    }

    @Test
    public void testDetectsQualityIssues() {
        RankingMatrix matrix = new RankingMatrix(
                Arrays.asList("A", "B"),
                new double[][]{{1, 1, 1, 1}, {2, 1, 3, 2}},
                4, 2
        );
        RankingValidation validation = this.validator.validate(matrix);
        Assert.assertEquals(1, validation.getNumOutOfRange());
        Assert.assertEquals(12.5, validation.getOutOfRangePct(), 0.000000001);
        Assert.assertEquals(25d, validation.getTiesPct(), 0.000000001);
        // Tied rows also have gaps.
        Assert.assertEquals(50d, validation.getGapsPct(), 0.000000001);
        Assert.assertEquals(Arrays.asList(
                "1 values (12.5%) out of valid range [1, 2]",
                "25.0% of respondents have tied ranks (threshold: 5%)",
                "50.0% of respondents have gaps in rankings (threshold: 5%)"
        ), validation.getIssues());
    }

    @Test
    public void testIncompleteRankings() {
        RankingMatrix matrix = new RankingMatrix(
                Arrays.asList("A", "B"),
                new double[][]{{1, Double.NaN}, {Double.NaN, Double.NaN}},
                2, 2
        );
        RankingValidation validation = this.validator.validate(matrix);
        Assert.assertEquals(25d, validation.getCompletePct(), 0.000000001);
        Assert.assertEquals(Arrays.asList("Only 25.0% complete (threshold: 80%)"), validation.getIssues());
    }

    @Test
    public void testNonIntegerRanks() {
        RankingMatrix matrix = new RankingMatrix(
                Arrays.asList("A", "B"),
                new double[][]{{1.5}, {2}},
                1, 2
        );
        RankingValidation validation = this.validator.validate(matrix);
        Assert.assertEquals(1, validation.getNumNonInteger());
        Assert.assertTrue(validation.getIssues().contains("1 non-integer rank values"));
    }
}
