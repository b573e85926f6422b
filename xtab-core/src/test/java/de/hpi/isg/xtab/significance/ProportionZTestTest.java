package de.hpi.isg.xtab.significance;

import org.junit.Assert;
import org.junit.Test;

/**
 * Test suite for the {@link ProportionZTest} and {@link WeightedTTest} classes.
 */
public class ProportionZTestTest {

    @Test
    public void testUnweightedProportions() {
        ProportionZTest test = new ProportionZTest(false, 30);
        TestResult result = test.test(new ProportionSample(60, 100, 100), new ProportionSample(40, 100, 100), 0.05);
        Assert.assertTrue(result.isSignificant());
        Assert.assertTrue(result.isFirstHigher());
        // z = 0.2 / sqrt(0.25 * 0.02)
        Assert.assertEquals(0.00468, result.getPValue(), 0.0001);

        TestResult reverse = test.test(new ProportionSample(40, 100, 100), new ProportionSample(60, 100, 100), 0.05);
        Assert.assertTrue(reverse.isSignificant());
        Assert.assertFalse(reverse.isFirstHigher());
    }

    @Test
    public void testSmallBasesAreSkipped() {
        ProportionZTest test = new ProportionZTest(false, 30);
        Assert.assertTrue(test.test(new ProportionSample(10, 20, 20), new ProportionSample(5, 100, 100), 0.05)
                .isSkipped());
        Assert.assertTrue(test.test(new ProportionSample(10, 5, 5), new ProportionSample(5, 100, 100), 0.05)
                .isSkipped());
    }

    @Test
    public void testWeightedProportionsUseEffectiveN() {
        ProportionZTest test = new ProportionZTest(true, 30);
        // The effective bases are too small although the weighted ones are not.
        Assert.assertTrue(test.test(new ProportionSample(60, 100, 25), new ProportionSample(40, 100, 25), 0.05)
                .isSkipped());
        Assert.assertFalse(test.test(new ProportionSample(60, 100, 100), new ProportionSample(40, 100, 100), 0.05)
                .isSkipped());
    }

    @Test
    public void testIdenticalProportions() {
        ProportionZTest test = new ProportionZTest(false, 30);
        TestResult result = test.test(new ProportionSample(0, 50, 50), new ProportionSample(0, 50, 50), 0.05);
        Assert.assertFalse(result.isSignificant());
        Assert.assertEquals(1d, result.getPValue(), 0);
    }

    @Test
    public void testMeans() {
        WeightedTTest test = new WeightedTTest(30);
        double[] high = new double[40], low = new double[40];
        for (int i = 0; i < 40; i++) {
            high[i] = 4 + i % 2;
            low[i] = 2 + i % 2;
        }
        TestResult result = test.test(MeanSample.unweighted(high), MeanSample.unweighted(low), 0.05);
        Assert.assertTrue(result.isSignificant());
        Assert.assertTrue(result.isFirstHigher());

        TestResult same = test.test(MeanSample.unweighted(high), MeanSample.unweighted(high), 0.05);
        Assert.assertFalse(same.isSignificant());

        TestResult small = test.test(MeanSample.unweighted(1, 2, 3), MeanSample.unweighted(high), 0.05);
        Assert.assertTrue(small.isSkipped());
    }
}
