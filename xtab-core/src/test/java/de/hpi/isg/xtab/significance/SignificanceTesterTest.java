package de.hpi.isg.xtab.significance;

import de.hpi.isg.xtab.banner.BannerBuilder;
import de.hpi.isg.xtab.banner.BannerSpecification;
import de.hpi.isg.xtab.banner.BannerStructure;
import de.hpi.isg.xtab.config.AnalysisConfiguration;
import de.hpi.isg.xtab.diagnostics.Diagnostic;
import de.hpi.isg.xtab.diagnostics.Diagnostics;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.SegmentKey;
import de.hpi.isg.xtab.model.VariableType;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Test suite for the {@link SignificanceTester} class.
 */
public class SignificanceTesterTest {

    private static final SegmentKey NORTH = SegmentKey.ofOption("Region", "North");

    private static final SegmentKey SOUTH = SegmentKey.ofOption("Region", "South");

    private static final SegmentKey EAST = SegmentKey.ofOption("Region", "East");

    private BannerStructure structure;

    private Diagnostics diagnostics;

    @Before
    public void setUp() {
        QuestionDefinition region = new QuestionDefinition("Region", "Region", VariableType.SINGLE_RESPONSE)
                .addOptions("North", "South", "East");
        this.structure = new BannerBuilder().build(new BannerSpecification().add(region));
        this.diagnostics = new Diagnostics();
    }

    private SignificanceTester createTester(boolean isBonferroniCorrection) {
        AnalysisConfiguration configuration = new AnalysisConfiguration();
        configuration.bonferroniCorrection = isBonferroniCorrection;
        return new SignificanceTester(this.structure, configuration, false, this.diagnostics);
    }

    private static Map<SegmentKey, ProportionSample> proportions(double north, double south, double east) {
        Map<SegmentKey, ProportionSample> samples = new LinkedHashMap<>();
        samples.put(NORTH, new ProportionSample(north, 100, 100));
        samples.put(SOUTH, new ProportionSample(south, 100, 100));
        samples.put(EAST, new ProportionSample(east, 100, 100));
        return samples;
    }

    @Test
    public void testLetters() {
        Map<SegmentKey, String> letters = this.createTester(true).testProportions(proportions(60, 40, 50));
        Assert.assertEquals(BannerStructure.TOTAL_LETTER, letters.get(SegmentKey.TOTAL));
        Assert.assertEquals("B", letters.get(NORTH));
        Assert.assertEquals("", letters.get(SOUTH));
        Assert.assertEquals("", letters.get(EAST));
    }

    @Test
    public void testBonferroniCorrection() {
        // North vs. East yields p ~ 0.034: significant at 0.05, but not at 0.05 / 3.
        Map<SegmentKey, String> uncorrected = this.createTester(false).testProportions(proportions(60, 50, 45));
        Assert.assertEquals("C", uncorrected.get(NORTH));

        Map<SegmentKey, String> corrected = this.createTester(true).testProportions(proportions(60, 50, 45));
        Assert.assertEquals("", corrected.get(NORTH));
    }

    @Test
    public void testSkippedComparisonsAreReported() {
        SignificanceTester tester = this.createTester(true);
        Map<SegmentKey, ProportionSample> samples = proportions(60, 40, 50);
        samples.put(EAST, new ProportionSample(5, 10, 10));
        Map<SegmentKey, String> letters = tester.testProportions(samples);
        Assert.assertEquals("B", letters.get(NORTH));
        Assert.assertEquals("", letters.get(EAST));

        // Both directions of the two comparisons with East are skipped.
        Assert.assertEquals(4, tester.reportSkippedComparisons());
        Assert.assertEquals(1, this.diagnostics.getEntries(Diagnostic.Category.SIGNIFICANCE).size());
        Assert.assertEquals(0, tester.reportSkippedComparisons());
    }

    @Test
    public void testMissingSegmentsAreIgnored() {
        Map<SegmentKey, ProportionSample> samples = new LinkedHashMap<>();
        samples.put(NORTH, new ProportionSample(60, 100, 100));
        Map<SegmentKey, String> letters = this.createTester(true).testProportions(samples);
        Assert.assertEquals("", letters.get(NORTH));
        Assert.assertEquals("", letters.get(SOUTH));
    }

    @Test
    public void testMeanRanksFavorLowerValues() {
        double[] better = new double[40], worse = new double[40], middle = new double[40];
        for (int i = 0; i < 40; i++) {
            better[i] = 1 + i % 2;
            worse[i] = 3 + i % 2;
            middle[i] = 1 + i % 2;
        }
        Map<SegmentKey, MeanSample> samples = new LinkedHashMap<>();
        samples.put(NORTH, MeanSample.unweighted(better));
        samples.put(SOUTH, MeanSample.unweighted(worse));
        samples.put(EAST, MeanSample.unweighted(middle));

        SignificanceTester tester = this.createTester(true);
        Map<SegmentKey, String> rankLetters = tester.testMeanRanks(samples);
        Assert.assertEquals("B", rankLetters.get(NORTH));
        Assert.assertEquals("", rankLetters.get(SOUTH));
        Assert.assertEquals("B", rankLetters.get(EAST));

        Map<SegmentKey, String> meanLetters = tester.testMeans(samples);
        Assert.assertEquals("", meanLetters.get(NORTH));
        Assert.assertEquals("AC", meanLetters.get(SOUTH));
    }
}
