package de.hpi.isg.xtab.cells;

import de.hpi.isg.xtab.banner.BannerBuilder;
import de.hpi.isg.xtab.banner.BannerSegmenter;
import de.hpi.isg.xtab.banner.BannerSpecification;
import de.hpi.isg.xtab.banner.BannerStructure;
import de.hpi.isg.xtab.banner.RowIndexMap;
import de.hpi.isg.xtab.model.BaseSize;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.QuestionRow;
import de.hpi.isg.xtab.model.QuestionTable;
import de.hpi.isg.xtab.model.RespondentTable;
import de.hpi.isg.xtab.model.SegmentKey;
import de.hpi.isg.xtab.model.VariableType;
import de.hpi.isg.xtab.weighting.WeightSequence;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

/**
 * Test suite for the {@link CellCalculator} and {@link BaseCalculator} classes.
 */
public class CellCalculatorTest {

    private static final SegmentKey MALE = SegmentKey.ofOption("Gender", "Male");

    private static final SegmentKey FEMALE = SegmentKey.ofOption("Gender", "Female");

    private final CellCalculator cellCalculator = new CellCalculator();

    private final BaseCalculator baseCalculator = new BaseCalculator();

    private RespondentTable table;

    private BannerStructure structure;

    private RowIndexMap rowIndices;

    @Before
    public void setUp() {
        this.table = RespondentTable.builder("survey")
                .addTextColumn("Gender", "Male", "Male", "Female", "Female", "Female")
                .addTextColumn("Q1", "Yes", "No", "Yes", "Yes", null)
                .build();
        QuestionDefinition gender = new QuestionDefinition("Gender", "Gender", VariableType.SINGLE_RESPONSE)
                .addOptions("Male", "Female");
        this.structure = new BannerBuilder().build(new BannerSpecification().add(gender));
        this.rowIndices = new BannerSegmenter().segment(this.table, this.structure);
    }

    @Test
    public void testPercentage() {
        Assert.assertEquals(25d, CellCalculator.percentage(1, 4), 0);
        Assert.assertTrue(Double.isNaN(CellCalculator.percentage(1, 0)));
        Assert.assertTrue(Double.isNaN(CellCalculator.percentage(1, Double.NaN)));
    }

    @Test
    public void testWeightedRowCounts() {
        WeightSequence weights = WeightSequence.of(1, 2, 0.5, 1.5, 1);
        Map<SegmentKey, Double> counts = this.cellCalculator.rowCounts(
                this.table, Collections.singletonList("Q1"), Collections.singleton("Yes"), this.rowIndices, weights
        );
        Assert.assertEquals(3d, counts.get(SegmentKey.TOTAL), 0);
        Assert.assertEquals(1d, counts.get(MALE), 0);
        Assert.assertEquals(2d, counts.get(FEMALE), 0);
    }

    @Test
    public void testColumnPercentsAddUp() {
        QuestionDefinition q1 = new QuestionDefinition("Q1", "Q1", VariableType.SINGLE_RESPONSE).addOptions("Yes", "No");
        WeightSequence weights = WeightSequence.unit(this.table.getNumRows());
        Map<SegmentKey, BaseSize> bases = this.baseCalculator.questionBases(q1, this.table, this.rowIndices, weights);
        Assert.assertEquals(4, bases.get(SegmentKey.TOTAL).getUnweighted());
        Assert.assertEquals(2, bases.get(FEMALE).getUnweighted());

        QuestionTable.Builder builder = QuestionTable.builder("Q1", "Q1", this.rowIndices.getKeys());
        QuestionRow yes = this.cellCalculator.addColumnPercentRow(builder, "Yes", this.cellCalculator.rowCounts(
                this.table, Collections.singletonList("Q1"), Collections.singleton("Yes"), this.rowIndices, weights
        ), bases);
        QuestionRow no = this.cellCalculator.addColumnPercentRow(builder, "No", this.cellCalculator.rowCounts(
                this.table, Collections.singletonList("Q1"), Collections.singleton("No"), this.rowIndices, weights
        ), bases);
        for (SegmentKey key : this.rowIndices.getKeys()) {
            Assert.assertEquals(100d, yes.getValue(key) + no.getValue(key), 0.000000001);
        }
        Assert.assertEquals(75d, yes.getValue(SegmentKey.TOTAL), 0.000000001);
        Assert.assertEquals(100d, yes.getValue(FEMALE), 0.000000001);
    }

    @Test
    public void testRowPercents() {
        QuestionTable.Builder builder = QuestionTable.builder("Q1", "Q1", this.rowIndices.getKeys());
        Map<SegmentKey, Double> counts = this.cellCalculator.rowCounts(
                this.table, Collections.singletonList("Q1"), Collections.singleton("Yes"),
                this.rowIndices, WeightSequence.unit(this.table.getNumRows())
        );
        QuestionRow row = this.cellCalculator.addRowPercentRow(builder, "Yes", counts, this.structure, true);
        Assert.assertEquals(100d, row.getValue(SegmentKey.TOTAL), 0);
        Assert.assertEquals(100d / 3, row.getValue(MALE), 0.000000001);
        Assert.assertEquals(200d / 3, row.getValue(FEMALE), 0.000000001);
    }

    @Test
    public void testRowPercentsWithZeroCounts() {
        QuestionTable.Builder builder = QuestionTable.builder("Q1", "Q1", this.rowIndices.getKeys());
        Map<SegmentKey, Double> counts = this.cellCalculator.rowCounts(
                this.table, Collections.singletonList("Q1"), Collections.singleton("Maybe"),
                this.rowIndices, WeightSequence.unit(this.table.getNumRows())
        );
        QuestionRow blank = this.cellCalculator.addRowPercentRow(builder, "Maybe", counts, this.structure, true);
        Assert.assertTrue(Double.isNaN(blank.getValue(MALE)));
        QuestionRow zero = this.cellCalculator.addRowPercentRow(builder, "Maybe (0)", counts, this.structure, false);
        Assert.assertEquals(0d, zero.getValue(MALE), 0);
        Assert.assertEquals(0d, zero.getValue(SegmentKey.TOTAL), 0);
    }

    @Test
    public void testMultiMentionCountsEveryColumn() {
        RespondentTable table = RespondentTable.builder("survey")
                .addTextColumn("Brands_1", "X", "Y", "X")
                .addTextColumn("Brands_2", "X", "X", null)
                .build();
        RowIndexMap rowIndices = new BannerSegmenter().segment(table, BannerStructure.totalOnly());
        Map<SegmentKey, Double> counts = this.cellCalculator.rowCounts(
                table, Arrays.asList("Brands_1", "Brands_2"), Collections.singleton("X"),
                rowIndices, WeightSequence.unit(3)
        );
        Assert.assertEquals(4d, counts.get(SegmentKey.TOTAL), 0);
    }

    @Test
    public void testBannerBases() {
        WeightSequence weights = WeightSequence.of(2, 1, 1, 1, 1);
        Map<SegmentKey, BaseSize> bases = this.baseCalculator.bannerBases(this.rowIndices, weights);
        BaseSize male = bases.get(MALE);
        Assert.assertEquals(2, male.getUnweighted());
        Assert.assertEquals(3d, male.getWeighted(), 0);
        Assert.assertEquals(9d / 5d, male.getEffective(), 0.000000001);
    }
}
