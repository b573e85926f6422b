package de.hpi.isg.xtab.banner;

import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.RespondentTable;
import de.hpi.isg.xtab.model.ResponseOption;
import de.hpi.isg.xtab.model.SegmentKey;
import de.hpi.isg.xtab.model.VariableType;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

/**
 * Test suite for the {@link BannerBuilder} and {@link BannerSegmenter} classes.
 */
public class BannerSegmenterTest {

    private final BannerBuilder builder = new BannerBuilder();

    private final BannerSegmenter segmenter = new BannerSegmenter();

    @Test
    public void testTotalOnly() {
        RespondentTable table = RespondentTable.builder("survey").addTextColumn("Q1", "a", "b").build();
        BannerStructure structure = this.builder.build(new BannerSpecification());
        Assert.assertEquals(Arrays.asList(SegmentKey.TOTAL), structure.getKeys());

        RowIndexMap rows = this.segmenter.segment(table, structure);
        Assert.assertEquals(IntArrayList.wrap(new int[]{0, 1}), rows.get(SegmentKey.TOTAL));
    }

    @Test
    public void testOptionSegments() {
        QuestionDefinition gender = new QuestionDefinition("Gender", "Gender", VariableType.SINGLE_RESPONSE)
                .addOptions("Male", "Female");
        RespondentTable table = RespondentTable.builder("survey")
                .addTextColumn("Gender", "Male", "Female", null, "Female")
                .build();

        BannerStructure structure = this.builder.build(new BannerSpecification().add(gender));
        SegmentKey male = SegmentKey.ofOption("Gender", "Male"), female = SegmentKey.ofOption("Gender", "Female");
        Assert.assertEquals(Arrays.asList(SegmentKey.TOTAL, male, female), structure.getKeys());
        Assert.assertEquals("A", structure.getColumn(male).getLetter());
        Assert.assertEquals("B", structure.getColumn(female).getLetter());
        Assert.assertEquals(BannerStructure.TOTAL_LETTER, structure.getTotalColumn().getLetter());

        RowIndexMap rows = this.segmenter.segment(table, structure);
        Assert.assertEquals(4, rows.get(SegmentKey.TOTAL).size());
        Assert.assertEquals(IntArrayList.wrap(new int[]{0}), rows.get(male));
        Assert.assertEquals(IntArrayList.wrap(new int[]{1, 3}), rows.get(female));
    }

    @Test
    public void testBoxCategorySegmentsAreUnions() {
        QuestionDefinition age = new QuestionDefinition("Age", "Age group", VariableType.SINGLE_RESPONSE)
                .addOption(new ResponseOption("18-29").setBoxCategory("Young").setDisplayOrder(1))
                .addOption(new ResponseOption("30-39").setBoxCategory("Young").setDisplayOrder(2))
                .addOption(new ResponseOption("40+").setBoxCategory("Old").setDisplayOrder(3));
        RespondentTable table = RespondentTable.builder("survey")
                .addTextColumn("Age", "18-29", "40+", "30-39", "40+", "18-29")
                .build();

        BannerStructure structure = this.builder.build(new BannerSpecification().add(age, true, "Age", null));
        SegmentKey young = SegmentKey.ofBoxCategory("Age", "Young"), old = SegmentKey.ofBoxCategory("Age", "Old");
        Assert.assertEquals(Arrays.asList(SegmentKey.TOTAL, young, old), structure.getKeys());

        RowIndexMap rows = this.segmenter.segment(table, structure);
        Assert.assertEquals(IntArrayList.wrap(new int[]{0, 2, 4}), rows.get(young));
        Assert.assertEquals(IntArrayList.wrap(new int[]{1, 3}), rows.get(old));
    }

    @Test
    public void testMultiMentionSegmentsUseAnyColumn() {
        QuestionDefinition brands = new QuestionDefinition("Brands", "Brands used", VariableType.MULTI_MENTION)
                .addOptions("X", "Y")
                .setNumColumns(2);
        RespondentTable table = RespondentTable.builder("survey")
                .addTextColumn("Brands_1", "X", "Y", null, "X")
                .addTextColumn("Brands_2", "Y", null, "X", null)
                .build();

        BannerStructure structure = this.builder.build(new BannerSpecification().add(brands));
        RowIndexMap rows = this.segmenter.segment(table, structure);
        Assert.assertEquals(IntArrayList.wrap(new int[]{0, 2, 3}), rows.get(SegmentKey.ofOption("Brands", "X")));
        Assert.assertEquals(IntArrayList.wrap(new int[]{0, 1}), rows.get(SegmentKey.ofOption("Brands", "Y")));
    }

    @Test
    public void testGroupsFollowDisplayOrder() {
        QuestionDefinition gender = new QuestionDefinition("Gender", "Gender", VariableType.SINGLE_RESPONSE)
                .addOptions("Male", "Female");
        QuestionDefinition region = new QuestionDefinition("Region", "Region", VariableType.SINGLE_RESPONSE)
                .addOptions("North", "South");
        BannerStructure structure = this.builder.build(new BannerSpecification()
                .add(gender, false, null, 2)
                .add(region, false, null, 1));
        Assert.assertEquals("Region", structure.getGroups().get(0).getQuestionCode());
        Assert.assertEquals("Gender", structure.getGroups().get(1).getQuestionCode());
        // Letters restart in every group.
        Assert.assertEquals("A", structure.getColumn(SegmentKey.ofOption("Gender", "Male")).getLetter());
    }

    @Test
    public void testMissingBannerColumn() {
        QuestionDefinition gender = new QuestionDefinition("Gender", "Gender", VariableType.SINGLE_RESPONSE)
                .addOptions("Male", "Female");
        RespondentTable table = RespondentTable.builder("survey").addTextColumn("Q1", "a").build();
        BannerStructure structure = this.builder.build(new BannerSpecification().add(gender));
        try {
            this.segmenter.segment(table, structure);
            Assert.fail("A missing banner column should be rejected.");
        } catch (CrosstabException e) {
            Assert.assertEquals(ErrorCode.BANNER_COLUMN_NOT_FOUND, e.getCode());
        }
    }

    @Test
    public void testBoxCategoryBannerWithoutCategories() {
        QuestionDefinition gender = new QuestionDefinition("Gender", "Gender", VariableType.SINGLE_RESPONSE)
                .addOptions("Male", "Female");
        try {
            this.builder.build(new BannerSpecification().add(gender, true, null, null));
            Assert.fail("A box category banner needs box categories.");
        } catch (CrosstabException e) {
            Assert.assertEquals(ErrorCode.BANNER_NO_BOX_CATEGORY, e.getCode());
        }
    }
}
