package de.hpi.isg.xtab.cells;

import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.RespondentTable;
import de.hpi.isg.xtab.model.ResponseOption;
import de.hpi.isg.xtab.model.RowKind;
import de.hpi.isg.xtab.model.VariableType;
import de.hpi.isg.xtab.weighting.WeightSequence;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.Assert;
import org.junit.Test;

/**
 * Test suite for the {@link SummaryCalculator} class.
 */
public class SummaryCalculatorTest {

    private final SummaryCalculator calculator = new SummaryCalculator();

    private static IntArrayList allRows(RespondentTable table) {
        IntArrayList rows = new IntArrayList();
        for (int row = 0; row < table.getNumRows(); row++) rows.add(row);
        return rows;
    }

    @Test
    public void testNpsScore() {
        RespondentTable table = RespondentTable.builder("survey").addNumericColumn("NPS", 0d, 0d, 9d, 10d).build();
        SummaryStatistic nps = this.calculator.npsScore(table.getColumn("NPS"), allRows(table), WeightSequence.unit(4));
        Assert.assertEquals(0d, nps.getValue(), 0.000000001);
        Assert.assertEquals(RowKind.SCORE, nps.getKind());
    }

    @Test
    public void testNpsScoreIgnoresNonResponses() {
        RespondentTable table = RespondentTable.builder("survey")
                .addTextColumn("NPS", "10", "DK", "7", null, "3")
                .build();
        SummaryStatistic nps = this.calculator.npsScore(table.getColumn("NPS"), allRows(table), WeightSequence.unit(5));
        // One promoter, one passive, one detractor.
        Assert.assertEquals(0d, nps.getValue(), 0.000000001);

        SummaryStatistic weighted = this.calculator.npsScore(
                table.getColumn("NPS"), allRows(table), WeightSequence.of(3, 1, 1, 1, 1)
        );
        Assert.assertEquals(40d, weighted.getValue(), 0.000000001);
    }

    @Test
    public void testNpsScoreSkipsScoresOutsideScale() {
        RespondentTable table = RespondentTable.builder("survey")
                .addTextColumn("NPS", "99", "-5", "Inf", "3", "DK", "10")
                .build();
        SummaryStatistic nps = this.calculator.npsScore(table.getColumn("NPS"), allRows(table), WeightSequence.unit(6));
        // One detractor, one promoter.
        Assert.assertEquals(0d, nps.getValue(), 0.000000001);
        Assert.assertEquals(2, nps.getSample().getValues().size());
        Assert.assertEquals(3, this.calculator.countInvalidNpsScores(table.getColumn("NPS"), allRows(table)));

        RespondentTable invalidOnly = RespondentTable.builder("survey")
                .addTextColumn("NPS", "99", "-5", "-Inf")
                .build();
        Assert.assertNull(this.calculator.npsScore(
                invalidOnly.getColumn("NPS"), allRows(invalidOnly), WeightSequence.unit(3)
        ));
    }

    @Test
    public void testRatingMeanSkipsExcludedOptions() {
        QuestionDefinition question = new QuestionDefinition("Q1", "Rating", VariableType.RATING)
                .addOptions("1", "2", "3", "4", "5")
                .addOption(new ResponseOption("99").setDisplayText("Don't know").setExcludeFromIndex(true));
        RespondentTable table = RespondentTable.builder("survey").addNumericColumn("Q1", 1d, 5d, 99d, 3d).build();
        SummaryStatistic mean = this.calculator.calculate(question, table.getColumn("Q1"), allRows(table),
                WeightSequence.unit(4));
        Assert.assertEquals(3d, mean.getValue(), 0.000000001);
        Assert.assertEquals(RowKind.AVERAGE, mean.getKind());
        Assert.assertEquals(3, mean.getSample().getValues().size());
    }

    @Test
    public void testLikertIndex() {
        QuestionDefinition question = new QuestionDefinition("Q2", "Agreement", VariableType.LIKERT)
                .addOption(new ResponseOption("Agree").setIndexWeight(100))
                .addOption(new ResponseOption("Neutral").setIndexWeight(50))
                .addOption(new ResponseOption("Disagree").setIndexWeight(0))
                .addOption(new ResponseOption("No answer"));
        RespondentTable table = RespondentTable.builder("survey")
                .addTextColumn("Q2", "Agree", "Neutral", "No answer", "Agree")
                .build();
        SummaryStatistic index = this.calculator.calculate(question, table.getColumn("Q2"), allRows(table),
                WeightSequence.unit(4));
        Assert.assertEquals(250d / 3, index.getValue(), 0.000000001);
        Assert.assertEquals(RowKind.INDEX, index.getKind());
    }

    @Test
    public void testNoSummaryForSingleResponse() {
        QuestionDefinition question = new QuestionDefinition("Q3", "Choice", VariableType.SINGLE_RESPONSE)
                .addOptions("a", "b");
        RespondentTable table = RespondentTable.builder("survey").addTextColumn("Q3", "a").build();
        Assert.assertNull(this.calculator.calculate(question, table.getColumn("Q3"), allRows(table),
                WeightSequence.unit(1)));
    }
}
