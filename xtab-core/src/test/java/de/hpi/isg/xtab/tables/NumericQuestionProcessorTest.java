package de.hpi.isg.xtab.tables;

import de.hpi.isg.xtab.banner.BannerSegmenter;
import de.hpi.isg.xtab.banner.BannerStructure;
import de.hpi.isg.xtab.config.AnalysisConfiguration;
import de.hpi.isg.xtab.diagnostics.Diagnostic;
import de.hpi.isg.xtab.diagnostics.Diagnostics;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.QuestionTable;
import de.hpi.isg.xtab.model.RespondentTable;
import de.hpi.isg.xtab.model.ResponseOption;
import de.hpi.isg.xtab.model.RowKind;
import de.hpi.isg.xtab.model.SegmentKey;
import de.hpi.isg.xtab.model.VariableType;
import de.hpi.isg.xtab.weighting.WeightSequence;
import org.junit.Assert;
import org.junit.Test;

/**
 * Test suite for the {@link NumericQuestionProcessor} class.
 */
public class NumericQuestionProcessorTest {

    @Test
    public void testStatistics() {
        RespondentTable table = RespondentTable.builder("survey")
                .addNumericColumn("Age", 10d, 20d, 30d, 40d, 200d, null)
                .build();
        QuestionDefinition question = new QuestionDefinition("Age", "Age in years", VariableType.NUMERIC)
                .addOption(new ResponseOption("Young").setBinRange(0, 25).setDisplayOrder(1))
                .addOption(new ResponseOption("Old").setBinRange(26, Double.NaN).setDisplayOrder(2))
                .setValueRange(0, 100);
        AnalysisConfiguration configuration = new AnalysisConfiguration();
        configuration.showNumericMedian = true;
        Diagnostics diagnostics = new Diagnostics();
        BannerStructure structure = BannerStructure.totalOnly();
        TableContext context = new TableContext(table, structure, new BannerSegmenter().segment(table, structure),
                WeightSequence.unit(table.getNumRows()), configuration, diagnostics);

        QuestionTable result = new QuestionDispatcher().process(question, context);

        Assert.assertEquals(5, result.getBase(SegmentKey.TOTAL).getUnweighted());
        Assert.assertEquals(40d, result.findRow("Young", RowKind.COLUMN_PERCENT).getValue(SegmentKey.TOTAL), 0.000000001);
        // The open bin also counts the out-of-range value.
        Assert.assertEquals(60d, result.findRow("Old", RowKind.COLUMN_PERCENT).getValue(SegmentKey.TOTAL), 0.000000001);
        Assert.assertEquals(25d, result.findRow("Mean", RowKind.AVERAGE).getValue(SegmentKey.TOTAL), 0.000000001);
        Assert.assertEquals(25d, result.findRow("Median", RowKind.MEDIAN).getValue(SegmentKey.TOTAL), 0.000000001);
        Assert.assertEquals(Math.sqrt(500d / 3), result.findRow("Standard Deviation", RowKind.STANDARD_DEVIATION)
                .getValue(SegmentKey.TOTAL), 0.000000001);
        Assert.assertEquals(1, diagnostics.getEntries(Diagnostic.Category.QUESTION).size());
    }
}
