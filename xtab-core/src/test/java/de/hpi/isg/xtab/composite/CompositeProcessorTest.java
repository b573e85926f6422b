package de.hpi.isg.xtab.composite;

import de.hpi.isg.xtab.banner.BannerBuilder;
import de.hpi.isg.xtab.banner.BannerSegmenter;
import de.hpi.isg.xtab.banner.BannerSpecification;
import de.hpi.isg.xtab.banner.BannerStructure;
import de.hpi.isg.xtab.config.AnalysisConfiguration;
import de.hpi.isg.xtab.diagnostics.Diagnostics;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.QuestionRow;
import de.hpi.isg.xtab.model.QuestionTable;
import de.hpi.isg.xtab.model.RespondentTable;
import de.hpi.isg.xtab.model.ResponseOption;
import de.hpi.isg.xtab.model.RowKind;
import de.hpi.isg.xtab.model.SegmentKey;
import de.hpi.isg.xtab.model.VariableType;
import de.hpi.isg.xtab.tables.TableContext;
import de.hpi.isg.xtab.weighting.WeightSequence;
import org.junit.Assert;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

/**
 * Test suite for the {@link CompositeProcessor} class.
 */
public class CompositeProcessorTest {

    @Test
    public void testCompositeTable() {
        Map<String, QuestionDefinition> questions = new HashMap<>();
        questions.put("Q1", new QuestionDefinition("Q1", "Q1", VariableType.LIKERT)
                .addOption(new ResponseOption("Agree").setOptionValue(100))
                .addOption(new ResponseOption("Disagree").setOptionValue(0)));
        questions.put("Q2", new QuestionDefinition("Q2", "Q2", VariableType.LIKERT)
                .addOption(new ResponseOption("Agree").setOptionValue(100))
                .addOption(new ResponseOption("Disagree").setOptionValue(0)));
        QuestionDefinition gender = new QuestionDefinition("Gender", "Gender", VariableType.SINGLE_RESPONSE)
                .addOptions("Male", "Female");
        RespondentTable table = RespondentTable.builder("survey")
                .addTextColumn("Gender", "Male", "Male", "Female", "Female")
                .addTextColumn("Q1", "Agree", "Agree", "Disagree", null)
                .addTextColumn("Q2", "Agree", "Disagree", "Disagree", null)
                .build();
        BannerStructure structure = new BannerBuilder().build(new BannerSpecification().add(gender));
        TableContext context = new TableContext(table, structure, new BannerSegmenter().segment(table, structure),
                WeightSequence.unit(4), new AnalysisConfiguration(), new Diagnostics());

        CompositeDefinition composite = CompositeDefinition.parse("C1", "Agreement", "Mean", "Q1, Q2", null);
        QuestionTable result = new CompositeProcessor().process(composite, questions, context);

        Assert.assertEquals("C1", result.getQuestionCode());
        Assert.assertEquals(3, result.getBase(SegmentKey.TOTAL).getUnweighted());
        Assert.assertEquals(1, result.getBase(SegmentKey.ofOption("Gender", "Female")).getUnweighted());

        QuestionRow row = result.findRow("Agreement", RowKind.INDEX);
        Assert.assertEquals(50d, row.getValue(SegmentKey.TOTAL), 0.000000001);
        Assert.assertEquals(75d, row.getValue(SegmentKey.ofOption("Gender", "Male")), 0.000000001);
        Assert.assertEquals(0d, row.getValue(SegmentKey.ofOption("Gender", "Female")), 0.000000001);

        // The bases are far too small for significance tests.
        QuestionRow letters = result.findRow("Agreement", RowKind.SIGNIFICANCE);
        Assert.assertEquals("", letters.getText(SegmentKey.ofOption("Gender", "Male")));
    }
}
