package de.hpi.isg.xtab.composite;

import de.hpi.isg.xtab.diagnostics.Diagnostic;
import de.hpi.isg.xtab.diagnostics.Diagnostics;
import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.RespondentTable;
import de.hpi.isg.xtab.model.VariableType;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Test suite for the {@link CompositeValidator} class.
 */
public class CompositeValidatorTest {

    private Map<String, QuestionDefinition> questions;

    private RespondentTable table;

    private Diagnostics diagnostics;

    private CompositeValidator validator;

    @Before
    public void setUp() {
        this.questions = new LinkedHashMap<>();
        this.questions.put("Q1", new QuestionDefinition("Q1", "Q1", VariableType.RATING).addOptions("1", "2", "3"));
        this.questions.put("Q2", new QuestionDefinition("Q2", "Q2", VariableType.RATING).addOptions("1", "2", "3"));
        this.questions.put("Q3", new QuestionDefinition("Q3", "Q3", VariableType.LIKERT).addOptions("Yes", "No"));
        this.questions.put("Q4", new QuestionDefinition("Q4", "Q4", VariableType.SINGLE_RESPONSE).addOptions("a"));
        this.questions.put("Q5", new QuestionDefinition("Q5", "Q5", VariableType.RATING).addOptions("1", "2", "3"));
        this.table = RespondentTable.builder("survey")
                .addNumericColumn("Q1", 1d)
                .addNumericColumn("Q2", 2d)
                .addTextColumn("Q3", "Yes")
                .addTextColumn("Q4", "a")
                .build();
        this.diagnostics = new Diagnostics();
        this.validator = new CompositeValidator(this.diagnostics);
    }

    private String validateAndGetProblem(CompositeDefinition... composites) {
        try {
            this.validator.validate(Arrays.asList(composites), this.questions, this.table);
            Assert.fail("The composites should be rejected.");
            return null;
        } catch (CrosstabException e) {
            Assert.assertEquals(ErrorCode.INVALID_COMPOSITE, e.getCode());
            return e.getMessage();
        }
    }

    @Test
    public void testValidComposite() {
        this.validator.validate(Collections.singletonList(
                CompositeDefinition.parse("C1", "Overall", "WeightedMean", "Q1, Q2", "1, 3")
        ), this.questions, this.table);
        Assert.assertEquals(0, this.diagnostics.size());
    }

    @Test
    public void testSingleSourceIsWarned() {
        this.validator.validate(Collections.singletonList(
                CompositeDefinition.parse("C1", "Overall", "Mean", "Q1", null)
        ), this.questions, this.table);
        Assert.assertEquals(1, this.diagnostics.getEntries(Diagnostic.Category.COMPOSITE).size());
    }

    @Test
    public void testCodes() {
        String problem = this.validateAndGetProblem(
                CompositeDefinition.parse("C1", null, "Mean", "Q1, Q2", null),
                CompositeDefinition.parse("C1", null, "Mean", "Q1, Q2", null),
                CompositeDefinition.parse("Q2", null, "Mean", "Q1, Q2", null)
        );
        Assert.assertTrue(problem, problem.contains("Duplicate composite code(s): C1"));
        Assert.assertTrue(problem, problem.contains("conflict with existing question code(s): Q2"));
    }

    @Test
    public void testSources() {
        String problem = this.validateAndGetProblem(
                CompositeDefinition.parse("C1", null, "Mean", "Q1, Q9", null),
                CompositeDefinition.parse("C2", null, "Mean", "Q1, Q5", null),
                CompositeDefinition.parse("C3", null, "Mean", "Q1, Q3", null),
                CompositeDefinition.parse("C4", null, "Mean", "Q4, Q4", null),
                CompositeDefinition.parse("C5", null, "Mean", "", null)
        );
        Assert.assertTrue(problem, problem.contains("Composite 'C1' references non-existent question(s): Q9"));
        Assert.assertTrue(problem, problem.contains("Composite 'C2': question(s) not found in data: Q5"));
        Assert.assertTrue(problem, problem.contains("Composite 'C3' mixes question types"));
        Assert.assertTrue(problem, problem.contains("Composite 'C4' includes invalid question type(s)"));
        Assert.assertTrue(problem, problem.contains("Composite 'C5' has no source questions"));
    }

    @Test
    public void testWeights() {
        String problem = this.validateAndGetProblem(
                CompositeDefinition.parse("C1", null, "WeightedMean", "Q1, Q2", null),
                CompositeDefinition.parse("C2", null, "WeightedMean", "Q1, Q2", "1"),
                CompositeDefinition.parse("C3", null, "WeightedMean", "Q1, Q2", "1, 0")
        );
        Assert.assertTrue(problem, problem.contains("Composite 'C1' uses WeightedMean but has no weights"));
        Assert.assertTrue(problem, problem.contains("Composite 'C2' has 2 source questions but 1 weights"));
        Assert.assertTrue(problem, problem.contains("Composite 'C3' has non-positive weights"));
    }
}
