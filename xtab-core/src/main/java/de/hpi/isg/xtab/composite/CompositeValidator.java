package de.hpi.isg.xtab.composite;

import com.google.common.base.Joiner;
import de.hpi.isg.xtab.diagnostics.Diagnostic;
import de.hpi.isg.xtab.diagnostics.Diagnostics;
import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.RespondentTable;
import de.hpi.isg.xtab.model.VariableType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks {@link CompositeDefinition}s against the declared questions and the data before any composite is
 * calculated. All violations are collected and reported at once.
 */
public class CompositeValidator {

    /**
     * The question types composites may be built from.
     */
    public static final Set<VariableType> SOURCE_TYPES =
            EnumSet.of(VariableType.RATING, VariableType.LIKERT, VariableType.NUMERIC);

    private final Diagnostics diagnostics;

    public CompositeValidator(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Validates the composites.
     *
     * @param composites the composites
     * @param questions  the declared questions by their codes
     * @param table      the respondents
     * @throws CrosstabException with {@link ErrorCode#INVALID_COMPOSITE} listing all violations if there are any
     */
    public void validate(Collection<CompositeDefinition> composites, Map<String, QuestionDefinition> questions,
                         RespondentTable table) {
        List<String> errors = new ArrayList<>();

        Set<String> seenCodes = new HashSet<>(), duplicateCodes = new LinkedHashSet<>();
        for (CompositeDefinition composite : composites) {
            if (!seenCodes.add(composite.getCode())) duplicateCodes.add(composite.getCode());
        }
        if (!duplicateCodes.isEmpty()) {
            errors.add("Duplicate composite code(s): " + Joiner.on(", ").join(duplicateCodes));
        }
        Set<String> conflictingCodes = new LinkedHashSet<>(seenCodes);
        conflictingCodes.retainAll(questions.keySet());
        if (!conflictingCodes.isEmpty()) {
            errors.add("Composite code(s) conflict with existing question code(s): " + Joiner.on(", ").join(conflictingCodes));
        }

        for (CompositeDefinition composite : composites) {
            this.validate(composite, questions, table, errors);
        }

        if (!errors.isEmpty()) {
            throw new CrosstabException(
                    ErrorCode.INVALID_COMPOSITE, "Invalid Composite Definitions",
                    Joiner.on("; ").join(errors),
                    "Composites built from mismatching or missing sources would report wrong scores.",
                    "Fix the composite definitions listed above"
            );
        }
    }

    private void validate(CompositeDefinition composite, Map<String, QuestionDefinition> questions,
                          RespondentTable table, List<String> errors) {
        String code = composite.getCode();
        List<String> sources = composite.getSourceQuestions();
        if (sources.isEmpty()) {
            errors.add(String.format("Composite '%s' has no source questions", code));
            return;
        }

        Set<VariableType> types = new LinkedHashSet<>();
        List<String> missingQuestions = new ArrayList<>(), missingColumns = new ArrayList<>();
        for (String source : sources) {
            QuestionDefinition question = questions.get(source);
            if (question == null) {
                missingQuestions.add(source);
                continue;
            }
            types.add(question.getType());
            if (!table.hasColumn(source)) missingColumns.add(source);
        }
        if (!missingQuestions.isEmpty()) {
            errors.add(String.format("Composite '%s' references non-existent question(s): %s",
                    code, Joiner.on(", ").join(missingQuestions)));
        }
        if (!missingColumns.isEmpty()) {
            errors.add(String.format("Composite '%s': question(s) not found in data: %s",
                    code, Joiner.on(", ").join(missingColumns)));
        }
        if (types.size() > 1) {
            errors.add(String.format("Composite '%s' mixes question types: %s. All sources must be of the same type " +
                    "(Rating, Likert, or Numeric)", code, types));
        }
        Set<VariableType> invalidTypes = new LinkedHashSet<>(types);
        invalidTypes.removeAll(SOURCE_TYPES);
        if (!invalidTypes.isEmpty()) {
            errors.add(String.format("Composite '%s' includes invalid question type(s): %s. Only Rating, Likert, " +
                    "and Numeric are supported", code, invalidTypes));
        }

        if (composite.getCalculationType() == CalculationType.WEIGHTED_MEAN) {
            if (composite.getWeights().isEmpty()) {
                errors.add(String.format("Composite '%s' uses WeightedMean but has no weights", code));
            } else {
                if (composite.getWeights().size() != sources.size()) {
                    errors.add(String.format("Composite '%s' has %d source questions but %d weights",
                            code, sources.size(), composite.getWeights().size()));
                }
                for (int i = 0; i < composite.getWeights().size(); i++) {
                    if (!(composite.getWeights().getDouble(i) > 0)) {
                        errors.add(String.format("Composite '%s' has non-positive weights. All weights must be > 0", code));
                        break;
                    }
                }
            }
        }

        if (sources.size() == 1) {
            this.diagnostics.warn(Diagnostic.Category.COMPOSITE,
                    "Composite '%s' has only one source question. Consider using the source question directly.", code);
        }
    }
}
