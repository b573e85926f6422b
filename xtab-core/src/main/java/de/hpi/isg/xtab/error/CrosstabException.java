package de.hpi.isg.xtab.error;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Signals a problem that must not be downgraded to a warning because continuing would produce wrong numbers.
 * Besides the {@link ErrorCode}, it describes the problem, its impact and how to remedy it.
 */
public class CrosstabException extends RuntimeException {

    private final ErrorCode code;

    private final String title, problem, whyItMatters;

    private final List<String> howToFix;

    public CrosstabException(ErrorCode code, String title, String problem, String whyItMatters, String... howToFix) {
        this(code, title, problem, whyItMatters, null, howToFix);
    }

    public CrosstabException(ErrorCode code, String title, String problem, String whyItMatters,
                             Throwable cause, String... howToFix) {
        super(String.format("[%s] %s: %s", code, title, problem), cause);
        this.code = code;
        this.title = title;
        this.problem = problem;
        this.whyItMatters = whyItMatters;
        this.howToFix = new ArrayList<>(Arrays.asList(howToFix));
    }

    /**
     * Shortcut for violated internal preconditions, i.e., programming errors.
     */
    public static CrosstabException invalidArgument(String problem) {
        return new CrosstabException(
                ErrorCode.INVALID_ARGUMENT, "Invalid Argument", problem,
                "Calculations cannot proceed with inconsistent inputs.",
                "This is an internal error - check the function call"
        );
    }

    public ErrorCode getCode() {
        return this.code;
    }

    public String getTitle() {
        return this.title;
    }

    public String getProblem() {
        return this.problem;
    }

    public String getWhyItMatters() {
        return this.whyItMatters;
    }

    public List<String> getHowToFix() {
        return Collections.unmodifiableList(this.howToFix);
    }

    /**
     * Renders all details of this instance in a multi-line, human-readable form.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(this.title).append(" (").append(this.code).append(")\n");
        sb.append("Problem: ").append(this.problem).append('\n');
        sb.append("Why it matters: ").append(this.whyItMatters).append('\n');
        if (!this.howToFix.isEmpty()) {
            sb.append("How to fix:\n");
            for (String step : this.howToFix) {
                sb.append("  - ").append(step).append('\n');
            }
        }
        return sb.toString();
    }
}
