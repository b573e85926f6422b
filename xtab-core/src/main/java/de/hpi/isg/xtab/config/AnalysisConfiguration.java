package de.hpi.isg.xtab.config;

import com.beust.jcommander.Parameter;
import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;
import de.hpi.isg.xtab.weighting.WeightRepairPolicy;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Describes how questions are tabulated.
 */
public class AnalysisConfiguration implements Serializable {

    ////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
    // Weighting settings.
    ////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

    /**
     * Name of the weight column or {@code null} to use unit weights.
     */
    @Parameter(names = "--weightVariable", description = "column with the design weights (unweighted if absent)")
    public String weightVariable = null;

    @Parameter(names = "--weightRepair", description = "how to handle invalid weights (exclude, coerce_to_one, error)")
    public WeightRepairPolicy weightRepair = WeightRepairPolicy.EXCLUDE;

    ////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
    // Significance settings.
    ////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

    @Parameter(names = "--enableSignificanceTesting", description = "whether to test banner columns pairwise", arity = 1)
    public boolean enableSignificanceTesting = true;

    @Parameter(names = "--alpha", description = "nominal significance level")
    public double alpha = 0.05;

    /**
     * Whether to divide {@link #alpha} by the number of pairwise comparisons within a banner group.
     */
    @Parameter(names = "--bonferroniCorrection", description = "whether to apply the Bonferroni correction", arity = 1)
    public boolean bonferroniCorrection = true;

    /**
     * Pairwise tests are skipped when either segment has a smaller (effective) base.
     */
    @Parameter(names = "--significanceMinBase", description = "minimum base for significance tests")
    public int significanceMinBase = 30;

    @Parameter(names = "--enableChiSquare", description = "whether to test box categories with chi-square", arity = 1)
    public boolean enableChiSquare = false;

    ////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
    // Row settings.
    ////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

    @Parameter(names = "--showFrequency", description = "whether to output frequency rows", arity = 1)
    public boolean showFrequency = false;

    @Parameter(names = "--showColumnPercent", description = "whether to output column % rows", arity = 1)
    public boolean showColumnPercent = true;

    @Parameter(names = "--showRowPercent", description = "whether to output row % rows", arity = 1)
    public boolean showRowPercent = false;

    /**
     * Whether a row % of the Total column over a zero row total is left blank rather than reported as 0.
     */
    @Parameter(names = "--zeroDivisionAsBlank", description = "whether to leave divisions by zero blank", arity = 1)
    public boolean zeroDivisionAsBlank = true;

    @Parameter(names = "--boxCategoryFrequency", description = "whether to output box category frequencies", arity = 1)
    public boolean boxCategoryFrequency = false;

    @Parameter(names = "--boxCategoryColumnPercent", description = "whether to output box category column %", arity = 1)
    public boolean boxCategoryColumnPercent = true;

    @Parameter(names = "--boxCategoryRowPercent", description = "whether to output box category row %", arity = 1)
    public boolean boxCategoryRowPercent = false;

    @Parameter(names = "--showStandardDeviation", description = "whether to output standard deviations", arity = 1)
    public boolean showStandardDeviation = false;

    /**
     * Whether to output the difference between the last and the first box category of a question.
     */
    @Parameter(names = "--showNetPositive", description = "whether to output net positive rows", arity = 1)
    public boolean showNetPositive = false;

    @Parameter(names = "--showNumericMedian", description = "whether to output medians of numeric questions", arity = 1)
    public boolean showNumericMedian = false;

    ////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
    // Ranking settings.
    ////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

    @Parameter(names = "--rankingTopN", description = "number of top ranks to aggregate")
    public int rankingTopN = 3;

    @Parameter(names = "--rankingShowTopN", description = "whether to output % top N rows", arity = 1)
    public boolean rankingShowTopN = true;

    @Parameter(names = "--rankingTieThreshold", description = "maximum % of respondents with tied ranks")
    public double rankingTieThresholdPct = 5;

    @Parameter(names = "--rankingGapThreshold", description = "maximum % of respondents with gaps in their ranks")
    public double rankingGapThresholdPct = 5;

    @Parameter(names = "--rankingCompletenessThreshold", description = "minimum % of complete rankings")
    public double rankingCompletenessThresholdPct = 80;

    /**
     * Whether a breached ranking quality threshold fails the question instead of producing a warning.
     */
    @Parameter(names = "--rankingStrictValidation", description = "whether ranking quality issues are fatal", arity = 1)
    public boolean rankingStrictValidation = false;

    /**
     * @return whether the weighting is switched on
     */
    public boolean isWeighted() {
        return this.weightVariable != null && !this.weightVariable.trim().isEmpty();
    }

    /**
     * Checks the ranges of the settings.
     *
     * @throws CrosstabException if any setting is out of range
     */
    public void validate() {
        List<String> problems = new ArrayList<>();
        if (!(this.alpha > 0 && this.alpha < 1)) problems.add(String.format("alpha must be in (0, 1), found %s", this.alpha));
        if (this.significanceMinBase < 1) problems.add("significanceMinBase must be at least 1");
        if (this.weightRepair == null) problems.add("weightRepair must be set");
        if (this.rankingTopN < 1) problems.add("rankingTopN must be at least 1");
        checkPercentage(problems, "rankingTieThreshold", this.rankingTieThresholdPct);
        checkPercentage(problems, "rankingGapThreshold", this.rankingGapThresholdPct);
        checkPercentage(problems, "rankingCompletenessThreshold", this.rankingCompletenessThresholdPct);
        if (!problems.isEmpty()) {
            throw new CrosstabException(
                    ErrorCode.INVALID_CONFIGURATION, "Invalid Configuration",
                    String.join("; ", problems) + ".",
                    "The analysis cannot run with out-of-range settings.",
                    "Correct the listed settings"
            );
        }
    }

    private static void checkPercentage(List<String> problems, String name, double value) {
        if (!(value >= 0 && value <= 100)) {
            problems.add(String.format("%s must be in [0, 100], found %s", name, value));
        }
    }
}
