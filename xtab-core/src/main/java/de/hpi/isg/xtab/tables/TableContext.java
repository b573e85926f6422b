package de.hpi.isg.xtab.tables;

import de.hpi.isg.xtab.banner.BannerStructure;
import de.hpi.isg.xtab.banner.RowIndexMap;
import de.hpi.isg.xtab.config.AnalysisConfiguration;
import de.hpi.isg.xtab.diagnostics.Diagnostics;
import de.hpi.isg.xtab.model.RespondentTable;
import de.hpi.isg.xtab.significance.SignificanceTester;
import de.hpi.isg.xtab.weighting.WeightSequence;

/**
 * Everything needed to tabulate a question: the (possibly filtered) respondents with their segmentation and
 * weights, plus the run-wide settings.
 */
public class TableContext {

    private final RespondentTable table;

    private final BannerStructure structure;

    private final RowIndexMap rowIndices;

    /**
     * Weights aligned with the {@link #table}.
     */
    private final WeightSequence weights;

    private final AnalysisConfiguration configuration;

    private final Diagnostics diagnostics;

    /**
     * Tests banner columns against each other or {@code null} if significance testing is disabled.
     */
    private final SignificanceTester significanceTester;

    public TableContext(RespondentTable table, BannerStructure structure, RowIndexMap rowIndices,
                        WeightSequence weights, AnalysisConfiguration configuration, Diagnostics diagnostics) {
        this.table = table;
        this.structure = structure;
        this.rowIndices = rowIndices;
        this.weights = weights;
        this.configuration = configuration;
        this.diagnostics = diagnostics;
        this.significanceTester = configuration.enableSignificanceTesting ?
                new SignificanceTester(structure, configuration, weights.isWeighted(), diagnostics) :
                null;
    }

    public RespondentTable getTable() {
        return this.table;
    }

    public BannerStructure getStructure() {
        return this.structure;
    }

    public RowIndexMap getRowIndices() {
        return this.rowIndices;
    }

    public WeightSequence getWeights() {
        return this.weights;
    }

    public AnalysisConfiguration getConfiguration() {
        return this.configuration;
    }

    public Diagnostics getDiagnostics() {
        return this.diagnostics;
    }

    public boolean isSignificanceTesting() {
        return this.significanceTester != null;
    }

    public SignificanceTester getSignificanceTester() {
        return this.significanceTester;
    }
}
