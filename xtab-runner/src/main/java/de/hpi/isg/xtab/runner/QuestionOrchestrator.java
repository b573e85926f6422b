package de.hpi.isg.xtab.runner;

import de.hpi.isg.xtab.banner.BannerBuilder;
import de.hpi.isg.xtab.banner.BannerSegmenter;
import de.hpi.isg.xtab.banner.BannerSpecification;
import de.hpi.isg.xtab.banner.BannerStructure;
import de.hpi.isg.xtab.banner.RowIndexMap;
import de.hpi.isg.xtab.composite.CompositeDefinition;
import de.hpi.isg.xtab.composite.CompositeProcessor;
import de.hpi.isg.xtab.composite.CompositeValidator;
import de.hpi.isg.xtab.diagnostics.Diagnostics;
import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.filter.BaseFilter;
import de.hpi.isg.xtab.model.QuestionDefinition;
import de.hpi.isg.xtab.model.QuestionTable;
import de.hpi.isg.xtab.model.RespondentTable;
import de.hpi.isg.xtab.tables.QuestionDispatcher;
import de.hpi.isg.xtab.tables.TableContext;
import de.hpi.isg.xtab.weighting.WeightSequence;
import de.hpi.isg.xtab.weighting.WeightingEngine;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tabulates all questions and composites of a survey one after another. The weights and the banner are prepared
 * once per run; a question that fails is recorded as {@link SkippedQuestion} and the run moves on. Progress is
 * saved to a checkpoint every {@link RunConfiguration#checkpointFrequency} questions, so that an interrupted run
 * can resume with the remaining questions.
 */
public class QuestionOrchestrator {

    private final Logger logger = LoggerFactory.getLogger(this.getClass());

    private final RunConfiguration configuration;

    private final QuestionDispatcher dispatcher = new QuestionDispatcher();

    private final BannerBuilder bannerBuilder = new BannerBuilder();

    private final BannerSegmenter segmenter = new BannerSegmenter();

    private final CompositeProcessor compositeProcessor = new CompositeProcessor();

    public QuestionOrchestrator(RunConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * Runs the analysis.
     *
     * @param data       the respondents
     * @param questions  the questions to tabulate in output order
     * @param banner     the banner questions
     * @param composites the composites to tabulate after the questions
     * @return the {@link RunReport}
     * @throws CrosstabException if the run cannot start, e.g., due to invalid weights, banner or composites
     * @throws IOException       if the checkpoint cannot be written
     */
    public RunReport run(RespondentTable data, List<QuestionDefinition> questions, BannerSpecification banner,
                         List<CompositeDefinition> composites) throws IOException {
        Validate.notNull(data);
        Validate.notNull(questions);
        if (composites == null) composites = Collections.emptyList();
        this.configuration.validate();

        // Failures during the preparation concern every question and abort the run.
        Diagnostics diagnostics = new Diagnostics();
        WeightSequence weights = new WeightingEngine(diagnostics)
                .prepare(data, this.configuration.weightVariable, this.configuration.weightRepair);
        BannerStructure structure = this.bannerBuilder.build(banner == null ? new BannerSpecification() : banner);
        RowIndexMap rowIndices = this.segmenter.segment(data, structure);
        Map<String, QuestionDefinition> questionsByCode = new LinkedHashMap<>();
        for (QuestionDefinition question : questions) {
            questionsByCode.put(question.getCode(), question);
        }
        if (!composites.isEmpty()) {
            new CompositeValidator(diagnostics).validate(composites, questionsByCode, data);
        }

        CheckpointStore checkpointStore = this.configuration.isCheckpointing() ?
                new CheckpointStore(new File(this.configuration.checkpointFile)) :
                null;
        Checkpoint checkpoint = checkpointStore == null ? null : this.loadCheckpoint(checkpointStore);
        if (checkpoint == null) {
            checkpoint = new Checkpoint();
        } else {
            this.logger.info("Resuming from checkpoint with {} processed questions.", checkpoint.size());
        }
        int numResumedQuestions = checkpoint.size();

        List<SkippedQuestion> skippedQuestions = new ArrayList<>();
        int numQuestions = questions.size() + composites.size(), questionIndex = 0, numUnsavedQuestions = 0;
        for (QuestionDefinition question : questions) {
            questionIndex++;
            if (checkpoint.isProcessed(question.getCode())) {
                this.logger.debug("Skipping {}, which has already been processed.", question.getCode());
                continue;
            }
            this.logger.info("Processing question {}/{}: {}", questionIndex, numQuestions, question.getCode());
            diagnostics.setCurrentQuestion(question.getCode());
            QuestionTable table = this.processQuestion(question, data, weights, structure, diagnostics, skippedQuestions);
            diagnostics.setCurrentQuestion(null);
            if (table == null) continue;

            checkpoint.add(question.getCode(), table);
            if (checkpointStore != null && ++numUnsavedQuestions >= this.configuration.checkpointFrequency) {
                checkpointStore.save(checkpoint);
                numUnsavedQuestions = 0;
            }
        }

        for (CompositeDefinition composite : composites) {
            questionIndex++;
            if (checkpoint.isProcessed(composite.getCode())) continue;
            this.logger.info("Processing composite {}/{}: {}", questionIndex, numQuestions, composite.getCode());
            diagnostics.setCurrentQuestion(composite.getCode());
            try {
                TableContext context = new TableContext(data, structure, rowIndices, weights,
                        this.configuration, diagnostics);
                checkpoint.add(composite.getCode(), this.compositeProcessor.process(composite, questionsByCode, context));
            } catch (RuntimeException e) {
                this.skip(SkippedQuestion.of(composite.getCode(), SkippedQuestion.Stage.COMPOSITE, e), e, skippedQuestions);
            }
            diagnostics.setCurrentQuestion(null);
        }

        if (checkpointStore != null) checkpointStore.delete();

        RunReport report = new RunReport(
                this.collectTables(checkpoint, questions, composites),
                skippedQuestions,
                diagnostics.getEntries(),
                weights.isWeighted() ? WeightingEngine.summarize(weights.toArray()) : null,
                numResumedQuestions
        );
        if (report.getStatus() == RunReport.Status.PARTIAL) {
            this.logger.warn("Run completed with PARTIAL status: {} question(s) skipped, {} test(s) or section(s) omitted.",
                    report.getSkippedQuestions().size(), report.getOmissions().size());
        } else {
            this.logger.info("Run completed: {} tables.", report.getTables().size());
        }
        return report;
    }

    /**
     * Loads the saved progress of an interrupted run. An unreadable checkpoint is ignored and the run starts over.
     */
    private Checkpoint loadCheckpoint(CheckpointStore checkpointStore) {
        try {
            return checkpointStore.load();
        } catch (IOException e) {
            this.logger.warn("Checkpoint {} exists but could not be loaded. Starting fresh instead.",
                    checkpointStore.getFile(), e);
            return null;
        }
    }

    /**
     * Tabulates a single question on the respondents passing its base filter.
     *
     * @return the {@link QuestionTable} or {@code null} if the question was skipped
     */
    private QuestionTable processQuestion(QuestionDefinition question, RespondentTable data, WeightSequence weights,
                                          BannerStructure structure, Diagnostics diagnostics,
                                          List<SkippedQuestion> skippedQuestions) {
        SkippedQuestion.Stage stage = SkippedQuestion.Stage.FILTER;
        try {
            RespondentTable filteredData = BaseFilter.parse(question.getBaseFilter()).apply(data, diagnostics);

            stage = SkippedQuestion.Stage.SEGMENTATION;
            WeightSequence filteredWeights = weights.alignWith(filteredData);
            RowIndexMap rowIndices = this.segmenter.segment(filteredData, structure);

            stage = SkippedQuestion.Stage.TABULATION;
            TableContext context = new TableContext(filteredData, structure, rowIndices, filteredWeights,
                    this.configuration, diagnostics);
            return this.dispatcher.process(question, context);
        } catch (RuntimeException e) {
            this.skip(SkippedQuestion.of(question.getCode(), stage, e), e, skippedQuestions);
            return null;
        }
    }

    private void skip(SkippedQuestion skippedQuestion, RuntimeException cause, List<SkippedQuestion> skippedQuestions) {
        if (cause instanceof CrosstabException) {
            this.logger.warn("Skipping {}.", skippedQuestion);
        } else {
            this.logger.error("Skipping {}.", skippedQuestion, cause);
        }
        skippedQuestions.add(skippedQuestion);
    }

    /**
     * Orders the completed tables like the questions and composites, including tables restored from a checkpoint.
     */
    private List<QuestionTable> collectTables(Checkpoint checkpoint, List<QuestionDefinition> questions,
                                              List<CompositeDefinition> composites) {
        Map<String, QuestionTable> tablesByCode = new HashMap<>();
        for (int i = 0; i < checkpoint.size(); i++) {
            tablesByCode.put(checkpoint.getProcessedCodes().get(i), checkpoint.getTables().get(i));
        }
        List<String> codes = new ArrayList<>();
        for (QuestionDefinition question : questions) codes.add(question.getCode());
        for (CompositeDefinition composite : composites) codes.add(composite.getCode());
        List<QuestionTable> tables = new ArrayList<>();
        for (String code : codes) {
            QuestionTable table = tablesByCode.remove(code);
            if (table != null) tables.add(table);
        }
        return tables;
    }
}
