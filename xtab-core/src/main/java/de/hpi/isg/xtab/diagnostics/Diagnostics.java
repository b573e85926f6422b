package de.hpi.isg.xtab.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects {@link Diagnostic}s and logs them as they come in. Instances are threaded explicitly through the
 * processing steps rather than held globally.
 */
public class Diagnostics {

    private final Logger logger = LoggerFactory.getLogger(this.getClass());

    private final List<Diagnostic> entries = new ArrayList<>();

    /**
     * The question code that is attached to newly reported entries, if any.
     */
    private String currentQuestion;

    public void setCurrentQuestion(String questionCode) {
        this.currentQuestion = questionCode;
    }

    public String getCurrentQuestion() {
        return this.currentQuestion;
    }

    public void info(Diagnostic.Category category, String format, Object... args) {
        this.report(Diagnostic.Severity.INFO, category, String.format(format, args));
    }

    public void warn(Diagnostic.Category category, String format, Object... args) {
        this.report(Diagnostic.Severity.WARNING, category, String.format(format, args));
    }

    public void error(Diagnostic.Category category, String format, Object... args) {
        this.report(Diagnostic.Severity.ERROR, category, String.format(format, args));
    }

    public void report(Diagnostic.Severity severity, Diagnostic.Category category, String message) {
        Diagnostic diagnostic = new Diagnostic(severity, category, this.currentQuestion, message);
        this.entries.add(diagnostic);
        switch (severity) {
            case INFO:
                this.logger.info("{}", diagnostic);
                break;
            case WARNING:
                this.logger.warn("{}", diagnostic);
                break;
            default:
                this.logger.error("{}", diagnostic);
        }
    }

    public List<Diagnostic> getEntries() {
        return Collections.unmodifiableList(this.entries);
    }

    public List<Diagnostic> getEntries(Diagnostic.Category category) {
        return this.entries.stream().filter(d -> d.getCategory() == category).collect(Collectors.toList());
    }

    public boolean hasWarnings() {
        return this.entries.stream().anyMatch(d -> d.getSeverity() != Diagnostic.Severity.INFO);
    }

    public int size() {
        return this.entries.size();
    }
}
