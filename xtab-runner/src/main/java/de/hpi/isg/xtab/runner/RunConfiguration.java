package de.hpi.isg.xtab.runner;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import de.hpi.isg.xtab.config.AnalysisConfiguration;
import de.hpi.isg.xtab.error.CrosstabException;
import de.hpi.isg.xtab.error.ErrorCode;

/**
 * Extends the {@link AnalysisConfiguration} with settings that only concern the orchestration of a run.
 */
public class RunConfiguration extends AnalysisConfiguration {

    /**
     * File to save progress to or {@code null} to disable checkpointing.
     */
    @Parameter(names = "--checkpointFile", description = "file to save progress to (disabled if absent)")
    public String checkpointFile = null;

    @Parameter(names = "--checkpointFrequency", description = "number of completed questions between checkpoints")
    public int checkpointFrequency = 10;

    /**
     * Creates a new instance from command-line style arguments.
     *
     * @throws CrosstabException with {@link ErrorCode#INVALID_CONFIGURATION} if the arguments cannot be parsed
     */
    public static RunConfiguration parse(String... args) {
        RunConfiguration configuration = new RunConfiguration();
        try {
            JCommander.newBuilder().addObject(configuration).build().parse(args);
        } catch (ParameterException e) {
            throw new CrosstabException(
                    ErrorCode.INVALID_CONFIGURATION, "Invalid Configuration",
                    "Could not parse the arguments: " + e.getMessage(),
                    "The analysis cannot run with unknown or malformed settings.",
                    e,
                    "Check the names and values of the settings"
            );
        }
        return configuration;
    }

    public boolean isCheckpointing() {
        return this.checkpointFile != null && !this.checkpointFile.trim().isEmpty();
    }

    @Override
    public void validate() {
        super.validate();
        if (this.checkpointFrequency < 1) {
            throw new CrosstabException(
                    ErrorCode.INVALID_CONFIGURATION, "Invalid Configuration",
                    String.format("checkpointFrequency must be at least 1, found %d.", this.checkpointFrequency),
                    "The analysis cannot run with out-of-range settings.",
                    "Correct the listed settings"
            );
        }
    }
}
