package flowrun.engine.core;

import flowrun.engine.model.TaskOutcome;

/**
 * A job was aborted because one of its tasks failed.
 */
public class JobFailedException extends Exception {

    private final String taskId;
    private final TaskOutcome outcome;

    public JobFailedException(String taskId, TaskOutcome outcome) {
        super("Task " + taskId + " failed. Reason: " + outcome.message(), outcome.error());
        this.taskId = taskId;
        this.outcome = outcome;
    }

    public String taskId() {
        return taskId;
    }

    public TaskOutcome outcome() {
        return outcome;
    }
}
