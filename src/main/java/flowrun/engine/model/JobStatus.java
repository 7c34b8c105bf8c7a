package flowrun.engine.model;

/**
 * Aggregate status of a job.
 */
public enum JobStatus {
    /** Registered, nothing dispatched yet */
    QUEUED,
    /** At least one task has been dispatched */
    RUNNING,
    /** Every task finished */
    FINISHED,
    /** No further progress possible and at least one task did not finish */
    FAILED;

    public boolean isTerminal() {
        return this == FINISHED || this == FAILED;
    }
}
