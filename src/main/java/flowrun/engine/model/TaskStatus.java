package flowrun.engine.model;

/**
 * Task execution status.
 */
public enum TaskStatus {
    /** Some predecessor has not finished yet */
    WAITING,
    /** All predecessors finished, task is in the ready frontier */
    READY,
    /** Dispatched to a runner */
    RUNNING,
    /** Runner returned a value */
    FINISHED,
    /** Runner raised an error */
    FAILED;

    public boolean isTerminal() {
        return this == FINISHED || this == FAILED;
    }
}
