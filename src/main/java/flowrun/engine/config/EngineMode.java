package flowrun.engine.config;

/**
 * Execution strategy selection.
 */
public enum EngineMode {
    /** One task at a time, abort the job on first failure */
    SEQUENTIAL,
    /** Worker pool with resource admission, independent branches keep running */
    CONCURRENT
}
