package flowrun.engine.runner;

import flowrun.engine.model.ResourceRequest;

/**
 * Execution strategy bound to one task.
 *
 * Instances are created by a {@link RunnerFactory} on the engine's control
 * thread. {@link #run()} may execute on a worker thread; it must not touch
 * engine, job or task state and only return (or throw) its result.
 */
public interface Runner {

    /**
     * Perform the task's work.
     *
     * @return the task result, stored on the task when it finishes
     * @throws Exception any failure; captured as the task's outcome
     */
    Object run() throws Exception;

    /**
     * Resources this task needs. Consulted when the task carries no request of
     * its own.
     */
    ResourceRequest getRequirements();
}
