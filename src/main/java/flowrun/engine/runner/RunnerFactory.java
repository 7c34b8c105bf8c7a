package flowrun.engine.runner;

import flowrun.engine.model.Task;

/**
 * Creates the runner for a task.
 */
@FunctionalInterface
public interface RunnerFactory {

    Runner create(Task task);
}
