package flowrun.engine.core;

import flowrun.engine.model.Task;

/**
 * Observer invoked around every task execution.
 * Runs on the engine's control thread; must not change scheduling state.
 */
@FunctionalInterface
public interface TaskHook {

    TaskHook NOOP = task -> {
    };

    void onTask(Task task);
}
