package flowrun.engine.runner;

/**
 * No runner is registered for a task's kind (and app type).
 */
public class RunnerNotFoundException extends RuntimeException {

    public RunnerNotFoundException(String message) {
        super(message);
    }
}
