package flowrun.engine.runner;

/**
 * Failure reported by a runner while executing a task.
 */
public class RunnerException extends Exception {

    public RunnerException(String message) {
        super(message);
    }

    public RunnerException(String message, Throwable cause) {
        super(message, cause);
    }
}
