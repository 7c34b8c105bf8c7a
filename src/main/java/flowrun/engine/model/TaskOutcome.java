package flowrun.engine.model;

import java.util.Objects;

/**
 * Result of running a task: either the runner's value or the error it raised.
 */
public final class TaskOutcome {

    private final boolean success;
    private final Object value;
    private final Throwable error;

    private TaskOutcome(boolean success, Object value, Throwable error) {
        this.success = success;
        this.value = value;
        this.error = error;
    }

    public static TaskOutcome success(Object value) {
        return new TaskOutcome(true, value, null);
    }

    public static TaskOutcome failure(Throwable error) {
        return new TaskOutcome(false, null, Objects.requireNonNull(error, "error is required"));
    }

    public boolean isSuccess() {
        return success;
    }

    /** Runner return value, null for failures (and for runners returning null). */
    public Object value() {
        return value;
    }

    /** Captured error, null for successes. */
    public Throwable error() {
        return error;
    }

    /** Human readable reason for a failure; the value's text for a success. */
    public String message() {
        if (success) {
            return String.valueOf(value);
        }
        String msg = error.getMessage();
        return msg == null || msg.isBlank() ? error.getClass().getSimpleName() : msg;
    }

    @Override
    public String toString() {
        return success ? "Success{" + value + "}" : "Failure{" + message() + "}";
    }
}
