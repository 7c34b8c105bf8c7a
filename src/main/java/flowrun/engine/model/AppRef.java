package flowrun.engine.model;

import java.util.Objects;

/**
 * Reference to the application a task executes.
 */
public record AppRef(String id, AppType type) {

    public AppRef {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
    }

    public static AppRef of(String id, AppType type) {
        return new AppRef(id, type);
    }
}
