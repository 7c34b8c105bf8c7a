package flowrun.engine.model;

import java.util.Locale;

/**
 * Type tag of the application a task refers to.
 */
public enum AppType {
    COMMAND_LINE,
    CONTAINER,
    SCRIPT,
    WORKFLOW;

    public static AppType fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
