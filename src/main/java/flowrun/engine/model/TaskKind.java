package flowrun.engine.model;

import java.util.Locale;

/**
 * Kind of work a task performs. Selects the runner family in the registry.
 */
public enum TaskKind {
    /** Prepare an application (pull an image, fetch a tool) before it runs */
    INSTALL,
    /** Execute one application step */
    RUN,
    /** Gather the outputs of finished steps */
    COLLECT_OUTPUTS;

    /** Parse a configuration key such as {@code collect_outputs}. */
    public static TaskKind fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
