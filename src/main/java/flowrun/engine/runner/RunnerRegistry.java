package flowrun.engine.runner;

import flowrun.engine.model.AppType;
import flowrun.engine.model.Task;
import flowrun.engine.model.TaskKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Lookup table from task kind to runner factory.
 *
 * A kind is either bound to a single factory, or polymorphic over the task's
 * app type with one factory per {@link AppType}. Built once and handed to the
 * engine; immutable afterwards.
 */
public final class RunnerRegistry {

    private final Map<TaskKind, RunnerFactory> byKind;
    private final Map<TaskKind, Map<AppType, RunnerFactory>> byAppType;

    private RunnerRegistry(Builder builder) {
        this.byKind = Collections.unmodifiableMap(new EnumMap<>(builder.byKind));
        Map<TaskKind, Map<AppType, RunnerFactory>> nested = new EnumMap<>(TaskKind.class);
        builder.byAppType.forEach((kind, map) -> nested.put(kind, Collections.unmodifiableMap(new EnumMap<>(map))));
        this.byAppType = Collections.unmodifiableMap(nested);
    }

    /**
     * Create the runner for a task.
     *
     * @throws RunnerNotFoundException if nothing is registered for the task
     */
    public Runner resolve(Task task) {
        return factoryFor(task).create(task);
    }

    RunnerFactory factoryFor(Task task) {
        RunnerFactory direct = byKind.get(task.kind());
        if (direct != null) {
            return direct;
        }

        Map<AppType, RunnerFactory> perApp = byAppType.get(task.kind());
        if (perApp == null) {
            throw new RunnerNotFoundException("No runner registered for task kind " + task.kind());
        }
        if (task.app() == null) {
            throw new RunnerNotFoundException(
                    "Task " + task.id() + " of kind " + task.kind() + " has no app to select a runner by");
        }
        RunnerFactory factory = perApp.get(task.app().type());
        if (factory == null) {
            throw new RunnerNotFoundException(
                    "No runner registered for task kind " + task.kind() + " and app type " + task.app().type());
        }
        return factory;
    }

    public boolean isPolymorphic(TaskKind kind) {
        return byAppType.containsKey(kind);
    }

    public boolean supports(TaskKind kind) {
        return byKind.containsKey(kind) || byAppType.containsKey(kind);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<TaskKind, RunnerFactory> byKind = new EnumMap<>(TaskKind.class);
        private final Map<TaskKind, Map<AppType, RunnerFactory>> byAppType = new EnumMap<>(TaskKind.class);

        private Builder() {
        }

        /** Bind every task of this kind to one factory. */
        public Builder register(TaskKind kind, RunnerFactory factory) {
            Objects.requireNonNull(kind, "kind is required");
            Objects.requireNonNull(factory, "factory is required");
            if (byAppType.containsKey(kind)) {
                throw new IllegalArgumentException("Task kind " + kind + " is already registered per app type");
            }
            if (byKind.putIfAbsent(kind, factory) != null) {
                throw new IllegalArgumentException("Task kind " + kind + " is already registered");
            }
            return this;
        }

        /** Bind tasks of this kind whose app has the given type. */
        public Builder register(TaskKind kind, AppType appType, RunnerFactory factory) {
            Objects.requireNonNull(kind, "kind is required");
            Objects.requireNonNull(appType, "appType is required");
            Objects.requireNonNull(factory, "factory is required");
            if (byKind.containsKey(kind)) {
                throw new IllegalArgumentException("Task kind " + kind + " is already registered with a single runner");
            }
            Map<AppType, RunnerFactory> perApp = byAppType.computeIfAbsent(kind, k -> new EnumMap<>(AppType.class));
            if (perApp.putIfAbsent(appType, factory) != null) {
                throw new IllegalArgumentException("Task kind " + kind + " / app type " + appType + " is already registered");
            }
            return this;
        }

        public RunnerRegistry build() {
            return new RunnerRegistry(this);
        }
    }

    @Override
    public String toString() {
        return "RunnerRegistry{kinds=" + byKind.keySet() + ", polymorphic=" + byAppType.keySet() + "}";
    }
}
