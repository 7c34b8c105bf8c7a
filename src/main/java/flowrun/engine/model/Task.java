package flowrun.engine.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * The smallest schedulable unit of work.
 *
 * Identity, kind, app and arguments are fixed at construction. Execution state
 * (status, resources, outcome, timestamps) is mutated by the graph and the
 * engine only, always from the engine's control thread.
 */
public final class Task {
    private final String id;
    private final TaskKind kind;
    private final AppRef app; // null for kinds that are not polymorphic over app type
    private final JsonNode arguments;

    private ResourceRequest resources;
    private TaskStatus status = TaskStatus.WAITING;
    private TaskOutcome outcome;
    private Instant startedAt;
    private Instant finishedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.app = builder.app;
        this.arguments = builder.arguments != null ? builder.arguments : JsonNodeFactory.instance.objectNode();
        this.resources = builder.resources;
    }

    // Getters
    public String id() {
        return id;
    }

    public TaskKind kind() {
        return kind;
    }

    public AppRef app() {
        return app;
    }

    public JsonNode arguments() {
        return arguments;
    }

    public ResourceRequest resources() {
        return resources;
    }

    public TaskStatus status() {
        return status;
    }

    public TaskOutcome outcome() {
        return outcome;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Attach the resource request. Once attached it can't be replaced.
     */
    public void attachResources(ResourceRequest request) {
        Objects.requireNonNull(request, "request is required");
        if (resources != null) {
            throw new IllegalStateException("Task " + id + " already has resources " + resources);
        }
        this.resources = request;
    }

    /** Called by the task graph when every predecessor has finished. */
    void markReady() {
        if (status != TaskStatus.WAITING) {
            throw new IllegalStateException("Task " + id + " cannot become READY from " + status);
        }
        status = TaskStatus.READY;
    }

    public void markRunning() {
        if (status != TaskStatus.READY) {
            throw new IllegalStateException("Task " + id + " cannot start from " + status);
        }
        status = TaskStatus.RUNNING;
        startedAt = Instant.now();
    }

    /**
     * Record the outcome of a run. Status becomes FINISHED or FAILED accordingly.
     */
    public void complete(TaskOutcome result) {
        Objects.requireNonNull(result, "result is required");
        if (status != TaskStatus.RUNNING) {
            throw new IllegalStateException("Task " + id + " cannot complete from " + status);
        }
        this.outcome = result;
        this.status = result.isSuccess() ? TaskStatus.FINISHED : TaskStatus.FAILED;
        this.finishedAt = Instant.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private TaskKind kind = TaskKind.RUN;
        private AppRef app;
        private JsonNode arguments;
        private ResourceRequest resources;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(TaskKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder app(AppRef app) {
            this.app = app;
            return this;
        }

        public Builder arguments(JsonNode arguments) {
            this.arguments = arguments;
            return this;
        }

        public Builder resources(ResourceRequest resources) {
            this.resources = resources;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', kind=" + kind + ", status=" + status + "}";
    }
}
