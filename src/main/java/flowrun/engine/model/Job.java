package flowrun.engine.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named unit of submitted work: a task graph plus an aggregate status.
 *
 * Created QUEUED by the caller; the engine moves it to RUNNING on first
 * dispatch and to FINISHED or FAILED once no further progress is possible.
 */
public final class Job {
    private final String id;
    private final TaskGraph graph;

    private JobStatus status = JobStatus.QUEUED;
    private String errorMessage;
    private String failedTaskId;

    public Job(String id, TaskGraph graph) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.graph = Objects.requireNonNull(graph, "graph is required");
    }

    // Getters
    public String id() {
        return id;
    }

    public TaskGraph graph() {
        return graph;
    }

    public JobStatus status() {
        return status;
    }

    public String errorMessage() {
        return errorMessage;
    }

    /** Task that aborted the job, set by fail-fast execution only. */
    public String failedTaskId() {
        return failedTaskId;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public void markRunning() {
        if (status == JobStatus.QUEUED) {
            status = JobStatus.RUNNING;
        }
    }

    /**
     * Abort the job because of one task.
     */
    public void fail(String taskId, String message) {
        this.status = JobStatus.FAILED;
        this.failedTaskId = taskId;
        this.errorMessage = message;
    }

    /**
     * Recompute the aggregate status from the graph.
     * Only an exhausted graph yields a terminal status: FINISHED if every task
     * finished, FAILED otherwise. A job that is already terminal is left alone.
     *
     * @return the status after recomputation
     */
    public JobStatus updateStatus() {
        if (status.isTerminal() || !graph.isExhausted()) {
            return status;
        }
        if (graph.allFinished()) {
            status = JobStatus.FINISHED;
        } else {
            status = JobStatus.FAILED;
            errorMessage = "Tasks did not finish: " + unfinishedTaskIds();
        }
        return status;
    }

    public List<String> unfinishedTaskIds() {
        List<String> ids = new ArrayList<>();
        for (Task task : graph.tasks()) {
            if (task.status() != TaskStatus.FINISHED) {
                ids.add(task.id());
            }
        }
        return ids;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', status=" + status + ", tasks=" + graph.size() + "}";
    }
}
