package flowrun.engine.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dependency DAG over the tasks of one job.
 *
 * An edge {@code before -> after} means {@code after} may only start once
 * {@code before} is FINISHED. The graph tracks the ready frontier: tasks whose
 * predecessors are all FINISHED and which have not started yet. Frontier
 * membership and the resolved set only ever grow forward; a task never goes
 * back to WAITING.
 *
 * Not thread-safe. The owning engine touches it from its control thread only.
 */
public final class TaskGraph {

    private static final Logger log = LoggerFactory.getLogger(TaskGraph.class);

    private final Map<String, Task> tasks;
    private final Map<String, Set<String>> predecessors;
    private final Map<String, Set<String>> successors;
    private final Set<String> ready = new LinkedHashSet<>();
    private final Set<String> resolved = new HashSet<>();

    private TaskGraph(Map<String, Task> tasks,
            Map<String, Set<String>> predecessors,
            Map<String, Set<String>> successors) {
        this.tasks = tasks;
        this.predecessors = predecessors;
        this.successors = successors;

        for (Task task : tasks.values()) {
            if (predecessors.get(task.id()).isEmpty()) {
                task.markReady();
                ready.add(task.id());
            }
        }
    }

    /**
     * Current ready frontier. Order follows insertion but callers must not rely
     * on it for correctness.
     */
    public List<Task> readyTasks() {
        List<Task> result = new ArrayList<>(ready.size());
        for (String id : ready) {
            Task task = tasks.get(id);
            if (task.status() == TaskStatus.READY) {
                result.add(task);
            }
        }
        return result;
    }

    public boolean hasReadyTasks() {
        for (String id : ready) {
            if (tasks.get(id).status() == TaskStatus.READY) {
                return true;
            }
        }
        return false;
    }

    /**
     * Mark a completed task as handled and promote the dependents it unblocks.
     *
     * A FINISHED task promotes every WAITING dependent whose predecessors are now
     * all FINISHED. A FAILED task promotes nothing. Resolving the same task again
     * is a no-op.
     *
     * @param task a task of this graph in a terminal status
     * @return the tasks newly added to the frontier
     */
    public List<Task> resolveTask(Task task) {
        Task own = tasks.get(task.id());
        if (own != task) {
            throw new IllegalArgumentException("Task " + task.id() + " does not belong to this graph");
        }
        if (resolved.contains(task.id())) {
            log.debug("Task {} already resolved, ignoring", task.id());
            return List.of();
        }
        if (!task.isTerminal()) {
            throw new IllegalStateException("Cannot resolve task " + task.id() + " in status " + task.status());
        }

        ready.remove(task.id());
        resolved.add(task.id());

        if (task.status() != TaskStatus.FINISHED) {
            return List.of();
        }

        List<Task> promoted = new ArrayList<>();
        for (String next : successors.get(task.id())) {
            Task dependent = tasks.get(next);
            if (dependent.status() == TaskStatus.WAITING && predecessorsFinished(next)) {
                dependent.markReady();
                ready.add(next);
                promoted.add(dependent);
            }
        }
        return promoted;
    }

    private boolean predecessorsFinished(String taskId) {
        for (String pred : predecessors.get(taskId)) {
            if (tasks.get(pred).status() != TaskStatus.FINISHED) {
                return false;
            }
        }
        return true;
    }

    public boolean hasRunningTasks() {
        for (Task task : tasks.values()) {
            if (task.status() == TaskStatus.RUNNING) {
                return true;
            }
        }
        return false;
    }

    /** No ready task and no running task: nothing in this graph can change anymore. */
    public boolean isExhausted() {
        return !hasReadyTasks() && !hasRunningTasks();
    }

    public boolean allFinished() {
        for (Task task : tasks.values()) {
            if (task.status() != TaskStatus.FINISHED) {
                return false;
            }
        }
        return true;
    }

    public Collection<Task> tasks() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    public Optional<Task> task(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public Set<String> predecessors(String taskId) {
        Set<String> preds = predecessors.get(taskId);
        if (preds == null) {
            throw new IllegalArgumentException("Unknown task " + taskId);
        }
        return Collections.unmodifiableSet(preds);
    }

    public int size() {
        return tasks.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, Task> tasks = new LinkedHashMap<>();
        private final List<String[]> edges = new ArrayList<>();

        public Builder task(Task task) {
            if (tasks.putIfAbsent(task.id(), task) != null) {
                throw new IllegalArgumentException("Duplicate task id " + task.id());
            }
            return this;
        }

        public Builder tasks(Collection<Task> all) {
            all.forEach(this::task);
            return this;
        }

        /** {@code after} depends on {@code before}. */
        public Builder dependency(String before, String after) {
            edges.add(new String[] { before, after });
            return this;
        }

        public TaskGraph build() {
            Map<String, Set<String>> preds = new HashMap<>();
            Map<String, Set<String>> succs = new HashMap<>();
            for (Task task : tasks.values()) {
                if (task.status() != TaskStatus.WAITING) {
                    throw new IllegalArgumentException("Task " + task.id() + " already left WAITING: " + task.status());
                }
                preds.put(task.id(), new LinkedHashSet<>());
                succs.put(task.id(), new LinkedHashSet<>());
            }

            for (String[] edge : edges) {
                String before = edge[0];
                String after = edge[1];
                if (!tasks.containsKey(before) || !tasks.containsKey(after)) {
                    throw new IllegalArgumentException("Dependency references unknown task: " + before + " -> " + after);
                }
                if (before.equals(after)) {
                    throw new IllegalArgumentException("Task " + before + " cannot depend on itself");
                }
                preds.get(after).add(before);
                succs.get(before).add(after);
            }

            checkAcyclic(preds, succs);
            return new TaskGraph(new LinkedHashMap<>(tasks), preds, succs);
        }

        private void checkAcyclic(Map<String, Set<String>> preds, Map<String, Set<String>> succs) {
            Map<String, Integer> inDegree = new HashMap<>();
            Deque<String> queue = new ArrayDeque<>();
            for (String id : tasks.keySet()) {
                int degree = preds.get(id).size();
                inDegree.put(id, degree);
                if (degree == 0) {
                    queue.add(id);
                }
            }

            int visited = 0;
            while (!queue.isEmpty()) {
                String id = queue.poll();
                visited++;
                for (String next : succs.get(id)) {
                    int left = inDegree.merge(next, -1, Integer::sum);
                    if (left == 0) {
                        queue.add(next);
                    }
                }
            }

            if (visited != tasks.size()) {
                List<String> cyclic = new ArrayList<>();
                inDegree.forEach((id, degree) -> {
                    if (degree > 0) {
                        cyclic.add(id);
                    }
                });
                Collections.sort(cyclic);
                throw new IllegalArgumentException("Task graph contains a cycle through " + cyclic);
            }
        }
    }

    @Override
    public String toString() {
        return "TaskGraph{tasks=" + tasks.size() + ", ready=" + ready.size() + ", resolved=" + resolved.size() + "}";
    }
}
