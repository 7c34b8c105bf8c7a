package flowrun.engine.core;

import flowrun.engine.model.Job;
import flowrun.engine.model.Task;
import flowrun.engine.report.JobReport;
import flowrun.engine.runner.Runner;
import flowrun.engine.runner.RunnerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base of the execution strategies.
 *
 * Holds the registry of submitted jobs, resolves runners and invokes the
 * before/after hooks. Subclasses decide how ready tasks get executed.
 */
public abstract class Engine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Engine.class);

    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final RunnerRegistry runners;
    private final TaskHook beforeTask;
    private final TaskHook afterTask;

    protected Engine(RunnerRegistry runners, TaskHook beforeTask, TaskHook afterTask) {
        this.runners = Objects.requireNonNull(runners, "runners is required");
        this.beforeTask = beforeTask != null ? beforeTask : TaskHook.NOOP;
        this.afterTask = afterTask != null ? afterTask : TaskHook.NOOP;
    }

    /**
     * Register the given jobs and run everything that can still make progress.
     * Blocks the calling thread until all registered jobs are terminal.
     */
    public void run(Job... submitted) {
        for (Job job : submitted) {
            Job previous = jobs.put(job.id(), job);
            if (previous != null && previous != job) {
                log.warn("Job {} replaced a previously registered job with the same id", job.id());
            }
        }
        runAll();
    }

    /**
     * Strategy-specific execution of every registered job.
     */
    protected abstract void runAll();

    /**
     * Create the runner configured for this task.
     *
     * @throws flowrun.engine.runner.RunnerNotFoundException if none is registered
     */
    protected Runner getRunner(Task task) {
        return runners.resolve(task);
    }

    protected void beforeTask(Task task) {
        invokeHook("before", beforeTask, task);
    }

    protected void afterTask(Task task) {
        invokeHook("after", afterTask, task);
    }

    private void invokeHook(String name, TaskHook hook, Task task) {
        try {
            hook.onTask(task);
        } catch (RuntimeException e) {
            log.warn("{}-task hook failed for {}", name, task.id(), e);
        }
    }

    public Collection<Job> jobs() {
        return Collections.unmodifiableCollection(jobs.values());
    }

    public Job job(String jobId) {
        return jobs.get(jobId);
    }

    /** Outcome reports for every registered job. */
    public List<JobReport> reports() {
        List<JobReport> reports = new ArrayList<>(jobs.size());
        for (Job job : jobs.values()) {
            reports.add(JobReport.from(job));
        }
        return reports;
    }

    /**
     * Release execution resources. Nothing to release by default.
     */
    @Override
    public void close() {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + jobs.size() + " jobs]";
    }
}
