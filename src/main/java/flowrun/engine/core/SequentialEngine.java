package flowrun.engine.core;

import flowrun.engine.model.Job;
import flowrun.engine.model.JobStatus;
import flowrun.engine.model.Task;
import flowrun.engine.model.TaskOutcome;
import flowrun.engine.model.TaskStatus;
import flowrun.engine.runner.RunnerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs one task at a time on the calling thread.
 *
 * Fail-fast: the first failed task aborts its job. Nothing else in that job is
 * executed and the job is marked FAILED with a message naming the task.
 */
public class SequentialEngine extends Engine {

    private static final Logger log = LoggerFactory.getLogger(SequentialEngine.class);

    public SequentialEngine(RunnerRegistry runners) {
        this(runners, TaskHook.NOOP, TaskHook.NOOP);
    }

    public SequentialEngine(RunnerRegistry runners, TaskHook beforeTask, TaskHook afterTask) {
        super(runners, beforeTask, afterTask);
    }

    @Override
    protected void runAll() {
        for (Job job : jobs()) {
            if (job.status() != JobStatus.QUEUED) {
                continue;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Interrupted, leaving job {} and the rest queued", job.id());
                return;
            }
            job.markRunning();
            try {
                runJob(job);
                job.updateStatus();
                log.info("Job {} finished: {}", job.id(), job.status());
            } catch (JobFailedException e) {
                job.fail(e.taskId(), e.getMessage());
                log.warn("Job {} failed: {}", job.id(), e.getMessage());
            }
        }
    }

    private void runJob(Job job) throws JobFailedException {
        log.info("Running job {}", job);
        List<Task> ready = job.graph().readyTasks();
        while (!ready.isEmpty()) {
            for (Task task : ready) {
                beforeTask(task);
                runTask(task);
                afterTask(task);
                if (task.status() == TaskStatus.FAILED) {
                    throw new JobFailedException(task.id(), task.outcome());
                }
                job.graph().resolveTask(task);
            }
            ready = job.graph().readyTasks();
        }
    }

    /**
     * Execute one task synchronously and record its outcome.
     */
    protected void runTask(Task task) {
        task.markRunning();
        log.info("Running {}", task);
        log.debug("Arguments: {}", task.arguments());
        try {
            Object value = getRunner(task).run();
            task.complete(TaskOutcome.success(value));
            log.info("Finished: {}", task.id());
            log.debug("Result: {}", value);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Task interrupted ({})", task.id(), e);
            task.complete(TaskOutcome.failure(e));
        } catch (Throwable t) {
            log.error("Task error ({})", task.id(), t);
            task.complete(TaskOutcome.failure(t));
        }
    }
}
