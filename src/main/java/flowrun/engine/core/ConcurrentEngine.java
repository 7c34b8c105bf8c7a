package flowrun.engine.core;

import flowrun.engine.config.EngineConfig;
import flowrun.engine.model.Job;
import flowrun.engine.model.JobStatus;
import flowrun.engine.model.ResourceRequest;
import flowrun.engine.model.Task;
import flowrun.engine.model.TaskOutcome;
import flowrun.engine.runner.Runner;
import flowrun.engine.runner.RunnerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs ready tasks on a fixed worker pool, gated by a CPU/RAM ledger.
 *
 * The control loop is single-threaded: it admits ready tasks whose resource
 * request fits, submits their runners to the pool, polls the pending futures
 * without blocking, and applies completions (status, hooks, release, graph
 * resolution) itself. Workers only compute results.
 *
 * Best-effort: a failed task does not stop independent branches. A job fails
 * only once its graph is exhausted with some task not finished.
 *
 * Admission is first-fit over the frontiers with no priority or reservation,
 * so a large request can keep losing to smaller ones, and a request larger
 * than the machine waits forever.
 */
public class ConcurrentEngine extends Engine {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentEngine.class);

    private final ResourceLedger ledger;
    private final ExecutorService pool;
    private final Duration pollInterval;
    private final List<InFlight> running = new ArrayList<>();
    // Identity: task ids are only unique within one job
    private final Set<Task> starving = Collections.newSetFromMap(new IdentityHashMap<>());

    public ConcurrentEngine(RunnerRegistry runners, EngineConfig config) {
        this(runners, config, TaskHook.NOOP, TaskHook.NOOP);
    }

    public ConcurrentEngine(RunnerRegistry runners, EngineConfig config, TaskHook beforeTask, TaskHook afterTask) {
        super(runners, beforeTask, afterTask);
        this.ledger = new ResourceLedger(config.cpuCount(), config.ramMb());
        this.pollInterval = config.pollInterval();
        AtomicInteger threadIndex = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(config.poolSize(), r -> {
            Thread t = new Thread(r, "flowrun-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Concurrent engine started: pool={}, resources={}", config.poolSize(), ledger.summary());
    }

    @Override
    protected void runAll() {
        while (true) {
            int dispatched = runReadyTasks();
            int completed = collectFinished();

            if (completed > 0) {
                updateJobs();
            }
            if (running.isEmpty() && !hasReadyTasks()) {
                updateJobs();
                return;
            }
            if (dispatched == 0 && completed == 0) {
                try {
                    Thread.sleep(pollInterval.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted with {} task(s) in flight, leaving run loop", running.size());
                    return;
                }
            }
        }
    }

    /**
     * Admit and dispatch every ready task that fits.
     *
     * @return number of tasks dispatched or failed before dispatch
     */
    private int runReadyTasks() {
        int progressed = 0;
        for (Job job : jobs()) {
            if (job.isTerminal()) {
                continue;
            }
            for (Task task : job.graph().readyTasks()) {
                Runner runner;
                try {
                    runner = getRunner(task);
                    if (task.resources() == null) {
                        task.attachResources(runner.getRequirements());
                    }
                } catch (RuntimeException e) {
                    failBeforeDispatch(job, task, e);
                    progressed++;
                    continue;
                }

                if (!acquireResources(task)) {
                    continue;
                }

                beforeTask(task);
                job.markRunning();
                task.markRunning();
                log.info("Running {}", task);
                log.debug("Arguments: {}", task.arguments());
                running.add(new InFlight(job, task, submit(runner)));
                progressed++;
            }
        }
        return progressed;
    }

    private void failBeforeDispatch(Job job, Task task, RuntimeException e) {
        log.error("Cannot dispatch task {}", task.id(), e);
        beforeTask(task);
        job.markRunning();
        task.markRunning();
        task.complete(TaskOutcome.failure(e));
        afterTask(task);
        job.graph().resolveTask(task);
    }

    /**
     * Apply every completed in-flight task.
     *
     * @return number of completions processed
     */
    private int collectFinished() {
        int completed = 0;
        Iterator<InFlight> it = running.iterator();
        while (it.hasNext()) {
            InFlight item = it.next();
            if (isDone(item.result())) {
                processResult(item);
                it.remove();
                completed++;
            }
        }
        return completed;
    }

    private void processResult(InFlight item) {
        Task task = item.task();
        TaskOutcome outcome = collect(item.result());
        task.complete(outcome);
        if (outcome.isSuccess()) {
            log.info("Finished: {}", task.id());
            log.debug("Result: {}", outcome.value());
        } else {
            log.error("Failed: {}", task.id(), outcome.error());
        }
        afterTask(task);
        releaseResources(task);
        item.job().graph().resolveTask(task);
    }

    private void updateJobs() {
        for (Job job : jobs()) {
            JobStatus before = job.status();
            JobStatus after = job.updateStatus();
            if (before != after) {
                if (after == JobStatus.FAILED) {
                    log.warn("Job {} failed: {}", job.id(), job.errorMessage());
                } else {
                    log.info("Job {} finished: {}", job.id(), after);
                }
            }
        }
    }

    private boolean hasReadyTasks() {
        for (Job job : jobs()) {
            if (!job.isTerminal() && job.graph().hasReadyTasks()) {
                return true;
            }
        }
        return false;
    }

    protected boolean acquireResources(Task task) {
        ResourceRequest res = task.resources();
        log.debug("[resources: {}] Acquiring {} for {}", ledger.summary(), res, task.id());
        if (ledger.exceedsCapacity(res) && starving.add(task)) {
            log.warn("Task {} requests {} but the engine only has {}; it will never be admitted",
                    task.id(), res, ledger.summary());
        }
        return ledger.tryAcquire(res);
    }

    protected void releaseResources(Task task) {
        log.debug("[resources: {}] Releasing {} from {}", ledger.summary(), task.resources(), task.id());
        ledger.release(task.resources());
    }

    /**
     * Hand the runner to the worker pool.
     */
    protected Future<Object> submit(Runner runner) {
        Callable<Object> call = runner::run;
        return pool.submit(call);
    }

    /**
     * Non-blocking completion check.
     */
    protected boolean isDone(Future<Object> result) {
        return result.isDone();
    }

    /**
     * Retrieve a completed result, turning a raised error into a failure outcome.
     */
    protected TaskOutcome collect(Future<Object> result) {
        try {
            return TaskOutcome.success(result.get());
        } catch (ExecutionException e) {
            return TaskOutcome.failure(e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskOutcome.failure(e);
        } catch (RuntimeException e) {
            return TaskOutcome.failure(e);
        }
    }

    public ResourceLedger ledger() {
        return ledger;
    }

    /** Tasks dispatched and not yet collected. */
    public int inFlightCount() {
        return running.size();
    }

    /**
     * Shut the worker pool down. In-flight tasks are not cancelled; they get a
     * grace period before the pool is forced down.
     */
    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
                log.warn("Worker pool forcefully stopped");
            } else {
                log.info("Worker pool stopped gracefully");
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record InFlight(Job job, Task task, Future<Object> result) {
    }
}
