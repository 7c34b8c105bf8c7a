package flowrun.engine.core;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import flowrun.engine.config.EngineConfig;
import flowrun.engine.model.Job;
import flowrun.engine.model.JobStatus;
import flowrun.engine.model.ResourceRequest;
import flowrun.engine.model.Task;
import flowrun.engine.model.TaskGraph;
import flowrun.engine.model.TaskKind;
import flowrun.engine.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(20)
class ConcurrentEngineTest {

    private static EngineConfig config(int cpu, int ramMb) {
        return EngineConfig.defaults()
                .withCpuCount(cpu)
                .withRamMb(ramMb)
                .withPoolSize(4)
                .withPollInterval(Duration.ofMillis(5));
    }

    private static Task task(String id) {
        return Task.builder().id(id).build();
    }

    private static Task task(String id, ResourceRequest res) {
        return Task.builder().id(id).resources(res).build();
    }

    @Test
    @DisplayName("Linear chain A -> B -> C runs in dependency order")
    void linearChain() {
        ScriptedRunners runners = new ScriptedRunners();
        Task a = task("a");
        Task b = task("b");
        Task c = task("c");
        Job job = new Job("chain", TaskGraph.builder()
                .task(a).task(b).task(c)
                .dependency("a", "b")
                .dependency("b", "c")
                .build());

        try (ConcurrentEngine engine = new ConcurrentEngine(runners.registry(), config(4, 1024))) {
            engine.run(job);
            assertEquals(0, engine.inFlightCount());
        }

        assertEquals(List.of("a", "b", "c"), runners.started());
        assertEquals(JobStatus.FINISHED, job.status());
        assertEquals("result-c", c.outcome().value());
    }

    @Test
    @DisplayName("Independent sibling still finishes when the root fails")
    void fanOutPartialFailure() {
        ScriptedRunners runners = new ScriptedRunners().failing("root", "exit 1");
        Task root = task("root");
        Task child = task("child");
        Task sibling = task("sibling");
        Job job = new Job("partial", TaskGraph.builder()
                .task(root).task(child).task(sibling)
                .dependency("root", "child")
                .build());

        try (ConcurrentEngine engine = new ConcurrentEngine(runners.registry(), config(4, 1024))) {
            engine.run(job);
        }

        assertEquals(TaskStatus.FAILED, root.status());
        assertEquals("exit 1", root.outcome().message());
        assertEquals(TaskStatus.WAITING, child.status());
        assertEquals(TaskStatus.FINISHED, sibling.status());
        assertEquals("result-sibling", sibling.outcome().value());
        assertEquals(JobStatus.FAILED, job.status());
        assertTrue(job.errorMessage().contains("root"));
        assertTrue(job.errorMessage().contains("child"));
        assertFalse(runners.started().contains("child"));
    }

    @Test
    @DisplayName("Two full-machine requests never overlap")
    void contentionSerialisesTasks() {
        ScriptedRunners runners = new ScriptedRunners().delayMs(40);
        Job job = new Job("contention", TaskGraph.builder()
                .task(task("x", ResourceRequest.of(4, 0)))
                .task(task("y", ResourceRequest.of(4, 0)))
                .build());

        try (ConcurrentEngine engine = new ConcurrentEngine(runners.registry(), config(4, 1024))) {
            engine.run(job);
            assertEquals(4, engine.ledger().availableCpu());
        }

        assertEquals(JobStatus.FINISHED, job.status());
        assertEquals(1, runners.maxConcurrent());
        assertEquals(2, runners.started().size());
    }

    @Test
    @DisplayName("Requests that fit together run concurrently")
    void sufficientResourcesRunConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        ScriptedRunners runners = new ScriptedRunners();
        for (String id : List.of("x", "y")) {
            runners.script(id, () -> {
                bothStarted.countDown();
                if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("peer task never started");
                }
                return id;
            });
        }
        Job job = new Job("parallel", TaskGraph.builder()
                .task(task("x", ResourceRequest.of(4, 0)))
                .task(task("y", ResourceRequest.of(4, 0)))
                .build());

        try (ConcurrentEngine engine = new ConcurrentEngine(runners.registry(), config(8, 1024))) {
            engine.run(job);
        }

        assertEquals(JobStatus.FINISHED, job.status());
        assertEquals(2, runners.maxConcurrent());
    }

    @Test
    @DisplayName("CPU_ALL task excludes a 1-core task and vice versa")
    void exclusiveTaskRunsAlone() {
        ScriptedRunners runners = new ScriptedRunners().delayMs(40);
        Task whole = task("whole", ResourceRequest.exclusive(0));
        Task small = task("small", ResourceRequest.of(1, 0));
        Job job = new Job("exclusive", TaskGraph.builder().task(whole).task(small).build());

        try (ConcurrentEngine engine = new ConcurrentEngine(runners.registry(), config(4, 1024))) {
            engine.run(job);
            assertFalse(engine.ledger().isExclusiveLocked());
            assertEquals(4, engine.ledger().availableCpu());
        }

        assertEquals(JobStatus.FINISHED, job.status());
        assertEquals(1, runners.maxConcurrent());
    }

    @Test
    void memoryGatesAdmission() {
        ScriptedRunners runners = new ScriptedRunners().delayMs(30);
        Job job = new Job("ram", TaskGraph.builder()
                .task(task("m1", ResourceRequest.of(1, 600)))
                .task(task("m2", ResourceRequest.of(1, 600)))
                .build());

        try (ConcurrentEngine engine = new ConcurrentEngine(runners.registry(), config(4, 1000))) {
            engine.run(job);
            assertEquals(1000, engine.ledger().availableRamMb());
        }

        assertEquals(JobStatus.FINISHED, job.status());
        assertEquals(1, runners.maxConcurrent());
    }

    @Test
    @DisplayName("Missing resource request is filled from the runner")
    void requirementsFromRunner() {
        ScriptedRunners runners = new ScriptedRunners()
                .requirements("p", ResourceRequest.of(2, 10))
                .requirements("q", ResourceRequest.of(3, 30));
        Task p = task("p");
        Task q = task("q", ResourceRequest.of(1, 5));
        Job job = new Job("req", TaskGraph.builder().task(p).task(q).build());

        try (ConcurrentEngine engine = new ConcurrentEngine(runners.registry(), config(4, 1024))) {
            engine.run(job);
        }

        assertEquals(ResourceRequest.of(2, 10), p.resources());
        assertEquals(ResourceRequest.of(1, 5), q.resources());
        assertEquals(1, runners.requirementLookups());
    }

    @Test
    @DisplayName("Hooks run on the calling thread for successes and failures")
    void hooksOnControlThread() {
        ScriptedRunners runners = new ScriptedRunners().failing("bad", "broken");
        Thread caller = Thread.currentThread();
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        List<Thread> hookThreads = Collections.synchronizedList(new ArrayList<>());
        TaskHook before = t -> {
            hookThreads.add(Thread.currentThread());
            events.add("before:" + t.id());
        };
        TaskHook after = t -> {
            hookThreads.add(Thread.currentThread());
            events.add("after:" + t.id() + ":" + t.status());
        };
        Job job = new Job("hooks", TaskGraph.builder().task(task("good")).task(task("bad")).build());

        try (ConcurrentEngine engine = new ConcurrentEngine(runners.registry(), config(4, 1024), before, after)) {
            engine.run(job);
        }

        assertEquals(4, events.size());
        assertTrue(events.contains("after:good:FINISHED"));
        assertTrue(events.contains("after:bad:FAILED"));
        assertTrue(events.indexOf("before:good") < events.indexOf("after:good:FINISHED"));
        hookThreads.forEach(t -> assertSame(caller, t));
    }

    @Test
    @DisplayName("Unresolvable runner fails the task without blocking other jobs")
    void missingRunnerFailsTask() {
        ScriptedRunners runners = new ScriptedRunners();
        Task install = Task.builder().id("install").kind(TaskKind.INSTALL).build();
        Job broken = new Job("broken", TaskGraph.builder().task(install).build());
        Job fine = new Job("fine", TaskGraph.builder().task(task("ok")).build());

        try (ConcurrentEngine engine = new ConcurrentEngine(runners.registry(), config(2, 1024))) {
            engine.run(broken, fine);
            assertEquals(2, engine.ledger().availableCpu());
        }

        assertEquals(TaskStatus.FAILED, install.status());
        assertNull(install.resources());
        assertEquals(JobStatus.FAILED, broken.status());
        assertEquals(JobStatus.FINISHED, fine.status());
    }

    @Test
    @DisplayName("Diamond with several jobs returns every resource")
    void ledgerConservedAcrossJobs() {
        ScriptedRunners runners = new ScriptedRunners().delayMs(5);
        List<Job> jobs = new ArrayList<>();
        for (int j = 0; j < 3; j++) {
            jobs.add(new Job("job-" + j, TaskGraph.builder()
                    .task(task("top", ResourceRequest.of(1, 100)))
                    .task(task("left", ResourceRequest.of(2, 200)))
                    .task(task("right", ResourceRequest.exclusive(50)))
                    .task(task("bottom", ResourceRequest.of(3, 300)))
                    .dependency("top", "left")
                    .dependency("top", "right")
                    .dependency("left", "bottom")
                    .dependency("right", "bottom")
                    .build()));
        }

        try (ConcurrentEngine engine = new ConcurrentEngine(runners.registry(), config(4, 512))) {
            engine.run(jobs.toArray(new Job[0]));

            assertEquals(4, engine.ledger().availableCpu());
            assertEquals(512, engine.ledger().availableRamMb());
            assertFalse(engine.ledger().isExclusiveLocked());
        }

        jobs.forEach(job -> assertEquals(JobStatus.FINISHED, job.status()));
        assertEquals(12, runners.started().size());
    }

    @Test
    void emptyJobFinishesImmediately() {
        Job job = new Job("empty", TaskGraph.builder().build());

        try (ConcurrentEngine engine = new ConcurrentEngine(new ScriptedRunners().registry(), config(1, 0))) {
            engine.run(job);
        }

        assertEquals(JobStatus.FINISHED, job.status());
    }

    @Test
    @DisplayName("Oversized request waits until the control thread is interrupted")
    void oversizedRequestStarves() throws Exception {
        ScriptedRunners runners = new ScriptedRunners();
        Task huge = task("huge", ResourceRequest.of(1, 4096));
        Job job = new Job("starved", TaskGraph.builder().task(huge).build());

        try (ConcurrentEngine engine = new ConcurrentEngine(runners.registry(), config(2, 1024))) {
            Thread control = new Thread(() -> engine.run(job), "control");
            control.start();
            Thread.sleep(150);
            assertTrue(control.isAlive());

            control.interrupt();
            control.join(5000);
            assertFalse(control.isAlive());
        }

        assertEquals(TaskStatus.READY, huge.status());
        assertEquals(JobStatus.QUEUED, job.status());
        assertTrue(runners.started().isEmpty());
    }

    @Test
    @DisplayName("Oversized tasks sharing an id across jobs are each reported")
    void starvationWarnedPerTask() throws Exception {
        Logger engineLog = (Logger) LoggerFactory.getLogger(ConcurrentEngine.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        engineLog.addAppender(appender);

        Job first = new Job("first", TaskGraph.builder().task(task("huge", ResourceRequest.of(1, 4096))).build());
        Job second = new Job("second", TaskGraph.builder().task(task("huge", ResourceRequest.of(1, 4096))).build());

        try (ConcurrentEngine engine = new ConcurrentEngine(new ScriptedRunners().registry(), config(2, 1024))) {
            Thread control = new Thread(() -> engine.run(first, second), "control");
            control.start();
            Thread.sleep(150);
            control.interrupt();
            control.join(5000);
            assertFalse(control.isAlive());
        } finally {
            engineLog.detachAppender(appender);
        }

        long warnings;
        synchronized (appender.list) {
            warnings = appender.list.stream()
                    .filter(e -> e.getLevel() == Level.WARN)
                    .filter(e -> e.getFormattedMessage().contains("never be admitted"))
                    .count();
        }
        assertEquals(2, warnings);
    }
}
