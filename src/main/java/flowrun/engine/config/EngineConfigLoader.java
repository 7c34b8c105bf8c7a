package flowrun.engine.config;

import flowrun.engine.model.AppType;
import flowrun.engine.model.Task;
import flowrun.engine.model.TaskKind;
import flowrun.engine.runner.Runner;
import flowrun.engine.runner.RunnerFactory;
import flowrun.engine.runner.RunnerRegistry;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Loads engine settings and the runner table from an INI file.
 *
 * <pre>
 * [engine]
 * ram_mb = 8192
 * ; optional, host core count otherwise
 * cpu = 4
 * ; optional, cpu otherwise
 * pool_size = 4
 * poll_interval_ms = 100
 * ; concurrent or sequential
 * mode = concurrent
 *
 * [runners]
 * install.container = com.example.ImagePullRunner
 * run.command_line  = flowrun.engine.runner.ProcessRunner
 * collect_outputs   = com.example.OutputCollector
 * </pre>
 *
 * A runners key is either a task kind, or {@code kind.app_type} for kinds that
 * pick their runner by app type. The value names a {@link Runner} class with a
 * public constructor taking the {@link Task}.
 */
public final class EngineConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    static final String ENGINE_SECTION = "engine";
    static final String RUNNERS_SECTION = "runners";

    private EngineConfigLoader() {
    }

    /**
     * Read the [engine] section on top of {@link EngineConfig#defaults()}.
     *
     * @return empty if the file can't be read or has no [engine] section
     */
    public static Optional<EngineConfig> loadConfig(File file) {
        Optional<Ini> ini = read(file);
        if (ini.isEmpty()) {
            return Optional.empty();
        }
        Profile.Section engine = ini.get().get(ENGINE_SECTION);
        if (engine == null) {
            log.warn("No [{}] section in {}", ENGINE_SECTION, file);
            return Optional.empty();
        }

        EngineConfig cfg = EngineConfig.defaults();
        String ram = opt(engine, "ram_mb");
        if (ram != null) {
            cfg.withRamMb(Integer.parseInt(ram));
        }
        String cpu = opt(engine, "cpu");
        if (cpu != null) {
            cfg.withCpuCount(Integer.parseInt(cpu));
        }
        String pool = opt(engine, "pool_size");
        if (pool != null) {
            cfg.withPoolSize(Integer.parseInt(pool));
        }
        String poll = opt(engine, "poll_interval_ms");
        if (poll != null) {
            cfg.withPollInterval(Duration.ofMillis(Long.parseLong(poll)));
        }
        String mode = opt(engine, "mode");
        if (mode != null) {
            cfg.withMode(EngineMode.valueOf(mode.toUpperCase(Locale.ROOT)));
        }

        log.info("Loaded {} from {}", cfg, file);
        return Optional.of(cfg);
    }

    /**
     * Build the runner registry from the [runners] section.
     *
     * @return empty if the file can't be read or has no [runners] section
     * @throws IllegalArgumentException for unknown kinds, app types or classes
     */
    public static Optional<RunnerRegistry> loadRunners(File file) {
        Optional<Ini> ini = read(file);
        if (ini.isEmpty()) {
            return Optional.empty();
        }
        Profile.Section runners = ini.get().get(RUNNERS_SECTION);
        if (runners == null) {
            log.warn("No [{}] section in {}", RUNNERS_SECTION, file);
            return Optional.empty();
        }

        RunnerRegistry.Builder registry = RunnerRegistry.builder();
        for (String key : runners.keySet()) {
            String className = opt(runners, key);
            if (className == null) {
                throw new IllegalArgumentException("Runner class missing for key '" + key + "' in " + file);
            }
            RunnerFactory factory = reflectiveFactory(className);
            int dot = key.indexOf('.');
            if (dot < 0) {
                registry.register(TaskKind.fromKey(key), factory);
            } else {
                registry.register(TaskKind.fromKey(key.substring(0, dot)),
                        AppType.fromKey(key.substring(dot + 1)), factory);
            }
            log.debug("Runner {} -> {}", key, className);
        }
        return Optional.of(registry.build());
    }

    /**
     * Factory instantiating {@code className} through its {@code (Task)} constructor.
     */
    static RunnerFactory reflectiveFactory(String className) {
        Class<?> cls;
        try {
            cls = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Runner class not found: " + className, e);
        }
        if (!Runner.class.isAssignableFrom(cls)) {
            throw new IllegalArgumentException(className + " does not implement " + Runner.class.getName());
        }
        Constructor<? extends Runner> ctor;
        try {
            ctor = cls.asSubclass(Runner.class).getConstructor(Task.class);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(className + " has no public (Task) constructor", e);
        }

        return task -> {
            try {
                return ctor.newInstance(task);
            } catch (InvocationTargetException e) {
                throw new IllegalStateException("Cannot create " + className + " for task " + task.id(), e.getCause());
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Cannot create " + className + " for task " + task.id(), e);
            }
        };
    }

    // ===== helpers =====
    private static Optional<Ini> read(File file) {
        if (file == null || !file.isFile()) {
            log.warn("Engine config file not found: {}", file);
            return Optional.empty();
        }
        try {
            return Optional.of(new Ini(file));
        } catch (IOException e) {
            log.warn("Cannot read engine config {}", file, e);
            return Optional.empty();
        }
    }

    private static String opt(Profile.Section s, String key) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
