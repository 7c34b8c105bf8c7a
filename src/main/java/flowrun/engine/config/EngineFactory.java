package flowrun.engine.config;

import flowrun.engine.core.ConcurrentEngine;
import flowrun.engine.core.Engine;
import flowrun.engine.core.SequentialEngine;
import flowrun.engine.core.TaskHook;
import flowrun.engine.runner.RunnerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Wires an engine from configuration.
 *
 * Usage:
 *
 * <pre>
 * try (Engine engine = EngineFactory.create(new File("engine.ini"), beforeHook, afterHook)) {
 *     engine.run(job);
 * }
 * </pre>
 */
public final class EngineFactory {

    private static final Logger log = LoggerFactory.getLogger(EngineFactory.class);

    private EngineFactory() {
    }

    /**
     * Create the engine selected by {@link EngineConfig#mode()}.
     */
    public static Engine create(EngineConfig config, RunnerRegistry runners, TaskHook beforeTask, TaskHook afterTask) {
        log.info("Creating {} engine with {}", config.mode(), config);
        return switch (config.mode()) {
            case SEQUENTIAL -> new SequentialEngine(runners, beforeTask, afterTask);
            case CONCURRENT -> new ConcurrentEngine(runners, config, beforeTask, afterTask);
        };
    }

    public static Engine create(EngineConfig config, RunnerRegistry runners) {
        return create(config, runners, TaskHook.NOOP, TaskHook.NOOP);
    }

    /**
     * Create an engine from an INI file holding both [engine] and [runners].
     * Settings missing from the file fall back to the environment.
     *
     * @throws IllegalArgumentException if the file has no usable [runners] section
     */
    public static Engine create(File iniFile, TaskHook beforeTask, TaskHook afterTask) {
        EngineConfig config = EngineConfigLoader.loadConfig(iniFile).orElseGet(EngineConfig::fromEnv);
        RunnerRegistry runners = EngineConfigLoader.loadRunners(iniFile)
                .orElseThrow(() -> new IllegalArgumentException("No runners configured in " + iniFile));
        return create(config, runners, beforeTask, afterTask);
    }
}
