package flowrun.engine.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Configuration holder for engine settings.
 * All settings have sensible defaults.
 */
public final class EngineConfig {

    // Resource budget
    private int ramMb = 4096;
    private int cpuCount = Runtime.getRuntime().availableProcessors();

    // Worker pool
    private Integer poolSize = null; // null: one worker per core
    private Duration pollInterval = Duration.ofMillis(100);

    private EngineMode mode = EngineMode.CONCURRENT;

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        EngineConfig config = new EngineConfig();

        String ram = System.getenv("FLOWRUN_RAM_MB");
        if (ram != null && !ram.isBlank()) {
            config.withRamMb(Integer.parseInt(ram.trim()));
        }

        String cpu = System.getenv("FLOWRUN_CPU");
        if (cpu != null && !cpu.isBlank()) {
            config.withCpuCount(Integer.parseInt(cpu.trim()));
        }

        String pool = System.getenv("FLOWRUN_POOL_SIZE");
        if (pool != null && !pool.isBlank()) {
            config.withPoolSize(Integer.parseInt(pool.trim()));
        }

        String poll = System.getenv("FLOWRUN_POLL_MS");
        if (poll != null && !poll.isBlank()) {
            config.withPollInterval(Duration.ofMillis(Long.parseLong(poll.trim())));
        }

        String mode = System.getenv("FLOWRUN_MODE");
        if (mode != null && !mode.isBlank()) {
            config.withMode(EngineMode.valueOf(mode.trim().toUpperCase(Locale.ROOT)));
        }

        return config;
    }

    // Getters
    public int ramMb() {
        return ramMb;
    }

    public int cpuCount() {
        return cpuCount;
    }

    public int poolSize() {
        return poolSize != null ? poolSize : cpuCount;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public EngineMode mode() {
        return mode;
    }

    // Fluent setters for testing/customization
    public EngineConfig withRamMb(int ramMb) {
        if (ramMb < 0) {
            throw new IllegalArgumentException("ramMb must not be negative, got " + ramMb);
        }
        this.ramMb = ramMb;
        return this;
    }

    public EngineConfig withCpuCount(int cpuCount) {
        if (cpuCount <= 0) {
            throw new IllegalArgumentException("cpuCount must be positive, got " + cpuCount);
        }
        this.cpuCount = cpuCount;
        return this;
    }

    public EngineConfig withPoolSize(int poolSize) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive, got " + poolSize);
        }
        this.poolSize = poolSize;
        return this;
    }

    public EngineConfig withPollInterval(Duration pollInterval) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive, got " + pollInterval);
        }
        this.pollInterval = pollInterval;
        return this;
    }

    public EngineConfig withMode(EngineMode mode) {
        this.mode = mode;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "ramMb=" + ramMb +
                ", cpuCount=" + cpuCount +
                ", poolSize=" + poolSize() +
                ", pollInterval=" + pollInterval.toMillis() + "ms" +
                ", mode=" + mode +
                '}';
    }
}
