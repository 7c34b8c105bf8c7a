package flowrun.engine.model;

/**
 * CPU and memory a task needs while it runs.
 * Immutable value; {@link #CPU_ALL} reserves every core exclusively.
 */
public record ResourceRequest(int cpu, int memMb) {

    /** Sentinel cpu value: the whole machine, with no other task alongside. */
    public static final int CPU_ALL = -1;

    public ResourceRequest {
        if (cpu == 0 || cpu < CPU_ALL) {
            throw new IllegalArgumentException("cpu must be positive or CPU_ALL, got " + cpu);
        }
        if (memMb < 0) {
            throw new IllegalArgumentException("memMb must not be negative, got " + memMb);
        }
    }

    public static ResourceRequest of(int cpu, int memMb) {
        return new ResourceRequest(cpu, memMb);
    }

    /** Request every core exclusively. */
    public static ResourceRequest exclusive(int memMb) {
        return new ResourceRequest(CPU_ALL, memMb);
    }

    public boolean isExclusive() {
        return cpu == CPU_ALL;
    }

    @Override
    public String toString() {
        return "Resources{cpu=" + (isExclusive() ? "ALL" : String.valueOf(cpu)) + ", memMb=" + memMb + "}";
    }
}
