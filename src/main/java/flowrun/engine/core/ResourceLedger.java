package flowrun.engine.core;

import flowrun.engine.model.ResourceRequest;

/**
 * Bookkeeping of free CPU cores and RAM against fixed totals.
 *
 * A {@link ResourceRequest#CPU_ALL} request is granted only when every core is
 * free and takes the exclusive lock instead of cores; while the lock is held
 * nothing else is admitted. Available values always stay within
 * {@code [0, total]}.
 *
 * Not thread-safe: owned by the engine's control thread.
 */
public final class ResourceLedger {

    private final int totalCpu;
    private final int totalRamMb;

    private int availableCpu;
    private int availableRamMb;
    private boolean exclusiveLock;

    public ResourceLedger(int totalCpu, int totalRamMb) {
        if (totalCpu <= 0) {
            throw new IllegalArgumentException("totalCpu must be positive, got " + totalCpu);
        }
        if (totalRamMb < 0) {
            throw new IllegalArgumentException("totalRamMb must not be negative, got " + totalRamMb);
        }
        this.totalCpu = totalCpu;
        this.totalRamMb = totalRamMb;
        this.availableCpu = totalCpu;
        this.availableRamMb = totalRamMb;
    }

    /**
     * Try to admit a request.
     *
     * @return true if granted and the ledger was debited, false if it must wait
     */
    public boolean tryAcquire(ResourceRequest request) {
        if (exclusiveLock) {
            return false;
        }
        if (request.memMb() > availableRamMb) {
            return false;
        }
        if (request.isExclusive()) {
            if (availableCpu != totalCpu) {
                return false;
            }
        } else if (request.cpu() > availableCpu) {
            return false;
        }

        availableRamMb -= request.memMb();
        if (request.isExclusive()) {
            exclusiveLock = true;
        } else {
            availableCpu -= request.cpu();
        }
        return true;
    }

    /**
     * Give back what {@link #tryAcquire} granted for the same request.
     */
    public void release(ResourceRequest request) {
        if (availableRamMb + request.memMb() > totalRamMb) {
            throw new IllegalStateException("Releasing " + request + " overflows RAM: " + summary());
        }
        if (request.isExclusive()) {
            if (!exclusiveLock) {
                throw new IllegalStateException("Releasing " + request + " without the exclusive lock: " + summary());
            }
        } else if (availableCpu + request.cpu() > totalCpu) {
            throw new IllegalStateException("Releasing " + request + " overflows CPU: " + summary());
        }

        availableRamMb += request.memMb();
        if (request.isExclusive()) {
            exclusiveLock = false;
        } else {
            availableCpu += request.cpu();
        }
    }

    /**
     * True if the request could not be granted even on an idle machine.
     */
    public boolean exceedsCapacity(ResourceRequest request) {
        return request.memMb() > totalRamMb || (!request.isExclusive() && request.cpu() > totalCpu);
    }

    public int totalCpu() {
        return totalCpu;
    }

    public int totalRamMb() {
        return totalRamMb;
    }

    public int availableCpu() {
        return availableCpu;
    }

    public int availableRamMb() {
        return availableRamMb;
    }

    public boolean isExclusiveLocked() {
        return exclusiveLock;
    }

    /** Compact state for logs, e.g. {@code 2/4L;1024/2048}. */
    public String summary() {
        return availableCpu + "/" + totalCpu + (exclusiveLock ? "L" : "") + ";" + availableRamMb + "/" + totalRamMb;
    }

    @Override
    public String toString() {
        return "ResourceLedger{" + summary() + "}";
    }
}
