package fr.lapetina.genstudio.orchestrator;

import fr.lapetina.genstudio.orchestrator.exception.CapacityExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Global concurrency budget N.
 *
 * Two counters:
 * - reservations: tasks waiting for admission plus tasks running an attempt; checked by submit
 * - in-flight slots: attempts with an adapter call outstanding; never above N
 *
 * A task waiting out a retry backoff holds neither.
 */
public final class ConcurrencyBudget {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyBudget.class);

    // Threshold for warning about approaching capacity (percentage)
    private static final double CAPACITY_WARNING_THRESHOLD = 0.8;

    private final int maxConcurrency;
    private final AtomicInteger reserved = new AtomicInteger(0);
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private volatile boolean capacityWarningLogged = false;

    public ConcurrencyBudget(int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1, got " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
        log.info("ConcurrencyBudget initialized: maxConcurrency={}", maxConcurrency);
    }

    /**
     * Reserves a slot for a new task, failing when all N are taken.
     *
     * @throws CapacityExceededException if the budget is saturated
     */
    public void tryReserve() {
        while (true) {
            int current = reserved.get();
            if (current >= maxConcurrency) {
                log.warn("Submission rejected: reserved={}/{}", current, maxConcurrency);
                throw new CapacityExceededException(
                        CapacityExceededException.Reason.CONCURRENCY_BUDGET_SATURATED,
                        "reserved " + current + "/" + maxConcurrency);
            }
            if (reserved.compareAndSet(current, current + 1)) {
                checkCapacityThreshold(current + 1);
                return;
            }
        }
    }

    /**
     * Reserves unconditionally; used for queued submissions and re-admission after backoff.
     */
    public void reserve() {
        checkCapacityThreshold(reserved.incrementAndGet());
    }

    public void release() {
        int remaining = reserved.updateAndGet(current -> current > 0 ? current - 1 : 0);
        log.debug("Reservation released: reserved={}/{}", remaining, maxConcurrency);
    }

    /**
     * Takes an in-flight slot for an attempt about to call its adapter.
     * @return true if slot acquired, false if N attempts are already running
     */
    public boolean tryAcquireSlot() {
        while (true) {
            int current = inFlight.get();
            if (current >= maxConcurrency) {
                return false;
            }
            if (inFlight.compareAndSet(current, current + 1)) {
                log.debug("Slot acquired: inFlight={}/{}", current + 1, maxConcurrency);
                return true;
            }
        }
    }

    public void releaseSlot() {
        int remaining = inFlight.updateAndGet(current -> current > 0 ? current - 1 : 0);
        log.debug("Slot released: inFlight={}/{}", remaining, maxConcurrency);
    }

    public boolean hasFreeSlot() {
        return inFlight.get() < maxConcurrency;
    }

    private void checkCapacityThreshold(int current) {
        double utilization = (double) current / maxConcurrency;
        if (utilization >= CAPACITY_WARNING_THRESHOLD && !capacityWarningLogged) {
            log.warn("Approaching concurrency budget: reserved={}/{} ({}%)",
                    current, maxConcurrency, (int) (utilization * 100));
            capacityWarningLogged = true;
        } else if (utilization < CAPACITY_WARNING_THRESHOLD * 0.9) {
            // Reset warning flag when utilization drops significantly
            capacityWarningLogged = false;
        }
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public int getReserved() {
        return reserved.get();
    }

    public int getInFlight() {
        return inFlight.get();
    }
}
