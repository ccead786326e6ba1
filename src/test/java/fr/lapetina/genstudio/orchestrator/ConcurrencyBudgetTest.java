package fr.lapetina.genstudio.orchestrator;

import fr.lapetina.genstudio.orchestrator.exception.CapacityExceededException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencyBudgetTest {

    @Test
    @DisplayName("should reject reservations beyond N")
    void shouldRejectBeyondN() {
        ConcurrencyBudget budget = new ConcurrencyBudget(2);
        budget.tryReserve();
        budget.tryReserve();

        assertThatThrownBy(budget::tryReserve)
                .isInstanceOf(CapacityExceededException.class)
                .extracting(e -> ((CapacityExceededException) e).getReason())
                .isEqualTo(CapacityExceededException.Reason.CONCURRENCY_BUDGET_SATURATED);

        budget.release();
        budget.tryReserve();
        assertThat(budget.getReserved()).isEqualTo(2);
    }

    @Test
    @DisplayName("should never hand out more than N in-flight slots")
    void shouldCapInFlightSlots() {
        ConcurrencyBudget budget = new ConcurrencyBudget(1);

        assertThat(budget.tryAcquireSlot()).isTrue();
        assertThat(budget.tryAcquireSlot()).isFalse();
        assertThat(budget.hasFreeSlot()).isFalse();

        budget.releaseSlot();
        assertThat(budget.hasFreeSlot()).isTrue();
    }

    @Test
    @DisplayName("should not go below zero on extra releases")
    void shouldNotGoNegative() {
        ConcurrencyBudget budget = new ConcurrencyBudget(3);
        budget.release();
        budget.releaseSlot();

        assertThat(budget.getReserved()).isZero();
        assertThat(budget.getInFlight()).isZero();
    }

    @Test
    @DisplayName("should admit exactly N concurrent reservations under contention")
    void shouldHoldUnderContention() throws Exception {
        ConcurrencyBudget budget = new ConcurrencyBudget(5);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        List<Runnable> jobs = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            jobs.add(() -> {
                try {
                    start.await();
                    budget.tryReserve();
                    accepted.incrementAndGet();
                } catch (CapacityExceededException e) {
                    // expected once saturated
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        jobs.forEach(pool::execute);
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(accepted.get()).isEqualTo(5);
        assertThat(budget.getReserved()).isEqualTo(5);
    }
}
