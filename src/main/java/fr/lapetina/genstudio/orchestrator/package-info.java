/**
 * LMAX Disruptor-based orchestration of generation tasks.
 *
 * <p>Every task transition is an event on a single ring buffer with one consumer, the
 * {@code TransitionHandler}. Caller threads, attempt
 * callbacks and timers only publish; they never mutate task or breaker state directly.
 *
 * <h2>Event Flow</h2>
 * <pre>
 * submit ─► SUBMITTED ─► admission queue ─► attempt (worker pool) ─► ATTEMPT_COMPLETED
 *                              ▲                                           │
 *                              └──────────── RETRY_DUE ◄── backoff ◄───────┘
 * cancel ─► CANCEL_REQUESTED ─► (grace period) ─► CANCEL_GRACE_EXPIRED
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.genstudio.orchestrator.TaskOrchestrator} - Public entry point</li>
 *   <li>{@link fr.lapetina.genstudio.orchestrator.ConcurrencyBudget} - Global budget of N in-flight attempts</li>
 *   <li>{@link fr.lapetina.genstudio.orchestrator.TaskSubscription} - Ordered stream of task snapshots</li>
 *   <li>{@link fr.lapetina.genstudio.orchestrator.exception.CapacityExceededException} - Thrown when admission is refused</li>
 * </ul>
 *
 * @see fr.lapetina.genstudio.orchestrator.TaskOrchestrator
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.genstudio.orchestrator;
