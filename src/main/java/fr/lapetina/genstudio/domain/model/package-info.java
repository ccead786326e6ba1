/**
 * Domain model of the generation orchestrator.
 *
 * <p>Every type in this package is an immutable value that is safe to hand to callers
 * on any thread.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.genstudio.domain.model.TaskSnapshot} - Immutable view of a task</li>
 *   <li>{@link fr.lapetina.genstudio.domain.model.TaskStatus} - Task lifecycle states and legal transitions</li>
 *   <li>{@link fr.lapetina.genstudio.domain.model.GenerationRequest} - Opaque payload owned by a task</li>
 *   <li>{@link fr.lapetina.genstudio.domain.model.GenerationResult} - Output reference set on success</li>
 *   <li>{@link fr.lapetina.genstudio.domain.model.ErrorKind} - Error taxonomy with fixed dispositions</li>
 *   <li>{@link fr.lapetina.genstudio.domain.model.ProviderHealth} - Breaker state per provider</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code result} is non-null iff {@code status == SUCCEEDED}</li>
 *   <li>{@code lastError} is non-null iff at least one attempt failed</li>
 *   <li>{@code history} is append-only; each snapshot carries one more entry than its predecessor</li>
 * </ul>
 */
package fr.lapetina.genstudio.domain.model;
