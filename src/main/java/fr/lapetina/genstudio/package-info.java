/**
 * GenStudio orchestrator - resilient task orchestration for content-generation providers.
 *
 * <p>Callers submit generation tasks against named providers (image compositing, video models).
 * The orchestrator admits them under a global concurrency budget, runs one provider attempt at a
 * time per task, retries transient failures with backoff, and isolates failing providers behind
 * per-provider circuit breakers. Every state change is applied by a single LMAX Disruptor consumer.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.genstudio.OrchestratorFactory} - Main entry point for creating
 *       a fully-configured orchestrator from YAML configuration</li>
 *   <li>{@link fr.lapetina.genstudio.GenStudioApplication} - Standalone HTTP server
 *       exposing tasks, event streams and provider health</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("config.yaml").start()) {
 *     TaskOrchestrator orchestrator = factory.getOrchestrator();
 *
 *     String taskId = orchestrator.submit("luma", GenerationRequest.ofPrompt("A lighthouse at dusk"));
 *     try (TaskSubscription updates = orchestrator.subscribe(taskId)) {
 *         updates.forEachRemaining(snapshot -> System.out.println(snapshot.status()));
 *     }
 * }
 * }</pre>
 *
 * @see fr.lapetina.genstudio.OrchestratorFactory
 * @see fr.lapetina.genstudio.orchestrator.TaskOrchestrator
 */
package fr.lapetina.genstudio;
