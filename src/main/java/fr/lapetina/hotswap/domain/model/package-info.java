/**
 * Domain model classes representing core concepts of the hot-swap controller.
 *
 * <p>This package contains immutable value objects and thread-safe entities
 * shared by the router, the lifecycle controller and the HTTP API.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.hotswap.domain.model.ModelRequest} - Immutable request to be forwarded</li>
 *   <li>{@link fr.lapetina.hotswap.domain.model.ModelResponse} - Worker response carried verbatim, or a controller error</li>
 *   <li>{@link fr.lapetina.hotswap.domain.model.WorkerHandle} - Thread-safe representation of one worker slot</li>
 *   <li>{@link fr.lapetina.hotswap.domain.model.ArtifactVersion} - Immutable stored artifact</li>
 *   <li>{@link fr.lapetina.hotswap.domain.model.LifecycleState} - Per-model lifecycle states</li>
 *   <li>{@link fr.lapetina.hotswap.domain.model.ErrorType} - Categorized error types with their HTTP status</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code ModelRequest}, {@code ModelResponse} and {@code ArtifactVersion} are immutable records.
 * {@code WorkerHandle} uses {@code AtomicInteger} and {@code AtomicReference} for mutable state.
 */
package fr.lapetina.hotswap.domain.model;
