/**
 * Per-model lifecycle: the two worker slots, the hold queue, and the controller
 * that promotes new artifacts between slots without losing requests.
 *
 * <p>One {@link fr.lapetina.hotswap.lifecycle.ModelEntry} exists per model name,
 * created through {@link fr.lapetina.hotswap.lifecycle.ModelRegistry}. Every mutation
 * of a model's state goes through its {@link fr.lapetina.hotswap.lifecycle.LifecycleController}.
 */
package fr.lapetina.hotswap.lifecycle;
