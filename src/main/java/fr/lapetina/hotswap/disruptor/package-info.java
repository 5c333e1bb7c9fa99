/**
 * LMAX Disruptor-based bus carrying lifecycle events to observers.
 *
 * <h2>Handler Stages</h2>
 * <p>Events flow through handlers in sequence:
 * <pre>
 * Log → Metrics → History
 * </pre>
 *
 * <p>Publishers never block: a full ring buffer drops the event and counts it.
 *
 * @see fr.lapetina.hotswap.disruptor.LifecycleEventBus
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.hotswap.disruptor;
