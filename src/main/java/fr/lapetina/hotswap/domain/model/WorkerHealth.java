package fr.lapetina.hotswap.domain.model;

/**
 * Health status of a worker process slot.
 *
 * STARTING: process launch requested, health probe not yet passed
 * READY: health probe passed, slot may receive traffic
 * UNHEALTHY: probe or forwarding failures exceeded the threshold
 * STOPPED: process not running
 */
public enum WorkerHealth {
    STARTING,
    READY,
    UNHEALTHY,
    STOPPED
}
