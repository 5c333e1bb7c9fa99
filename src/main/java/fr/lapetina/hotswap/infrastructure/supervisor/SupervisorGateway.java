package fr.lapetina.hotswap.infrastructure.supervisor;

/**
 * Capability interface over the external process supervisor.
 *
 * <p>Implementations are blocking and thread-safe. Callers run them off the
 * request path.
 */
public interface SupervisorGateway {

    /**
     * Starts the named process group and waits until the supervisor reports it started.
     * Starting an already running group is not an error.
     */
    void start(String groupName) throws GatewayException;

    /**
     * Gracefully stops the named process group. Stopping a stopped group is not an error.
     */
    void stop(String groupName) throws GatewayException;

    /**
     * Returns the aggregated status of the named process group.
     */
    ProcessStatus status(String groupName) throws GatewayException;
}
