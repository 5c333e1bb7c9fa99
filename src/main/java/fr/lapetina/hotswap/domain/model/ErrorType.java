package fr.lapetina.hotswap.domain.model;

/**
 * Error taxonomy for routed requests and lifecycle operations.
 */
public enum ErrorType {
    /** Model name was never registered */
    NOT_FOUND(404),

    /** Forwarding to the active worker failed */
    UPSTREAM_UNAVAILABLE(503),

    /** Standby slot never reached READY within the readiness bound */
    PROMOTION_TIMEOUT(503),

    /** Gateway or process error while starting the standby slot */
    PROMOTION_FAILED(503),

    /** A held request exceeded its maximum wait */
    QUEUE_TIMEOUT(504),

    /** Supervisor RPC endpoint unreachable or returned a fault */
    GATEWAY_ERROR(502),

    /** Request cancelled by the client while held */
    CANCELLED(503),

    /** Internal system error */
    INTERNAL_ERROR(500);

    private final int httpStatus;

    ErrorType(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
