package fr.lapetina.hotswap.infrastructure.supervisor;

/**
 * Raised when the process supervisor cannot be reached or rejects a call.
 */
public class GatewayException extends Exception {

    private final int faultCode;

    public GatewayException(String message) {
        this(message, 0, null);
    }

    public GatewayException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public GatewayException(String message, int faultCode, Throwable cause) {
        super(message, cause);
        this.faultCode = faultCode;
    }

    /**
     * XML-RPC fault code, or 0 when the failure was not a supervisor fault.
     */
    public int getFaultCode() {
        return faultCode;
    }
}
