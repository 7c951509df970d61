package io.llmc.core.error;

public class TransportException extends LlmcException {
    private final int httpStatus;
    private final boolean timeout;

    public TransportException(String message, String operation, String provider, int httpStatus, String upstreamBody) {
        super(message, operation, provider, upstreamBody, null);
        this.httpStatus = httpStatus;
        this.timeout = false;
    }

    public TransportException(String message, String operation, String provider, Throwable cause, boolean timeout) {
        super(message, operation, provider, null, cause);
        this.httpStatus = 0;
        this.timeout = timeout;
    }

    /** Upstream HTTP status, or 0 when no response was received. */
    public int httpStatus() {
        return httpStatus;
    }

    public boolean timeout() {
        return timeout;
    }
}
