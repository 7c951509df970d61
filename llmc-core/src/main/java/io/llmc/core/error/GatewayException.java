package io.llmc.core.error;

public class GatewayException extends LlmcException {
    private final int status;

    public GatewayException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
