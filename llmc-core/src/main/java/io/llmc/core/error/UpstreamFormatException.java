package io.llmc.core.error;

public class UpstreamFormatException extends LlmcException {

    public UpstreamFormatException(String message, String operation, String provider, String upstreamBody) {
        super(message, operation, provider, upstreamBody, null);
    }
}
