package io.llmc.core.error;

public class AuthException extends LlmcException {

    public AuthException(String message, String provider) {
        super(message, "auth", provider, null, null);
    }

    public AuthException(String message, String provider, String upstreamBody, Throwable cause) {
        super(message, "auth", provider, upstreamBody, cause);
    }
}
