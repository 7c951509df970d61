package io.llmc.core.error;

public class LlmcException extends RuntimeException {
    private final String operation;
    private final String provider;
    private final String upstreamBody;

    public LlmcException(String message, String operation, String provider, String upstreamBody, Throwable cause) {
        super(compose(message, operation, provider, upstreamBody), cause);
        this.operation = operation == null ? "" : operation;
        this.provider = provider == null ? "" : provider;
        this.upstreamBody = upstreamBody == null ? "" : upstreamBody;
    }

    public LlmcException(String message) {
        this(message, null, null, null, null);
    }

    public String operation() {
        return operation;
    }

    public String provider() {
        return provider;
    }

    public String upstreamBody() {
        return upstreamBody;
    }

    private static String compose(String message, String operation, String provider, String upstreamBody) {
        StringBuilder builder = new StringBuilder(message == null ? "" : message);
        if (operation != null && !operation.isBlank()) {
            builder.append(" [operation=").append(operation);
            if (provider != null && !provider.isBlank()) {
                builder.append(", provider=").append(provider);
            }
            builder.append(']');
        } else if (provider != null && !provider.isBlank()) {
            builder.append(" [provider=").append(provider).append(']');
        }
        if (upstreamBody != null && !upstreamBody.isBlank()) {
            builder.append(": ").append(upstreamBody);
        }
        return builder.toString();
    }
}
