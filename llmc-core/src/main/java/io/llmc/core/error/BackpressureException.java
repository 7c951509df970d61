package io.llmc.core.error;

public class BackpressureException extends LlmcException {

    public BackpressureException(String provider, int limit) {
        super("Too many in-flight requests (limit " + limit + ")", "send", provider, null, null);
    }
}
