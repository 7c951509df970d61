package io.llmc.core.http;

import java.nio.charset.StandardCharsets;

public record HttpResult(int status, String contentType, byte[] body) {

    public HttpResult {
        contentType = contentType == null ? "" : contentType;
        body = body == null ? new byte[0] : body;
    }

    public String bodyString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean eventStream() {
        return contentType.contains("text/event-stream");
    }
}
