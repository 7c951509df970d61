package io.llmc.core.gateway;

import io.llmc.core.error.AuthException;
import io.llmc.core.error.BackpressureException;
import io.llmc.core.error.ConfigException;
import io.llmc.core.error.GatewayException;
import io.llmc.core.error.LlmcException;
import io.llmc.core.error.TransportException;
import io.llmc.core.error.UpstreamFormatException;
import java.util.LinkedHashMap;
import java.util.Map;

/** Maps failures to HTTP status codes and OpenAI-shaped error bodies. */
final class GatewayErrors {

    private GatewayErrors() {
    }

    static int status(Throwable error) {
        if (error instanceof GatewayException gateway) {
            return gateway.status();
        }
        if (error instanceof BackpressureException) {
            return 429;
        }
        if (error instanceof ConfigException) {
            return 400;
        }
        if (error instanceof AuthException || error instanceof UpstreamFormatException) {
            return 502;
        }
        if (error instanceof TransportException transport) {
            int upstream = transport.httpStatus();
            return upstream >= 400 && upstream < 500 ? upstream : 502;
        }
        return 500;
    }

    static Map<String, Object> body(Throwable error, int status) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("message", error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage());
        detail.put("type", type(status));
        if (error instanceof LlmcException llmc) {
            if (!llmc.operation().isEmpty()) {
                detail.put("operation", llmc.operation());
            }
            if (!llmc.provider().isEmpty()) {
                detail.put("provider", llmc.provider());
            }
            if (!llmc.upstreamBody().isEmpty()) {
                detail.put("upstream_body", llmc.upstreamBody());
            }
        }
        return Map.of("error", detail);
    }

    static Map<String, Object> body(String message, int status) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("message", message);
        detail.put("type", type(status));
        return Map.of("error", detail);
    }

    private static String type(int status) {
        return switch (status) {
            case 400, 404, 405 -> "invalid_request_error";
            case 401 -> "authentication_error";
            case 403 -> "permission_error";
            case 429 -> "rate_limit_error";
            case 502, 503, 504 -> "upstream_error";
            default -> status >= 500 ? "server_error" : "invalid_request_error";
        };
    }
}
