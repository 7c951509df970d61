package io.llmc.core.http;

import io.llmc.core.error.TransportException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import okhttp3.Call;
import okhttp3.ConnectionPool;
import okhttp3.FormBody;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared HTTP client for all providers.
 *
 * <p>GET requests are retried on I/O errors, 429 and 5xx. POST requests are retried only when the failure happened
 * before any request bytes were written, so a chat request is never sent twice.
 */
public final class HttpTransport implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(HttpTransport.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final TransportSettings settings;
    private final OkHttpClient client;
    private final OkHttpClient streamingClient;
    private final ConcurrencyLimiter limiter;

    public HttpTransport(TransportSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool())
            .connectTimeout(settings.connectTimeout())
            .readTimeout(settings.requestTimeout())
            .writeTimeout(settings.requestTimeout())
            .callTimeout(settings.requestTimeout())
            .retryOnConnectionFailure(false)
            .eventListenerFactory(SendTracker.FACTORY);
        if (settings.insecureSkipTlsVerify()) {
            LOG.warn(
                "TLS certificate and hostname verification are DISABLED ({}=true). Do not use this outside local testing.",
                TransportSettings.INSECURE_TLS_ENV
            );
            trustEverything(builder);
        }
        this.client = builder.build();
        this.streamingClient = client.newBuilder()
            .readTimeout(settings.idleTimeout())
            .callTimeout(Duration.ZERO)
            .build();
        this.limiter = new ConcurrencyLimiter(settings.maxConcurrentPerProvider());
    }

    public TransportSettings settings() {
        return settings;
    }

    public ConcurrencyLimiter limiter() {
        return limiter;
    }

    public HttpResult get(String provider, String operation, String url, Map<String, String> headers) {
        Request.Builder builder = new Request.Builder().url(url).get();
        applyHeaders(builder, headers);
        try (ConcurrencyLimiter.Permit ignored = limiter.acquire(provider)) {
            return readFully(execute(client, builder, true, provider, operation), provider, operation);
        }
    }

    public HttpResult postJson(String provider, String operation, String url, Map<String, String> headers, byte[] body) {
        Request.Builder builder = new Request.Builder().url(url).post(RequestBody.create(body, JSON));
        applyHeaders(builder, headers);
        try (ConcurrencyLimiter.Permit ignored = limiter.acquire(provider)) {
            return readFully(execute(client, builder, false, provider, operation), provider, operation);
        }
    }

    /** Token endpoints: form POST outside the per-provider cap. */
    public HttpResult postForm(String provider, String operation, String url, Map<String, String> form) {
        FormBody.Builder formBody = new FormBody.Builder();
        form.forEach(formBody::add);
        Request.Builder builder = new Request.Builder().url(url).post(formBody.build())
            .header("Accept", "application/json");
        return readFully(execute(client, builder, false, provider, operation), provider, operation);
    }

    /** Token endpoints: GET outside the per-provider cap. */
    public HttpResult getUncapped(String provider, String operation, String url, Map<String, String> headers) {
        Request.Builder builder = new Request.Builder().url(url).get();
        applyHeaders(builder, headers);
        return readFully(execute(client, builder, true, provider, operation), provider, operation);
    }

    public HttpStream stream(String provider, String operation, String url, Map<String, String> headers, byte[] body) {
        Request.Builder builder = new Request.Builder().url(url).post(RequestBody.create(body, JSON));
        applyHeaders(builder, headers);
        if (headers == null || !headers.containsKey("Accept")) {
            builder.header("Accept", "text/event-stream, application/json");
        }
        ConcurrencyLimiter.Permit permit = limiter.acquire(provider);
        try {
            Executed executed = executeCall(streamingClient, builder, false, provider, operation);
            Response response = executed.response();
            if (!response.isSuccessful()) {
                try (response) {
                    String errorBody = response.body() == null ? "" : response.body().string();
                    throw upstreamError(response.code(), errorBody, provider, operation);
                } catch (IOException e) {
                    throw new TransportException("Failed reading error body", operation, provider, e, false);
                }
            }
            return new HttpStream(executed.call(), response, permit);
        } catch (RuntimeException e) {
            permit.close();
            throw e;
        }
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private Response execute(OkHttpClient http, Request.Builder builder, boolean idempotent, String provider, String operation) {
        return executeCall(http, builder, idempotent, provider, operation).response();
    }

    private Executed executeCall(
        OkHttpClient http,
        Request.Builder builder,
        boolean idempotent,
        String provider,
        String operation
    ) {
        int maxAttempts = settings.maxAttempts();
        long delayMs = settings.initialBackoff().toMillis();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            SendTracker.State state = new SendTracker.State();
            Call call = http.newCall(builder.tag(SendTracker.State.class, state).build());
            try {
                Response response = call.execute();
                boolean retryable = response.code() == 429 || response.code() >= 500;
                if (idempotent && retryable && attempt < maxAttempts) {
                    response.close();
                    LOG.warn("{} {} returned HTTP {}, retrying (attempt {}/{})", provider, operation, response.code(),
                        attempt, maxAttempts);
                    sleep(withJitter(delayMs), provider, operation);
                    delayMs = Math.min(delayMs * 2, settings.maxBackoff().toMillis());
                    continue;
                }
                return new Executed(call, response);
            } catch (IOException ioe) {
                boolean retryable = idempotent || !state.sent();
                if (retryable && attempt < maxAttempts) {
                    LOG.warn("{} {} failed ({}), retrying (attempt {}/{})", provider, operation, ioe.getMessage(),
                        attempt, maxAttempts);
                    sleep(withJitter(delayMs), provider, operation);
                    delayMs = Math.min(delayMs * 2, settings.maxBackoff().toMillis());
                    continue;
                }
                boolean timeout = ioe instanceof InterruptedIOException;
                throw new TransportException(
                    (timeout ? "Upstream request timed out: " : "Upstream request failed: ") + ioe.getMessage(),
                    operation,
                    provider,
                    ioe,
                    timeout
                );
            }
        }
        throw new TransportException("Exhausted retries", operation, provider, null, false);
    }

    private HttpResult readFully(Response response, String provider, String operation) {
        try (response) {
            ResponseBody body = response.body();
            byte[] bytes = body == null ? new byte[0] : body.bytes();
            if (!response.isSuccessful()) {
                throw upstreamError(response.code(), new String(bytes, StandardCharsets.UTF_8), provider,
                    operation);
            }
            return new HttpResult(response.code(), response.header("Content-Type", ""), bytes);
        } catch (IOException e) {
            boolean timeout = e instanceof InterruptedIOException;
            throw new TransportException("Failed reading upstream response: " + e.getMessage(), operation, provider, e,
                timeout);
        }
    }

    private TransportException upstreamError(int status, String body, String provider, String operation) {
        return new TransportException("Upstream returned HTTP " + status, operation, provider, status, body);
    }

    private void applyHeaders(Request.Builder builder, Map<String, String> headers) {
        if (headers == null) {
            return;
        }
        for (Map.Entry<String, String> header : headers.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
    }

    private long withJitter(long delayMs) {
        return delayMs + ThreadLocalRandom.current().nextLong(Math.max(1, delayMs / 2 + 1));
    }

    private void sleep(long delayMs, String provider, String operation) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting to retry", operation, provider, ie, false);
        }
    }

    private static void trustEverything(OkHttpClient.Builder builder) {
        X509TrustManager trustAll = new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        };
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[] {trustAll}, new SecureRandom());
            builder.sslSocketFactory(context.getSocketFactory(), trustAll);
            builder.hostnameVerifier((hostname, session) -> true);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialize insecure TLS context", e);
        }
    }

    private record Executed(Call call, Response response) {
    }
}
