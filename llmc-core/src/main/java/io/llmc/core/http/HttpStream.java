package io.llmc.core.http;

import java.util.concurrent.atomic.AtomicBoolean;
import okhttp3.Call;
import okhttp3.Response;
import okio.BufferedSource;

/**
 * An open streaming response. Closing before the body is exhausted cancels the call, which discards its connection.
 */
public final class HttpStream implements AutoCloseable {
    private final Call call;
    private final Response response;
    private final ConcurrencyLimiter.Permit permit;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean completed;

    HttpStream(Call call, Response response, ConcurrencyLimiter.Permit permit) {
        this.call = call;
        this.response = response;
        this.permit = permit;
    }

    public int status() {
        return response.code();
    }

    public String contentType() {
        return response.header("Content-Type", "");
    }

    public BufferedSource source() {
        return response.body().source();
    }

    public void markCompleted() {
        completed = true;
    }

    public boolean canceled() {
        return call.isCanceled();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (!completed) {
                call.cancel();
            }
            response.close();
        } finally {
            permit.close();
        }
    }
}
