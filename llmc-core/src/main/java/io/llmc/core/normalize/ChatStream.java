package io.llmc.core.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.core.error.TransportException;
import io.llmc.core.http.HttpStream;
import io.llmc.core.model.ChatChunk;
import io.llmc.core.model.Usage;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazy, finite, non-restartable sequence of chunks read from an upstream streaming response.
 *
 * <p>Each {@code data:} line (or bare JSON line) is decoded on its own. {@code [DONE]}, a terminal event or the end
 * of the body ends the sequence. Malformed frames are skipped. A plain JSON body becomes a single chunk. Closing
 * early cancels the upstream call.
 */
public final class ChatStream implements Iterator<ChatChunk>, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ChatStream.class);
    private static final int LOG_PREVIEW = 200;

    private final HttpStream stream;
    private final String provider;
    private final ResponseNormalizer normalizer;
    private final ObjectMapper mapper;
    private final boolean singleDocument;
    private final List<Consumer<ChatStream>> completionListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean completionFired = new AtomicBoolean(false);

    private volatile boolean closed;
    private boolean finished;
    private ChatChunk next;
    private Usage usage;
    private String finishReason;

    public ChatStream(HttpStream stream, String provider, ResponseNormalizer normalizer, ObjectMapper mapper) {
        this.stream = Objects.requireNonNull(stream, "stream must not be null");
        this.provider = provider == null ? "" : provider;
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        String contentType = stream.contentType().toLowerCase();
        this.singleDocument = contentType.contains("application/json") && !contentType.contains("event-stream");
    }

    /** Invoked once when the stream ends, whether exhausted, failed or closed. */
    public void onComplete(Consumer<ChatStream> listener) {
        completionListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public String provider() {
        return provider;
    }

    /** Usage accumulated from the frames read so far, or {@code null} if upstream reported none. */
    public Usage usage() {
        return usage;
    }

    public String finishReason() {
        return finishReason;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished || closed) {
            return false;
        }
        try {
            next = singleDocument ? readDocument() : readFrame();
        } catch (RuntimeException e) {
            finish();
            throw e;
        }
        if (next == null) {
            finish();
            return false;
        }
        return true;
    }

    @Override
    public ChatChunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException("stream exhausted");
        }
        ChatChunk chunk = next;
        next = null;
        return chunk;
    }

    @Override
    public void close() {
        closed = true;
        stream.close();
        fireCompletion();
    }

    private ChatChunk readDocument() {
        finished = true;
        byte[] body;
        try {
            body = stream.source().readByteArray();
        } catch (IOException e) {
            throw readFailure(e);
        }
        stream.markCompleted();
        ChatChunk chunk = ChunkFormat.fromResponse(normalizer.parse(body, provider));
        record(chunk);
        return chunk;
    }

    private ChatChunk readFrame() {
        BufferedSource source = stream.source();
        while (true) {
            String line;
            try {
                line = source.readUtf8Line();
            } catch (IOException e) {
                if (closed) {
                    return null;
                }
                throw readFailure(e);
            }
            if (line == null) {
                stream.markCompleted();
                return null;
            }
            String payload = payloadOf(line);
            if (payload == null || payload.isEmpty()) {
                continue;
            }
            if ("[DONE]".equals(payload)) {
                stream.markCompleted();
                return null;
            }
            JsonNode event;
            try {
                event = mapper.readTree(payload);
            } catch (JsonProcessingException e) {
                LOG.warn("Skipping malformed stream frame from {}: {}", provider, preview(payload));
                continue;
            }
            failOnErrorFrame(event, payload);
            Optional<FrameResult> decoded = ChunkFormat.decode(event, normalizer);
            if (decoded.isEmpty()) {
                LOG.warn("Skipping unrecognized stream frame from {}: {}", provider, preview(payload));
                continue;
            }
            FrameResult result = decoded.get();
            if (result.terminal()) {
                finished = true;
                stream.markCompleted();
            }
            ChatChunk chunk = result.chunk();
            if (chunk != null && !chunk.isEmpty()) {
                record(chunk);
                return chunk;
            }
            if (result.terminal()) {
                return null;
            }
        }
    }

    private String payloadOf(String line) {
        String trimmed = line.trim();
        if (trimmed.startsWith("data:")) {
            return trimmed.substring(5).trim();
        }
        if (trimmed.startsWith("{")) {
            return trimmed;
        }
        return null;
    }

    private void failOnErrorFrame(JsonNode event, String payload) {
        boolean errorFrame = (event.has("error") && !event.has("choices"))
            || "error".equals(event.path("type").asText(""));
        if (errorFrame) {
            throw new TransportException("Upstream reported an error mid-stream", "chat", provider, 0, payload);
        }
    }

    private void record(ChatChunk chunk) {
        if (chunk.usage() != null) {
            usage = merge(usage, chunk.usage());
        }
        if (chunk.finishReason() != null) {
            finishReason = chunk.finishReason();
        }
    }

    private TransportException readFailure(IOException e) {
        boolean timeout = e instanceof InterruptedIOException;
        return new TransportException(
            (timeout ? "Upstream stream idle timeout: " : "Upstream stream failed: ") + e.getMessage(),
            "chat",
            provider,
            e,
            timeout
        );
    }

    private void finish() {
        finished = true;
        stream.close();
        fireCompletion();
    }

    private void fireCompletion() {
        if (!completionFired.compareAndSet(false, true)) {
            return;
        }
        for (Consumer<ChatStream> listener : completionListeners) {
            try {
                listener.accept(this);
            } catch (RuntimeException e) {
                LOG.warn("Stream completion listener failed: {}", e.getMessage());
            }
        }
    }

    static Usage merge(Usage previous, Usage latest) {
        if (previous == null) {
            return latest;
        }
        long input = latest.inputTokens() > 0 ? latest.inputTokens() : previous.inputTokens();
        long output = latest.outputTokens() > 0 ? latest.outputTokens() : previous.outputTokens();
        long total = Math.max(latest.totalTokens(), input + output);
        return new Usage(input, output, total);
    }

    private static String preview(String payload) {
        return payload.length() <= LOG_PREVIEW ? payload : payload.substring(0, LOG_PREVIEW) + "...";
    }
}
