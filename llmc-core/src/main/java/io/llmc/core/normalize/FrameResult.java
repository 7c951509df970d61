package io.llmc.core.normalize;

import io.llmc.core.model.ChatChunk;

/**
 * Outcome of decoding one stream frame. {@code chunk} may be {@code null} for frames that carry nothing to emit.
 */
record FrameResult(ChatChunk chunk, boolean terminal) {

    static final FrameResult SKIP = new FrameResult(null, false);
    static final FrameResult END = new FrameResult(null, true);

    static FrameResult of(ChatChunk chunk) {
        return new FrameResult(chunk, false);
    }
}
