package io.llmc.core.model;

/**
 * Streamed fragment of a tool call. Fragments sharing an index belong to the same call.
 */
public record ToolCallDelta(int index, String id, String name, String argumentsFragment) {

    public ToolCallDelta {
        argumentsFragment = argumentsFragment == null ? "" : argumentsFragment;
    }
}
