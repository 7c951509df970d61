package io.llmc.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import io.llmc.core.model.Usage;

/**
 * Reads token usage from any of the known field layouts. Returns {@code null} when none is present.
 */
public final class UsageExtractor {

    private UsageExtractor() {
    }

    public static Usage extract(JsonNode root) {
        if (root == null || !root.isObject()) {
            return null;
        }
        Usage usage = fromUsageObject(root.path("usage"));
        if (usage != null) {
            return usage;
        }
        usage = fromMetrics(root.path("metrics"));
        if (usage != null) {
            return usage;
        }
        JsonNode gemini = root.path("usageMetadata");
        if (gemini.isObject()) {
            return complete(
                longOrNull(gemini, "promptTokenCount"),
                longOrNull(gemini, "candidatesTokenCount"),
                longOrNull(gemini, "totalTokenCount")
            );
        }
        return null;
    }

    static Usage fromUsageObject(JsonNode usage) {
        if (usage == null || !usage.isObject()) {
            return null;
        }
        if (usage.has("prompt_tokens") || usage.has("completion_tokens")) {
            return complete(
                longOrNull(usage, "prompt_tokens"),
                longOrNull(usage, "completion_tokens"),
                longOrNull(usage, "total_tokens")
            );
        }
        if (usage.has("input_tokens") || usage.has("output_tokens")) {
            return complete(
                longOrNull(usage, "input_tokens"),
                longOrNull(usage, "output_tokens"),
                longOrNull(usage, "total_tokens")
            );
        }
        for (String nested : new String[] {"tokens", "billed_units"}) {
            JsonNode counts = usage.path(nested);
            if (counts.has("input_tokens") || counts.has("output_tokens")) {
                return complete(longOrNull(counts, "input_tokens"), longOrNull(counts, "output_tokens"), null);
            }
        }
        if (usage.has("total_tokens")) {
            return new Usage(0, 0, usage.path("total_tokens").asLong());
        }
        return null;
    }

    static Usage fromMetrics(JsonNode metrics) {
        if (metrics == null || !metrics.isArray() || metrics.isEmpty()) {
            return null;
        }
        Long prompt = null;
        Long completion = null;
        Long total = null;
        for (JsonNode metric : metrics) {
            String name = metric.path("metric").asText("");
            long value = metric.path("value").asLong();
            switch (name) {
                case "num_prompt_tokens" -> prompt = value;
                case "num_completion_tokens" -> completion = value;
                case "num_total_tokens" -> total = value;
                default -> {
                }
            }
        }
        if (prompt == null && completion == null && total == null) {
            return null;
        }
        return complete(prompt, completion, total);
    }

    private static Usage complete(Long input, Long output, Long total) {
        long in = input == null ? 0 : input;
        long out = output == null ? 0 : output;
        long sum = total == null ? in + out : total;
        return new Usage(in, out, sum);
    }

    private static Long longOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || !value.canConvertToLong() ? null : value.asLong();
    }
}
