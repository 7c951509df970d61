package io.llmc.core.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Search and capability filters over model listings. Null limits and false flags do not filter.
 */
public record ModelFilter(
    String query,
    boolean tools,
    boolean reasoning,
    boolean vision,
    boolean audio,
    boolean code,
    Long minContext,
    Long minInput,
    Long minOutput,
    Double maxInputPrice,
    Double maxOutputPrice
) implements Predicate<ModelMetadata> {

    public static final ModelFilter NONE = new ModelFilter(null, false, false, false, false, false,
        null, null, null, null, null);

    public ModelFilter {
        query = query == null || query.isBlank() ? null : query.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean test(ModelMetadata model) {
        if (query != null && !matchesQuery(model)) {
            return false;
        }
        if ((tools && !model.supportsTools())
            || (reasoning && !model.supportsReasoning())
            || (vision && !model.supportsVision())
            || (audio && !model.supportsAudio())
            || (code && !model.supportsCode())) {
            return false;
        }
        if (minContext != null && !atLeast(model.contextLength(), minContext)) {
            return false;
        }
        // A model without a separate input limit accepts up to its context length.
        if (minInput != null && !atLeast(model.maxInputTokens(), minInput) && !atLeast(model.contextLength(), minInput)) {
            return false;
        }
        if (minOutput != null && !atLeast(model.maxOutputTokens(), minOutput)) {
            return false;
        }
        // Unknown prices pass price ceilings.
        if (maxInputPrice != null && model.inputPricePerMillion() != null && model.inputPricePerMillion() > maxInputPrice) {
            return false;
        }
        return maxOutputPrice == null || model.outputPricePerMillion() == null
            || model.outputPricePerMillion() <= maxOutputPrice;
    }

    public List<ModelMetadata> apply(List<ModelMetadata> models) {
        List<ModelMetadata> matching = new ArrayList<>();
        for (ModelMetadata model : models) {
            if (test(model)) {
                matching.add(model);
            }
        }
        return matching;
    }

    /**
     * Parses token counts such as {@code 128000}, {@code 128k} or {@code 1.5m}.
     */
    public static long parseTokenCount(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Token count must not be empty");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        long multiplier = 1;
        if (value.endsWith("k")) {
            multiplier = 1_000;
            value = value.substring(0, value.length() - 1);
        } else if (value.endsWith("m")) {
            multiplier = 1_000_000;
            value = value.substring(0, value.length() - 1);
        }
        try {
            double count = Double.parseDouble(value) * multiplier;
            if (count < 0 || Double.isNaN(count) || Double.isInfinite(count)) {
                throw new NumberFormatException(raw);
            }
            return (long) count;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid token count format: '" + raw + "'", e);
        }
    }

    private boolean matchesQuery(ModelMetadata model) {
        return contains(model.id()) || contains(model.displayName()) || contains(model.description());
    }

    private boolean contains(String value) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(query);
    }

    private static boolean atLeast(Integer actual, long minimum) {
        return actual != null && actual >= minimum;
    }
}
