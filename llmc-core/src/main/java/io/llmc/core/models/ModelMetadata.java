package io.llmc.core.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelMetadata(
    String id,
    String displayName,
    String description,
    String ownedBy,
    Long created,
    Integer contextLength,
    Integer maxInputTokens,
    Integer maxOutputTokens,
    Double inputPricePerMillion,
    Double outputPricePerMillion,
    boolean supportsTools,
    boolean supportsVision,
    boolean supportsAudio,
    boolean supportsReasoning,
    boolean supportsCode,
    boolean supportsStreaming
) {

    public ModelMetadata {
        Objects.requireNonNull(id, "id must not be null");
    }

    public static ModelMetadata of(String id) {
        return new ModelMetadata(id, null, null, null, null, null, null, null, null, null,
            false, false, false, false, false, true);
    }
}
