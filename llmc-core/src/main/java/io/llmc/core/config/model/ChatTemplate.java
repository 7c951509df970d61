package io.llmc.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

/**
 * Request-body template applied when {@code pattern} is found in the model name.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatTemplate(String pattern, String template) {

    public ChatTemplate {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(template, "template must not be null");
    }
}
