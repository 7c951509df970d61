package io.llmc.core.client;

import java.util.Objects;

/** A concrete provider and the model name understood by that provider. */
public record ModelTarget(String provider, String model) {

    public ModelTarget {
        Objects.requireNonNull(provider, "provider must not be null");
        model = model == null ? "" : model.trim();
    }

    @Override
    public String toString() {
        return provider + ":" + model;
    }
}
