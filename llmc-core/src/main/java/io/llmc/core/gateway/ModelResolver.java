package io.llmc.core.gateway;

import io.llmc.core.client.ModelTarget;
import io.llmc.core.error.ConfigException;
import io.llmc.core.error.GatewayException;
import io.llmc.core.provider.ProviderRegistry;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps an inbound model string to a provider and model: alias, then {@code provider:model}, then the fallback
 * provider.
 */
public final class ModelResolver {
    private final ProviderRegistry registry;
    private final Map<String, String> aliases;

    public ModelResolver(ProviderRegistry registry, Map<String, String> aliases) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.aliases = aliases == null ? Map.of() : Map.copyOf(aliases);
    }

    /**
     * Resolves against the gateway filter: the filter's provider is the fallback and any resolution outside the
     * filter is rejected.
     */
    public ModelTarget resolve(String requestedModel, GatewayFilter filter) {
        GatewayFilter effective = filter == null ? GatewayFilter.NONE : filter;
        String requested = requestedModel == null ? "" : requestedModel.trim();
        if (requested.isEmpty() && effective.hasModel()) {
            requested = effective.model();
        }
        ModelTarget target = resolve(requested, effective.provider());
        if (effective.hasProvider() && !effective.provider().equals(target.provider())) {
            throw new GatewayException(400, "Model '" + requested + "' does not match the gateway provider filter '"
                + effective.provider() + "' (filter mismatch)");
        }
        if (!effective.allowsModel(requested, target.model())) {
            throw new GatewayException(400, "Model '" + requested + "' does not match the gateway model filter '"
                + effective.model() + "' (filter mismatch)");
        }
        return target;
    }

    /** Resolves with an optional fallback provider and no filter checks. */
    public ModelTarget resolve(String requestedModel, String fallbackProvider) {
        String requested = requestedModel == null ? "" : requestedModel.trim();
        Optional<ModelTarget> aliased = alias(requested);
        if (aliased.isPresent()) {
            return requireKnown(aliased.get());
        }
        int separator = requested.indexOf(':');
        if (separator > 0) {
            String provider = requested.substring(0, separator);
            if (registry.contains(provider)) {
                return new ModelTarget(provider, requested.substring(separator + 1));
            }
        }
        if (fallbackProvider != null && !fallbackProvider.isBlank() && !requested.isEmpty()) {
            return requireKnown(new ModelTarget(fallbackProvider.trim(), requested));
        }
        throw new GatewayException(400, "Cannot determine provider for model '" + requested + "' (ambiguous model)");
    }

    private Optional<ModelTarget> alias(String name) {
        String target = aliases.get(name);
        if (target == null) {
            return Optional.empty();
        }
        int separator = target.indexOf(':');
        if (separator <= 0 || separator == target.length() - 1) {
            throw new ConfigException("Alias '" + name + "' has invalid target '" + target + "'");
        }
        return Optional.of(new ModelTarget(target.substring(0, separator), target.substring(separator + 1)));
    }

    private ModelTarget requireKnown(ModelTarget target) {
        registry.require(target.provider());
        return target;
    }
}
