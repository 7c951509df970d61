package io.llmc.core.gateway;

/**
 * Restrictions fixed for the lifetime of one gateway instance. Blank values mean "no restriction".
 */
public record GatewayFilter(String provider, String model, String apiKey) {

    public static final GatewayFilter NONE = new GatewayFilter(null, null, null);

    public GatewayFilter {
        provider = provider == null ? "" : provider.trim();
        model = model == null ? "" : model.trim();
        apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public boolean hasProvider() {
        return !provider.isEmpty();
    }

    public boolean hasModel() {
        return !model.isEmpty();
    }

    public boolean requiresKey() {
        return !apiKey.isEmpty();
    }

    /** Whether a requested or listed model passes the model filter. */
    public boolean allowsModel(String requested, String resolvedModel) {
        if (!hasModel()) {
            return true;
        }
        return model.equals(resolvedModel) || (requested != null && requested.contains(model));
    }
}
