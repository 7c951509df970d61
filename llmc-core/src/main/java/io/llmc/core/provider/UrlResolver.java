package io.llmc.core.provider;

import io.llmc.core.config.model.ProviderConfig;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds operation URLs from a provider's endpoint and configured paths.
 *
 * <p>Absolute paths are used verbatim. Otherwise the endpoint and path are joined with exactly one
 * {@code /}. Placeholders are substituted in a single scan, so values are never re-expanded and
 * unknown placeholders stay intact.
 */
public final class UrlResolver {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_.-]+)}");

    private final ProviderRegistry registry;

    public UrlResolver(ProviderRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public String resolveUrl(String providerName, Operation operation, String modelName) {
        ProviderConfig provider = registry.require(providerName);
        return resolveUrl(provider, operation, modelName);
    }

    public static String resolveUrl(ProviderConfig provider, Operation operation, String modelName) {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        String path = substitute(operation.pathFor(provider), modelName, provider.vars());
        if (isAbsolute(path)) {
            return path;
        }
        return join(provider.endpoint(), path);
    }

    public static boolean pathContainsModel(ProviderConfig provider, Operation operation) {
        String path = operation.pathFor(provider);
        return path.contains("{model}") || path.contains("{model_name}");
    }

    static String join(String endpoint, String path) {
        String base = trimTrailingSlashes(endpoint);
        String tail = trimLeadingSlashes(path);
        if (tail.isEmpty()) {
            return base;
        }
        return base + "/" + tail;
    }

    static String substitute(String template, String modelName, Map<String, String> vars) {
        if (template == null || template.indexOf('{') < 0) {
            return template == null ? "" : template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            String value = lookup(key, modelName, vars);
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? matcher.group() : value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String lookup(String key, String modelName, Map<String, String> vars) {
        if ("model".equals(key) || "model_name".equals(key)) {
            return modelName;
        }
        return vars == null ? null : vars.get(key);
    }

    private static boolean isAbsolute(String path) {
        return path.startsWith("http://") || path.startsWith("https://");
    }

    private static String trimTrailingSlashes(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }

    private static String trimLeadingSlashes(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '/') {
            start++;
        }
        return value.substring(start);
    }
}
