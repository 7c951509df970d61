package io.llmc.core.error;

public class ConfigException extends LlmcException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, null, null, null, cause);
    }

    public ConfigException(String message, String operation, String provider) {
        super(message, operation, provider, null, null);
    }

    public static ConfigException unknownProvider(String name) {
        return new UnknownProviderException(name);
    }

    public static final class UnknownProviderException extends ConfigException {
        public UnknownProviderException(String name) {
            super("Provider '" + name + "' not found");
        }
    }
}
