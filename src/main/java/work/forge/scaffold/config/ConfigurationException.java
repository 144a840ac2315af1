package work.forge.scaffold.config;

import work.forge.scaffold.shared.GenerationException;

/**
 * Raised when the persisted or supplied configuration is missing a required field or holds an
 * unsupported value. Always raised before planning, so no artifact has been written.
 */
public final class ConfigurationException extends GenerationException {
    public ConfigurationException(String message) {
        super("configuration_error", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("configuration_error", message, cause);
    }
}
