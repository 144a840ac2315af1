package work.forge.scaffold.config;

import java.util.Locale;

/**
 * Authentication flavours. {@link #COMPLETE} adds refresh tokens, email verification and
 * password reset on top of {@link #BASIC} login/register.
 */
public enum AuthMode {
    NONE,
    BASIC,
    COMPLETE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean enabled() {
        return this != NONE;
    }

    public static AuthMode from(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return AuthMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unsupported auth type: " + value);
        }
    }
}
