package work.forge.scaffold.config;

import java.util.List;
import java.util.Objects;

/**
 * Authentication block of the configuration. {@code features} holds the descriptive labels the
 * wizard records (e.g. "Email Verification"); generation is driven by {@code mode} alone.
 *
 * <p>Refresh tokens come with complete auth only. A recorded flag that contradicts the mode is
 * rejected; without auth the flag is ignored.
 */
public record AuthSettings(AuthMode mode, boolean refreshToken, List<String> features) {
    public static final List<String> COMPLETE_FEATURES = List.of(
        "Email Verification",
        "Password Reset",
        "Email Service"
    );

    public AuthSettings {
        Objects.requireNonNull(mode, "mode");
        if (mode == AuthMode.BASIC && refreshToken) {
            throw new ConfigurationException("Basic auth does not support refresh tokens");
        }
        if (mode == AuthMode.COMPLETE && !refreshToken) {
            throw new ConfigurationException("Complete auth always issues refresh tokens");
        }
        refreshToken = refreshToken && mode == AuthMode.COMPLETE;
        features = features == null ? List.of() : List.copyOf(features);
    }

    public static AuthSettings none() {
        return new AuthSettings(AuthMode.NONE, false, List.of());
    }

    public static AuthSettings basic() {
        return new AuthSettings(AuthMode.BASIC, false, List.of());
    }

    public static AuthSettings complete() {
        return new AuthSettings(AuthMode.COMPLETE, true, COMPLETE_FEATURES);
    }

    public static AuthSettings forMode(AuthMode mode) {
        return switch (mode) {
            case NONE -> none();
            case BASIC -> basic();
            case COMPLETE -> complete();
        };
    }
}
