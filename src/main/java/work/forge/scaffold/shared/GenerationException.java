package work.forge.scaffold.shared;

/**
 * Base of every scaffolding failure. Carries a stable {@code code} so reports and the CLI
 * can classify errors without inspecting exception types.
 */
public class GenerationException extends RuntimeException {
    private final String code;

    public GenerationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public GenerationException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
