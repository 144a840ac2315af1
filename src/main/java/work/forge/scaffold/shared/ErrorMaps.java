package work.forge.scaffold.shared;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalizes throwables into {@code {code, message}} maps for serialized reports.
 */
public final class ErrorMaps {
    private ErrorMaps() {}

    public static Map<String, Object> normalize(Throwable error) {
        if (error instanceof GenerationException ge) {
            return toMap(ge.code(), messageOf(ge));
        }
        if (error == null) {
            return toMap("unexpected_error", "Unexpected error");
        }
        return toMap("unexpected_error", messageOf(error));
    }

    public static String messageOf(Throwable error) {
        if (error == null) {
            return "Unexpected error";
        }
        var message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    private static Map<String, Object> toMap(String code, String message) {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code);
        map.put("message", message);
        return map;
    }
}
