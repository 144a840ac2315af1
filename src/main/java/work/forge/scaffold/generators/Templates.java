package work.forge.scaffold.generators;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads artifact templates from {@code /templates} on the classpath and fills {@code {{name}}}
 * placeholders. Spaced forms such as {@code {{ name }}} are left untouched so Jinja markup in the
 * generated project survives rendering.
 */
public final class Templates {
    private static final String ROOT = "/templates/";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([a-z][a-z0-9_]*)\\}\\}");
    private static final Map<String, String> CACHE = new ConcurrentHashMap<>();

    private Templates() {}

    public static String load(String name) {
        return CACHE.computeIfAbsent(name, Templates::read);
    }

    public static String render(String name, Map<String, String> values) {
        return fill(name, load(name), values);
    }

    static String fill(String name, String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder builder = new StringBuilder(template.length());
        while (matcher.find()) {
            String key = matcher.group(1);
            String value = values.get(key);
            if (value == null) {
                throw new IllegalStateException("Template '" + name + "' references unknown placeholder '" + key + "'");
            }
            matcher.appendReplacement(builder, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    private static String read(String name) {
        try (InputStream in = Templates.class.getResourceAsStream(ROOT + name)) {
            if (in == null) {
                throw new IllegalStateException("Template not found: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read template: " + name, ex);
        }
    }
}
