package notionstore.domain.properties;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes each property as a double quoted scalar, sorted by key so the same properties always produce the
 * same bytes.
 * <p>
 * <pre>
 * ---
 * Name: "Roadmap"
 * Tags: "a, b"
 * ---
 *
 * body
 * </pre>
 */
@ApplicationScoped
public class QuotedFrontmatterRenderer implements FrontmatterRenderer {
    private static final String DELIMITER = "---\n";

    /**
     * Code point order is UTF-8 byte order. Plain {@code String} order differs once a surrogate pair is compared
     * with a character at or above U+E000.
     */
    public static final Comparator<String> KEY_ORDER =
            Comparator.comparing((String key) -> key.codePoints().toArray(), Arrays::compare);

    @Override
    public String render(final Map<String, PropertyValue> properties, final String body) {
        if (properties == null || properties.isEmpty()) {
            return body;
        }

        final StringBuilder frontmatter = new StringBuilder(DELIMITER);
        final Map<String, PropertyValue> sorted = new TreeMap<>(KEY_ORDER);
        sorted.putAll(properties);
        sorted.forEach((key, value) -> frontmatter
                .append(key)
                .append(": \"")
                .append(escape(value.asText()))
                .append("\"\n"));

        return frontmatter
                .append(DELIMITER)
                .append("\n")
                .append(body)
                .toString();
    }

    /**
     * Backslashes go first, otherwise the ones added for newlines and quotes would be doubled.
     */
    public String escape(final String value) {
        return value
                .replace("\\", "\\\\")
                .replace("\n", "\\n")
                .replace("\"", "\\\"");
    }
}
