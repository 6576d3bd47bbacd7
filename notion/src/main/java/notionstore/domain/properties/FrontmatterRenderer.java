package notionstore.domain.properties;

import java.util.Map;

/**
 * Prepends a metadata block built from page properties to rendered content.
 */
public interface FrontmatterRenderer {
    /**
     * @param properties The normalized properties. An empty map leaves the body untouched.
     * @param body       The rendered page
     * @return The body with the frontmatter in front of it
     */
    String render(Map<String, PropertyValue> properties, String body);
}
