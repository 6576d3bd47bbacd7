package notionstore.domain.properties;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import notionstore.infrastructure.notion.api.NotionPage;
import notionstore.infrastructure.notion.api.NotionProperty;
import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Normalizes every property of a page. The returned maps have no defined order, so anything that renders
 * them must sort.
 */
@ApplicationScoped
public class PropertyMapNormalizer {

    @Inject
    private PropertyNormalizer propertyNormalizer;

    /**
     * Keys the values by property name.
     */
    public Map<String, PropertyValue> normalize(final NotionPage page) {
        return normalize(page, (name, property) -> name);
    }

    /**
     * Keys the values by property id. Properties without an id fall back to their name.
     */
    public Map<String, PropertyValue> normalizeById(final NotionPage page) {
        return normalize(page, (name, property) -> StringUtils.isBlank(property.id()) ? name : property.id());
    }

    private Map<String, PropertyValue> normalize(final NotionPage page, final BiFunction<String, NotionProperty, String> key) {
        final Map<String, PropertyValue> properties = new HashMap<>();

        page.getProperties().forEach((name, property) ->
                propertyNormalizer.normalize(property)
                        .ifPresent(value -> properties.put(key.apply(name, property), value)));

        return properties;
    }
}
