package notionstore.domain.properties;

import notionstore.infrastructure.notion.api.NotionProperty;

import java.util.Optional;

/**
 * Converts one remote property into a normalized value.
 */
public interface PropertyNormalizer {
    /**
     * @param property The property as returned by the API
     * @return The value, or empty if the property carries nothing worth representing. Empty text and empty
     * lists are never returned as values.
     */
    Optional<PropertyValue> normalize(NotionProperty property);
}
