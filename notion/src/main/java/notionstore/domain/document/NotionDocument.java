package notionstore.domain.document;

import notionstore.domain.properties.PropertyValue;
import notionstore.infrastructure.notion.api.NotionPage;

import java.util.Map;

/**
 * A page with its normalized properties and rendered markdown body.
 */
public record NotionDocument(NotionPage page, Map<String, PropertyValue> properties, String markdown) {
    public NotionDocument {
        properties = Map.copyOf(properties);
    }

    public String id() {
        return page.id();
    }
}
