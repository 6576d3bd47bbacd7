package notionstore.application.web;

import notionstore.domain.properties.PropertyValue;

import java.util.Map;

public record PageJsonResponse(String id, Map<String, PropertyValue> properties, String content) {
}
