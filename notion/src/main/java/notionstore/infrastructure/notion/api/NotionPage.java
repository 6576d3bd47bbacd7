package notionstore.infrastructure.notion.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NotionPage(String id,
                         @Nullable @JsonProperty("created_time") String createdTime,
                         @Nullable @JsonProperty("last_edited_time") String lastEditedTime,
                         @Nullable String url,
                         @Nullable Map<String, NotionProperty> properties) {

    public Map<String, NotionProperty> getProperties() {
        return Objects.requireNonNullElse(properties, Map.of());
    }
}
