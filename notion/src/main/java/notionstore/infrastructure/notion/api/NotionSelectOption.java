package notionstore.infrastructure.notion.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NotionSelectOption(@Nullable String id, @Nullable String name, @Nullable String color) {
    public static NotionSelectOption of(final String name) {
        return new NotionSelectOption(null, name, null);
    }
}
