package notionstore.infrastructure.notion.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NotionBlockChildrenResponse(@Nullable List<NotionBlock> results,
                                          @Nullable @JsonProperty("next_cursor") String nextCursor,
                                          @JsonProperty("has_more") boolean hasMore) {
    public List<NotionBlock> getResults() {
        return Objects.requireNonNullElse(results, List.of());
    }
}
