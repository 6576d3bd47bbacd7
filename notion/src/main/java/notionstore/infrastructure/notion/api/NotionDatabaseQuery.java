package notionstore.infrastructure.notion.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * The body of a database query. The start cursor is left out of the first request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotionDatabaseQuery(@Nullable @JsonProperty("start_cursor") String startCursor,
                                  @JsonProperty("page_size") int pageSize) {
}
