package notionstore.infrastructure.notion.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * The body Notion returns with any unsuccessful status code.
 * See https://developers.notion.com/reference/status-codes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotionErrorResponse(@Nullable String object,
                                  int status,
                                  @Nullable String code,
                                  @Nullable String message) {
}
