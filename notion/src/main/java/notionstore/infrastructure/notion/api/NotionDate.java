package notionstore.infrastructure.notion.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * A date property value. Start and end are either a bare date like 2024-01-31 or an ISO8601 date time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotionDate(@Nullable String start,
                         @Nullable String end,
                         @Nullable @JsonProperty("time_zone") String timeZone) {
    public static NotionDate of(final String start) {
        return new NotionDate(start, null, null);
    }
}
