package notionstore.infrastructure.notion.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * A page property as returned by the Notion API. The type field says which of the other fields is populated.
 * See https://developers.notion.com/reference/page-property-values
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotionProperty(@Nullable String id,
                             String type,
                             @Nullable List<NotionRichText> title,
                             @Nullable @JsonProperty("rich_text") List<NotionRichText> richText,
                             @Nullable NotionSelectOption select,
                             @Nullable NotionSelectOption status,
                             @Nullable @JsonProperty("multi_select") List<NotionSelectOption> multiSelect,
                             @Nullable Boolean checkbox,
                             @Nullable BigDecimal number,
                             @Nullable String url,
                             @Nullable String email,
                             @Nullable @JsonProperty("phone_number") String phoneNumber,
                             @Nullable NotionDate date,
                             @Nullable @JsonProperty("created_time") String createdTime,
                             @Nullable @JsonProperty("last_edited_time") String lastEditedTime,
                             @Nullable List<NotionUser> people) {

    public static NotionProperty ofType(final String id, final String type) {
        return new NotionProperty(id, type, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static NotionProperty title(final String id, final List<NotionRichText> title) {
        return new NotionProperty(id, "title", title, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static NotionProperty richText(final String id, final List<NotionRichText> richText) {
        return new NotionProperty(id, "rich_text", null, richText, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static NotionProperty select(final String id, @Nullable final NotionSelectOption select) {
        return new NotionProperty(id, "select", null, null, select, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static NotionProperty status(final String id, @Nullable final NotionSelectOption status) {
        return new NotionProperty(id, "status", null, null, null, status, null, null, null, null, null, null, null, null, null, null);
    }

    public static NotionProperty multiSelect(final String id, final List<NotionSelectOption> options) {
        return new NotionProperty(id, "multi_select", null, null, null, null, options, null, null, null, null, null, null, null, null, null);
    }

    public static NotionProperty checkbox(final String id, @Nullable final Boolean checkbox) {
        return new NotionProperty(id, "checkbox", null, null, null, null, null, checkbox, null, null, null, null, null, null, null, null);
    }

    public static NotionProperty number(final String id, @Nullable final BigDecimal number) {
        return new NotionProperty(id, "number", null, null, null, null, null, null, number, null, null, null, null, null, null, null);
    }

    public static NotionProperty url(final String id, @Nullable final String url) {
        return new NotionProperty(id, "url", null, null, null, null, null, null, null, url, null, null, null, null, null, null);
    }

    public static NotionProperty email(final String id, @Nullable final String email) {
        return new NotionProperty(id, "email", null, null, null, null, null, null, null, null, email, null, null, null, null, null);
    }

    public static NotionProperty phoneNumber(final String id, @Nullable final String phoneNumber) {
        return new NotionProperty(id, "phone_number", null, null, null, null, null, null, null, null, null, phoneNumber, null, null, null, null);
    }

    public static NotionProperty date(final String id, @Nullable final NotionDate date) {
        return new NotionProperty(id, "date", null, null, null, null, null, null, null, null, null, null, date, null, null, null);
    }

    public static NotionProperty createdTime(final String id, @Nullable final String createdTime) {
        return new NotionProperty(id, "created_time", null, null, null, null, null, null, null, null, null, null, null, createdTime, null, null);
    }

    public static NotionProperty lastEditedTime(final String id, @Nullable final String lastEditedTime) {
        return new NotionProperty(id, "last_edited_time", null, null, null, null, null, null, null, null, null, null, null, null, lastEditedTime, null);
    }

    public static NotionProperty people(final String id, final List<NotionUser> people) {
        return new NotionProperty(id, "people", null, null, null, null, null, null, null, null, null, null, null, null, null, people);
    }

    public List<NotionRichText> getTitle() {
        return Objects.requireNonNullElse(title, List.of());
    }

    public List<NotionRichText> getRichText() {
        return Objects.requireNonNullElse(richText, List.of());
    }

    public List<NotionSelectOption> getMultiSelect() {
        return Objects.requireNonNullElse(multiSelect, List.of());
    }

    public List<NotionUser> getPeople() {
        return Objects.requireNonNullElse(people, List.of());
    }
}
