package notionstore.infrastructure.notion.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * A block as returned by the block children endpoint.
 * See https://developers.notion.com/reference/block
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotionBlock(String id,
                          String type,
                          @JsonProperty("has_children") boolean hasChildren,
                          @Nullable NotionBlockContent paragraph,
                          @Nullable @JsonProperty("heading_1") NotionBlockContent heading1,
                          @Nullable @JsonProperty("heading_2") NotionBlockContent heading2,
                          @Nullable @JsonProperty("heading_3") NotionBlockContent heading3,
                          @Nullable @JsonProperty("bulleted_list_item") NotionBlockContent bulletedListItem,
                          @Nullable @JsonProperty("numbered_list_item") NotionBlockContent numberedListItem,
                          @Nullable @JsonProperty("to_do") NotionBlockContent toDo,
                          @Nullable NotionBlockContent toggle,
                          @Nullable NotionBlockContent quote,
                          @Nullable NotionBlockContent callout,
                          @Nullable NotionBlockContent code,
                          @Nullable NotionBlockContent equation,
                          @Nullable NotionBlockContent image,
                          @Nullable NotionBlockContent bookmark,
                          @Nullable NotionBlockContent embed,
                          @Nullable @JsonProperty("link_preview") NotionBlockContent linkPreview,
                          @Nullable @JsonProperty("child_page") NotionBlockContent childPage,
                          @Nullable @JsonProperty("child_database") NotionBlockContent childDatabase) {

    /**
     * Builds a block with a single populated content field, which is how the API shapes them.
     */
    public static NotionBlock of(final String id, final String type, final boolean hasChildren, final NotionBlockContent content) {
        return new NotionBlock(id, type, hasChildren,
                "paragraph".equals(type) ? content : null,
                "heading_1".equals(type) ? content : null,
                "heading_2".equals(type) ? content : null,
                "heading_3".equals(type) ? content : null,
                "bulleted_list_item".equals(type) ? content : null,
                "numbered_list_item".equals(type) ? content : null,
                "to_do".equals(type) ? content : null,
                "toggle".equals(type) ? content : null,
                "quote".equals(type) ? content : null,
                "callout".equals(type) ? content : null,
                "code".equals(type) ? content : null,
                "equation".equals(type) ? content : null,
                "image".equals(type) ? content : null,
                "bookmark".equals(type) ? content : null,
                "embed".equals(type) ? content : null,
                "link_preview".equals(type) ? content : null,
                "child_page".equals(type) ? content : null,
                "child_database".equals(type) ? content : null);
    }

    /**
     * Returns the content matching the block type, or an empty content for types that carry none (like divider).
     */
    public NotionBlockContent getContent() {
        final NotionBlockContent content = switch (Objects.requireNonNullElse(type, "")) {
            case "paragraph" -> paragraph;
            case "heading_1" -> heading1;
            case "heading_2" -> heading2;
            case "heading_3" -> heading3;
            case "bulleted_list_item" -> bulletedListItem;
            case "numbered_list_item" -> numberedListItem;
            case "to_do" -> toDo;
            case "toggle" -> toggle;
            case "quote" -> quote;
            case "callout" -> callout;
            case "code" -> code;
            case "equation" -> equation;
            case "image" -> image;
            case "bookmark" -> bookmark;
            case "embed" -> embed;
            case "link_preview" -> linkPreview;
            case "child_page" -> childPage;
            case "child_database" -> childDatabase;
            default -> null;
        };
        return Objects.requireNonNullElse(content, NotionBlockContent.text(null));
    }
}
