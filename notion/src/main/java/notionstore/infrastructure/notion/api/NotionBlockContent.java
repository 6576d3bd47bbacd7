package notionstore.infrastructure.notion.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The type specific part of a block. Most block types only populate the rich text, the rest add one or two
 * of the other fields.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotionBlockContent(@Nullable @JsonProperty("rich_text") List<NotionRichText> richText,
                                 @Nullable Boolean checked,
                                 @Nullable String language,
                                 @Nullable String url,
                                 @Nullable String title,
                                 @Nullable String expression,
                                 @Nullable List<NotionRichText> caption,
                                 @Nullable NotionIcon icon,
                                 @Nullable NotionFileLink external,
                                 @Nullable NotionFileLink file) {

    public static NotionBlockContent text(final List<NotionRichText> richText) {
        return new NotionBlockContent(richText, null, null, null, null, null, null, null, null, null);
    }

    public static NotionBlockContent toDo(final List<NotionRichText> richText, final boolean checked) {
        return new NotionBlockContent(richText, checked, null, null, null, null, null, null, null, null);
    }

    public static NotionBlockContent code(final List<NotionRichText> richText, final String language) {
        return new NotionBlockContent(richText, null, language, null, null, null, null, null, null, null);
    }

    public static NotionBlockContent link(final String url) {
        return new NotionBlockContent(null, null, null, url, null, null, null, null, null, null);
    }

    public static NotionBlockContent titled(final String title) {
        return new NotionBlockContent(null, null, null, null, title, null, null, null, null, null);
    }

    public List<NotionRichText> getRichText() {
        return Objects.requireNonNullElse(richText, List.of());
    }

    public List<NotionRichText> getCaption() {
        return Objects.requireNonNullElse(caption, List.of());
    }

    public boolean isChecked() {
        return Boolean.TRUE.equals(checked);
    }

    /**
     * Files are either hosted by Notion or linked externally, and a few blocks put the link at the top level.
     */
    public Optional<String> getLinkUrl() {
        return Optional.ofNullable(url)
                .or(() -> Optional.ofNullable(external).map(NotionFileLink::url))
                .or(() -> Optional.ofNullable(file).map(NotionFileLink::url));
    }
}
