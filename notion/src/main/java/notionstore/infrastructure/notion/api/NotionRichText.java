package notionstore.infrastructure.notion.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * One run of rich text. Only the rendered plain text, the link and the annotations are kept.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotionRichText(@Nullable String type,
                             @Nullable @JsonProperty("plain_text") String plainText,
                             @Nullable String href,
                             @Nullable NotionAnnotations annotations) {
    public static NotionRichText of(final String plainText) {
        return new NotionRichText("text", plainText, null, NotionAnnotations.plain());
    }

    public String getPlainText() {
        return Objects.requireNonNullElse(plainText, "");
    }

    public NotionAnnotations getAnnotations() {
        return Objects.requireNonNullElse(annotations, NotionAnnotations.plain());
    }
}
