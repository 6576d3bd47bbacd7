package notionstore.infrastructure.notion.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NotionAnnotations(boolean bold,
                                boolean italic,
                                boolean strikethrough,
                                boolean underline,
                                boolean code) {
    public static NotionAnnotations plain() {
        return new NotionAnnotations(false, false, false, false, false);
    }
}
