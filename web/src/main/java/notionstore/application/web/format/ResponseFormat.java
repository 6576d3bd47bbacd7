package notionstore.application.web.format;

public enum ResponseFormat {
    JSON,
    MARKDOWN
}
