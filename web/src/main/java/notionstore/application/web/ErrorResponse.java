package notionstore.application.web;

public record ErrorResponse(String kind, String message) {
}
