package notionstore.domain.exceptions;

/**
 * Represents a HTTP 404 response
 */
public class MissingResponse extends RuntimeException implements InternalException {
    private final String body;

    public MissingResponse(final String message) {
        super(message);
        this.body = "";
    }

    public MissingResponse(final String message, final String body) {
        super(message);
        this.body = body;
    }

    public String getBody() {
        return body;
    }
}
