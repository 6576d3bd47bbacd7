package notionstore.domain.exceptions;

/**
 * Represents a HTTP 401 or 403 response
 */
public class UnauthorizedResponse extends RuntimeException implements InternalException {
    private final String body;
    private final int code;

    public UnauthorizedResponse(final String message, final String body, final int code) {
        super(message);
        this.body = body;
        this.code = code;
    }

    public String getBody() {
        return body;
    }

    public int getCode() {
        return code;
    }
}
