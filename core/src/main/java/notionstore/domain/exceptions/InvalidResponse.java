package notionstore.domain.exceptions;

/**
 * Thrown when Notion answers with a status that is neither a success nor one of the
 * statuses with a dedicated exception. The raw body is kept so the error object can be read later.
 */
public class InvalidResponse extends RuntimeException implements ExternalException {
    private final String body;
    private final int code;

    public InvalidResponse(final String message, final String body, final int code) {
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
