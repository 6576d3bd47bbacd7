package notionstore.domain.exceptions;

/**
 * Represents a request header that could not be built or sent, usually because the credentials contain
 * characters that are not allowed in a header value.
 */
public class InvalidHeader extends RuntimeException implements InternalException {
    public InvalidHeader(final String message) {
        super(message);
    }

    public InvalidHeader(final String message, final Throwable cause) {
        super(message, cause);
    }
}
