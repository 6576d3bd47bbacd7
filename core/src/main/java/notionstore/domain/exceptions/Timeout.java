package notionstore.domain.exceptions;

/**
 * Thrown when the Notion API does not answer within the configured connect or read timeout.
 */
public class Timeout extends RuntimeException implements ExternalException {
    public Timeout(final String message) {
        super(message);
    }

    public Timeout(final String message, final Throwable cause) {
        super(message, cause);
    }
}
