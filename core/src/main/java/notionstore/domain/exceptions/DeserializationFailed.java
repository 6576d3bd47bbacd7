package notionstore.domain.exceptions;

/**
 * Thrown when a body returned by Notion can not be read into the expected model.
 */
public class DeserializationFailed extends RuntimeException implements InternalException {
    public DeserializationFailed(final Throwable cause) {
        super(cause);
    }
}
