package notionstore.domain.exceptions;

/**
 * Thrown when a response model can not be written as JSON.
 */
public class SerializationFailed extends RuntimeException implements InternalException {
    public SerializationFailed(final Throwable cause) {
        super(cause);
    }
}
