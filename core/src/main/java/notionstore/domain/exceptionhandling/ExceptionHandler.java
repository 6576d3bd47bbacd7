package notionstore.domain.exceptionhandling;

/**
 * Builds a message suitable for displaying to an end user from an exception.
 */
public interface ExceptionHandler {
    String getExceptionMessage(Throwable e);
}
