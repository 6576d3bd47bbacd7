package notionstore.domain.exceptionhandling;

import io.vavr.control.Try;

/**
 * Maps the failure of a Try into a known exception type.
 */
public interface ExceptionMapping {
    <T> Try<T> map(Try<T> tryObject);
}
