package notionstore.domain.exceptions;

/**
 * Marker interface for internal exceptions. Usually this means a configuration error or invalid inputs.
 * Making the same call again will produce the same result.
 */
public interface InternalException {
}
