package notionstore.domain.exceptions;

/**
 * Marker interface for external exceptions. These exceptions originate with the remote service or the network
 * between us and it, and the same call may behave differently if it is made again.
 */
public interface ExternalException {
}
