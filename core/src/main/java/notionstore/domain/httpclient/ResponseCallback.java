package notionstore.domain.httpclient;

import jakarta.ws.rs.core.Response;

/**
 * Reads the result out of an open response. The response is closed by the caller.
 */
@FunctionalInterface
public interface ResponseCallback<T> {
    T handleResponse(Response response);
}
