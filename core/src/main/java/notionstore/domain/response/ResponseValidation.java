package notionstore.domain.response;

import jakarta.ws.rs.core.Response;

/**
 * Checks a response before its entity is read, throwing an exception that describes any failure.
 */
public interface ResponseValidation {
    Response validate(Response response, String uri);
}
