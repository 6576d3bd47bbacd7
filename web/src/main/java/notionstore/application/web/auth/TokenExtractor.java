package notionstore.application.web.auth;

import jakarta.ws.rs.core.MultivaluedMap;

import java.util.Optional;

/**
 * Finds the Notion integration token a caller sent with a request.
 */
public interface TokenExtractor {
    Optional<String> extract(MultivaluedMap<String, String> headers);
}
