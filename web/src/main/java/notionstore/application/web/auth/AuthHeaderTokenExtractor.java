package notionstore.application.web.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.MultivaluedMap;
import notionstore.application.web.RequestHeaders;
import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * Reads the raw token from the custom "Auth" header.
 */
@ApplicationScoped
public class AuthHeaderTokenExtractor implements TokenExtractor {
    public static final String HEADER = "Auth";

    @Override
    public Optional<String> extract(final MultivaluedMap<String, String> headers) {
        return RequestHeaders.first(headers, HEADER)
                .map(String::trim)
                .filter(StringUtils::isNotBlank);
    }
}
