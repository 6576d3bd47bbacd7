package notionstore.application.web.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MultivaluedMap;
import notionstore.application.web.RequestHeaders;
import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * Reads the token from an "Authorization: Bearer" header.
 */
@ApplicationScoped
public class BearerTokenExtractor implements TokenExtractor {
    private static final String SCHEME = "Bearer ";

    @Override
    public Optional<String> extract(final MultivaluedMap<String, String> headers) {
        return RequestHeaders.first(headers, HttpHeaders.AUTHORIZATION)
                .filter(value -> StringUtils.startsWithIgnoreCase(value, SCHEME))
                .map(value -> value.substring(SCHEME.length()).trim())
                .filter(StringUtils::isNotBlank);
    }
}
