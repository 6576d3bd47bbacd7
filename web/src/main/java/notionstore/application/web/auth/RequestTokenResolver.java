package notionstore.application.web.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.MultivaluedMap;
import notionstore.domain.storage.StorageErrorKind;
import notionstore.domain.storage.StorageFailure;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Tries each token extractor in turn. The bearer header wins over the custom header.
 */
@ApplicationScoped
public class RequestTokenResolver {
    @Inject
    private BearerTokenExtractor bearerTokenExtractor;

    @Inject
    private AuthHeaderTokenExtractor authHeaderTokenExtractor;

    @Inject
    private Logger logger;

    public String resolve(final MultivaluedMap<String, String> headers) {
        final String token = List.<TokenExtractor>of(bearerTokenExtractor, authHeaderTokenExtractor).stream()
                .map(extractor -> extractor.extract(headers))
                .flatMap(Optional::stream)
                .findFirst()
                .orElseThrow(() -> {
                    logger.warning("Missing Notion token in request headers");
                    return new StorageFailure(StorageErrorKind.PERMISSION_DENIED, "missing notion token");
                });

        // A token that can not be sent as a header value is treated like a bad credential
        if (StringUtils.containsAny(token, '\r', '\n')) {
            logger.warning("Rejected a Notion token containing a line break");
            throw new StorageFailure(StorageErrorKind.PERMISSION_DENIED, "invalid notion token");
        }

        return token;
    }
}
