package notionstore.application.web.format;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MultivaluedMap;
import notionstore.application.web.RequestHeaders;

import java.util.Arrays;
import java.util.Optional;

/**
 * Picks the page representation from the request headers. A markdown Content-Type wins, then the first
 * Accept item that names a known type. Anything else gets JSON.
 */
@ApplicationScoped
public class ResponseFormatSelector {
    public ResponseFormat select(final MultivaluedMap<String, String> headers) {
        final boolean markdownContent = RequestHeaders.first(headers, HttpHeaders.CONTENT_TYPE)
                .filter(value -> value.startsWith("text/markdown"))
                .isPresent();

        if (markdownContent) {
            return ResponseFormat.MARKDOWN;
        }

        return RequestHeaders.first(headers, HttpHeaders.ACCEPT)
                .flatMap(this::fromAccept)
                .orElse(ResponseFormat.JSON);
    }

    private Optional<ResponseFormat> fromAccept(final String accept) {
        return Arrays.stream(accept.split(","))
                .map(String::trim)
                .map(this::fromMediaRange)
                .flatMap(Optional::stream)
                .findFirst();
    }

    private Optional<ResponseFormat> fromMediaRange(final String item) {
        if (item.startsWith("text/markdown") || item.startsWith("text/*")) {
            return Optional.of(ResponseFormat.MARKDOWN);
        }

        if (item.startsWith("application/json") || item.startsWith("application/*") || item.equals("*/*")) {
            return Optional.of(ResponseFormat.JSON);
        }

        return Optional.empty();
    }
}
