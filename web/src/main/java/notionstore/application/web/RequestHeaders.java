package notionstore.application.web;

import jakarta.ws.rs.core.MultivaluedMap;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Header names are case insensitive, but a plain MultivaluedMap is not.
 */
public final class RequestHeaders {
    private RequestHeaders() {
    }

    public static Optional<String> first(final MultivaluedMap<String, String> headers, final String name) {
        if (headers == null) {
            return Optional.empty();
        }

        return headers.entrySet().stream()
                .filter(entry -> StringUtils.equalsIgnoreCase(entry.getKey(), name))
                .map(entry -> Objects.requireNonNullElse(entry.getValue(), List.<String>of()))
                .flatMap(List::stream)
                .filter(Objects::nonNull)
                .findFirst();
    }
}
