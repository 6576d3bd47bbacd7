package notionstore.application.web;

import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.ext.Provider;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.util.logging.Logger;

/**
 * Logs the method, path, status and duration of every request.
 */
@Provider
public class RequestLoggingFilter implements ContainerRequestFilter, ContainerResponseFilter {
    private static final String START_PROPERTY = RequestLoggingFilter.class.getName() + ".start";

    @Inject
    private Logger logger;

    public static String describe(final String method, final URI uri, final int status, final long elapsedMillis) {
        final String path = StringUtils.isBlank(uri.getRawQuery())
                ? uri.getRawPath()
                : uri.getRawPath() + "?" + uri.getRawQuery();

        return "handled " + method + " " + path + " -> " + status + " in " + elapsedMillis + "ms";
    }

    @Override
    public void filter(final ContainerRequestContext requestContext) {
        requestContext.setProperty(START_PROPERTY, System.nanoTime());
    }

    @Override
    public void filter(final ContainerRequestContext requestContext, final ContainerResponseContext responseContext) {
        final Object start = requestContext.getProperty(START_PROPERTY);
        final long elapsedMillis = start instanceof Long startNanos
                ? (System.nanoTime() - startNanos) / 1_000_000
                : 0;

        logger.info(describe(
                requestContext.getMethod(),
                requestContext.getUriInfo().getRequestUri(),
                responseContext.getStatus(),
                elapsedMillis));
    }
}
