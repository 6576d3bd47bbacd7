package notionstore.application.web;

import jakarta.inject.Inject;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import notionstore.domain.storage.StorageErrorKind;
import notionstore.domain.storage.StorageFailure;

import java.util.logging.Logger;

/**
 * Turns storage failures into HTTP responses with a small JSON body.
 */
@Provider
public class StorageFailureMapper implements ExceptionMapper<StorageFailure> {
    @Inject
    private Logger logger;

    public static Response.Status statusFor(final StorageErrorKind kind) {
        return switch (kind) {
            case INVALID_INPUT, NOT_A_DIRECTORY, UNSUPPORTED -> Response.Status.BAD_REQUEST;
            case PERMISSION_DENIED -> Response.Status.UNAUTHORIZED;
            case NOT_FOUND -> Response.Status.NOT_FOUND;
            case CONFIG_INVALID, UNEXPECTED -> Response.Status.INTERNAL_SERVER_ERROR;
        };
    }

    @Override
    public Response toResponse(final StorageFailure exception) {
        final Response.Status status = statusFor(exception.getKind());

        if (status.getFamily() == Response.Status.Family.CLIENT_ERROR) {
            logger.warning("Rejected request: " + exception);
        }

        return Response.status(status)
                .entity(new ErrorResponse(exception.getKind().name(), exception.getMessage()))
                .type(MediaType.APPLICATION_JSON_TYPE)
                .build();
    }
}
