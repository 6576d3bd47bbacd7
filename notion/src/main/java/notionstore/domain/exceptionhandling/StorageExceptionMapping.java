package notionstore.domain.exceptionhandling;

import io.vavr.API;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import notionstore.domain.exceptions.InvalidResponse;
import notionstore.domain.exceptions.MissingResponse;
import notionstore.domain.exceptions.UnauthorizedResponse;
import notionstore.domain.json.JsonDeserializer;
import notionstore.domain.storage.StorageErrorKind;
import notionstore.domain.storage.StorageFailure;
import notionstore.infrastructure.notion.api.NotionErrorResponse;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Predicates.instanceOf;

/**
 * Translates the exceptions raised by the Notion client into storage failures.
 * Every remote failure is expected to pass through here exactly once; storage failures pass through untouched.
 */
@ApplicationScoped
public class StorageExceptionMapping implements ExceptionMapping {
    private static final Map<Integer, StorageErrorKind> STATUS_KINDS = Map.of(
            400, StorageErrorKind.INVALID_INPUT,
            401, StorageErrorKind.PERMISSION_DENIED,
            403, StorageErrorKind.PERMISSION_DENIED,
            404, StorageErrorKind.NOT_FOUND);

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private Logger logger;

    /**
     * Maps an HTTP status to the kind of storage failure it represents.
     */
    public static StorageErrorKind kindForStatus(final int status) {
        return STATUS_KINDS.getOrDefault(status, StorageErrorKind.UNEXPECTED);
    }

    @Override
    public <T> Try<T> map(final Try<T> tryObject) {
        checkNotNull(tryObject);

        return tryObject.mapFailure(API.Case(API.$(), this::translate));
    }

    public StorageFailure translate(final Throwable throwable) {
        checkNotNull(throwable);

        final StorageFailure failure = API.Match(throwable).of(
                API.Case(API.$(instanceOf(StorageFailure.class)), StorageFailure.class::cast),
                API.Case(API.$(instanceOf(InvalidResponse.class)),
                        ex -> fromInvalidResponse((InvalidResponse) ex)),
                API.Case(API.$(instanceOf(MissingResponse.class)),
                        ex -> fromResponse(404, ((MissingResponse) ex).getBody(), ex)),
                API.Case(API.$(instanceOf(UnauthorizedResponse.class)),
                        ex -> fromUnauthorizedResponse((UnauthorizedResponse) ex)),
                API.Case(API.$(this::isCancellation),
                        ex -> new StorageFailure(StorageErrorKind.UNEXPECTED, "operation was cancelled", ex)
                                .withContext("cancelled", "true")),
                API.Case(API.$(),
                        ex -> new StorageFailure(StorageErrorKind.UNEXPECTED, messageOf(ex), ex)
                                .withContext("source", ex.getClass().getSimpleName())));

        if (failure != throwable && failure.is(StorageErrorKind.UNEXPECTED) && !failure.getContext().containsKey("cancelled")) {
            logger.log(Level.SEVERE, "Unexpected failure calling Notion: " + failure, throwable);
        }

        return failure;
    }

    private StorageFailure fromInvalidResponse(final InvalidResponse ex) {
        return fromResponse(ex.getCode(), ex.getBody(), ex);
    }

    private StorageFailure fromUnauthorizedResponse(final UnauthorizedResponse ex) {
        return fromResponse(ex.getCode(), ex.getBody(), ex);
    }

    private StorageFailure fromResponse(final int status, final String body, final Throwable cause) {
        final NotionErrorResponse error = parseError(body);

        final String message = error != null && StringUtils.isNotBlank(error.message())
                ? error.message()
                : messageOf(cause);

        final StorageFailure failure = new StorageFailure(kindForStatus(status), message, cause)
                .withContext("status", Integer.toString(status));

        if (error != null && StringUtils.isNotBlank(error.code())) {
            failure.withContext("code", error.code());
        }

        return failure;
    }

    @Nullable
    private NotionErrorResponse parseError(final String body) {
        if (StringUtils.isBlank(body)) {
            return null;
        }

        // Proxies and gateways return HTML or plain text, so a body that is not a Notion error is ignored
        return Try.of(() -> jsonDeserializer.deserialize(body, NotionErrorResponse.class))
                .getOrNull();
    }

    private boolean isCancellation(final Throwable throwable) {
        return throwable instanceof InterruptedException
                || throwable instanceof CancellationException
                || throwable.getCause() instanceof InterruptedException;
    }

    private static String messageOf(final Throwable throwable) {
        return StringUtils.defaultIfBlank(throwable.getMessage(), throwable.getClass().getSimpleName());
    }
}
