package notionstore.domain.storage;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The only exception that crosses the storage interface. The kind is stable and safe to switch on,
 * the message and context carry whatever detail the remote service or local validation produced.
 */
public class StorageFailure extends RuntimeException {
    private final StorageErrorKind kind;
    private final Map<String, String> context;

    public StorageFailure(final StorageErrorKind kind, final String message) {
        this(kind, message, null);
    }

    public StorageFailure(final StorageErrorKind kind, final String message, @Nullable final Throwable cause) {
        super(message, cause);
        this.kind = Preconditions.checkNotNull(kind);
        this.context = new LinkedHashMap<>();
    }

    public StorageErrorKind getKind() {
        return kind;
    }

    public Map<String, String> getContext() {
        return Collections.unmodifiableMap(context);
    }

    public StorageFailure withContext(final String key, final String value) {
        context.put(key, value);
        return this;
    }

    public boolean is(final StorageErrorKind kind) {
        return this.kind == kind;
    }

    @Override
    public String toString() {
        final String contextText = context.isEmpty()
                ? ""
                : context.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining(", ", " { ", " }"));
        return kind + " => " + getMessage() + contextText;
    }
}
