package notionstore.domain.storage;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Optional;

/**
 * Metadata describing one entry. Directories carry no length, type or modification time.
 */
public record Metadata(EntryMode mode,
                       @Nullable Long contentLength,
                       @Nullable String contentType,
                       @Nullable Instant lastModified) {

    public static Metadata directory() {
        return new Metadata(EntryMode.DIR, null, null, null);
    }

    public static Metadata file(final String contentType) {
        return new Metadata(EntryMode.FILE, null, contentType, null);
    }

    public Metadata withContentLength(final long contentLength) {
        return new Metadata(mode, contentLength, contentType, lastModified);
    }

    public Metadata withLastModified(@Nullable final Instant lastModified) {
        return new Metadata(mode, contentLength, contentType, lastModified);
    }

    public boolean isDirectory() {
        return mode == EntryMode.DIR;
    }

    public Optional<Long> getContentLength() {
        return Optional.ofNullable(contentLength);
    }

    public Optional<Instant> getLastModified() {
        return Optional.ofNullable(lastModified);
    }
}
