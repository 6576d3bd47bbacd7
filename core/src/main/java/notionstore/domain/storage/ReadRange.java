package notionstore.domain.storage;

import org.jspecify.annotations.Nullable;

/**
 * A byte range of a read. A null size means "to the end of the content".
 */
public record ReadRange(long offset, @Nullable Long size) {
    public static ReadRange full() {
        return new ReadRange(0, null);
    }

    public static ReadRange of(final long offset, final long size) {
        return new ReadRange(offset, size);
    }

    public boolean isFull() {
        return offset == 0 && size == null;
    }
}
