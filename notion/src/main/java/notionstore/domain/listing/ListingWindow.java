package notionstore.domain.listing;

import notionstore.domain.storage.StorageErrorKind;
import notionstore.domain.storage.StorageFailure;

/**
 * A slice of the full ordered listing.
 */
public record ListingWindow(int offset, int limit) {
    public ListingWindow {
        if (offset < 0) {
            throw new StorageFailure(StorageErrorKind.INVALID_INPUT, "offset must not be negative")
                    .withContext("offset", Integer.toString(offset));
        }

        if (limit <= 0) {
            throw new StorageFailure(StorageErrorKind.INVALID_INPUT, "limit must be greater than zero")
                    .withContext("limit", Integer.toString(limit));
        }
    }

    /**
     * A window that covers every item.
     */
    public static ListingWindow all() {
        return new ListingWindow(0, Integer.MAX_VALUE);
    }
}
