package notionstore.domain.listing;

import com.google.common.base.Preconditions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import notionstore.domain.storage.StorageErrorKind;
import notionstore.domain.storage.StorageFailure;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Follows cursors one page at a time. Every item is visited once in the order the source returns it, and
 * any failure abandons the whole listing.
 */
@ApplicationScoped
public class CursorPaginatedLister implements PaginatedLister {

    @Inject
    private Logger logger;

    @Override
    public ListingResult list(final PageSource source, final ListingMode mode, final ListingWindow window) {
        Preconditions.checkNotNull(source);
        Preconditions.checkNotNull(mode);
        Preconditions.checkNotNull(window);

        final boolean windowed = mode != ListingMode.ACCUMULATE_ALL;
        final int offset = windowed ? window.offset() : 0;
        final int limit = windowed ? window.limit() : Integer.MAX_VALUE;

        final List<String> ids = new ArrayList<>();
        int skipped = 0;
        int visited = 0;
        int pages = 0;
        String cursor = null;

        // The null cursor means both "start" and "end", so the loop tracks whether it has started itself
        do {
            throwIfCancelled(pages, visited);

            final ListingPage page = source.fetch(cursor);
            ++pages;
            visited += page.ids().size();

            for (final String id : page.ids()) {
                if (skipped < offset) {
                    ++skipped;
                } else if (ids.size() < limit) {
                    ids.add(id);
                }
            }

            cursor = page.nextCursor();

            if (mode == ListingMode.WINDOWED && ids.size() >= limit) {
                logger.fine("Collected " + limit + " items after " + pages + " pages, not fetching any more");
                break;
            }
        } while (cursor != null);

        logger.fine("Listed " + ids.size() + " of " + visited + " visited items in " + pages + " pages");

        return new ListingResult(ids, visited);
    }

    private void throwIfCancelled(final int pages, final int visited) {
        if (Thread.currentThread().isInterrupted()) {
            throw new StorageFailure(StorageErrorKind.UNEXPECTED, "listing was cancelled before it completed")
                    .withContext("cancelled", "true")
                    .withContext("pages", Integer.toString(pages))
                    .withContext("visited", Integer.toString(visited));
        }
    }
}
