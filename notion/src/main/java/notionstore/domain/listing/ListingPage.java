package notionstore.domain.listing;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of identifiers. A null next cursor means the collection is exhausted.
 */
public record ListingPage(List<String> ids, @Nullable String nextCursor) {
    public ListingPage {
        ids = List.copyOf(ids);
    }
}
