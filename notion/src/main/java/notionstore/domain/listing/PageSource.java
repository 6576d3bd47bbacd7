package notionstore.domain.listing;

import org.jspecify.annotations.Nullable;

/**
 * Fetches one page of a collection. A null cursor asks for the first page.
 * Implementations throw translated storage failures.
 */
@FunctionalInterface
public interface PageSource {
    ListingPage fetch(@Nullable String cursor);
}
