package notionstore.domain.listing;

import java.util.List;

/**
 * The identifiers a listing returned, and how many items it saw on the pages it fetched.
 */
public record ListingResult(List<String> ids, int totalVisited) {
    public ListingResult {
        ids = List.copyOf(ids);
    }
}
