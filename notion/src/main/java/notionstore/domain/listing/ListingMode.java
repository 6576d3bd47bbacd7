package notionstore.domain.listing;

public enum ListingMode {
    /**
     * Return every identifier in the collection. The window is ignored.
     */
    ACCUMULATE_ALL,
    /**
     * Skip the window offset, collect up to the window limit, and stop fetching pages once the limit is reached.
     */
    WINDOWED,
    /**
     * Like WINDOWED, but keep fetching pages to the end of the collection so the visited count is the
     * size of the whole collection.
     */
    WINDOWED_EXHAUSTIVE
}
