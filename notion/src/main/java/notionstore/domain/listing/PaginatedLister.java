package notionstore.domain.listing;

/**
 * Drives a cursor based collection to completion, or to the end of a window.
 */
public interface PaginatedLister {
    /**
     * @param source The collection being listed
     * @param mode   How the window is applied
     * @param window The slice of the full listing to return. Ignored by ACCUMULATE_ALL.
     * @return The identifiers in the order the source returned them
     */
    ListingResult list(PageSource source, ListingMode mode, ListingWindow window);

    default ListingResult listAll(final PageSource source) {
        return list(source, ListingMode.ACCUMULATE_ALL, ListingWindow.all());
    }
}
