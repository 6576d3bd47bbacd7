package notionstore.domain.document;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import notionstore.domain.exceptionhandling.StorageExceptionMapping;
import notionstore.domain.injection.Preferred;
import notionstore.domain.listing.ListingMode;
import notionstore.domain.listing.ListingPage;
import notionstore.domain.listing.ListingResult;
import notionstore.domain.listing.ListingWindow;
import notionstore.domain.listing.PageSource;
import notionstore.domain.listing.PaginatedLister;
import notionstore.infrastructure.notion.NotionClient;
import notionstore.infrastructure.notion.api.NotionDatabaseQueryResponse;
import notionstore.infrastructure.notion.api.NotionPage;
import org.apache.commons.lang3.StringUtils;

import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Lists the ids of the pages in a database.
 */
@ApplicationScoped
public class NotionDatabaseLister {
    @Inject
    @Preferred
    private NotionClient notionClient;

    @Inject
    private PaginatedLister paginatedLister;

    @Inject
    private StorageExceptionMapping exceptionMapping;

    @Inject
    private Logger logger;

    public ListingResult listAll(final String token, final String databaseId) {
        return list(token, databaseId, ListingMode.ACCUMULATE_ALL, ListingWindow.all());
    }

    public ListingResult list(final String token,
                              final String databaseId,
                              final ListingMode mode,
                              final ListingWindow window) {
        checkArgument(StringUtils.isNotBlank(databaseId));

        return paginatedLister.list(databaseSource(token, databaseId), mode, window);
    }

    private PageSource databaseSource(final String token, final String databaseId) {
        return cursor -> {
            logger.fine("Querying database " + databaseId + " from cursor " + cursor);

            final NotionDatabaseQueryResponse response = Try.of(() -> notionClient.queryDatabase(
                            token, databaseId, cursor, NotionClient.MAX_PAGE_SIZE))
                    .getOrElseThrow(exceptionMapping::translate);

            return new ListingPage(
                    response.getResults().stream().map(NotionPage::id).toList(),
                    response.hasMore() ? response.nextCursor() : null);
        };
    }
}
