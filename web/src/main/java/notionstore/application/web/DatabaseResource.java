package notionstore.application.web;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.MultivaluedMap;
import notionstore.application.web.auth.RequestTokenResolver;
import notionstore.domain.config.WebConfig;
import notionstore.domain.document.NotionDatabaseLister;
import notionstore.domain.listing.ListingMode;
import notionstore.domain.listing.ListingResult;
import notionstore.domain.listing.ListingWindow;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Lists one window of the page ids in a database. The whole database is walked so the total is exact.
 */
@Path("/database")
public class DatabaseResource {
    @Inject
    private RequestTokenResolver tokenResolver;

    @Inject
    private NotionDatabaseLister databaseLister;

    @Inject
    private WebConfig webConfig;

    @Inject
    private Logger logger;

    @GET
    @Path("{id}")
    @Produces(MediaType.APPLICATION_JSON)
    public DatabasePagesResponse getPages(@PathParam("id") final String id,
                                          @QueryParam("offset") final Integer offset,
                                          @QueryParam("limit") final Integer limit,
                                          @Context final HttpHeaders headers) {
        return pages(id, offset, limit, headers.getRequestHeaders());
    }

    public DatabasePagesResponse pages(final String id,
                                       @Nullable final Integer offset,
                                       @Nullable final Integer limit,
                                       final MultivaluedMap<String, String> headers) {
        final String databaseId = ResourceIds.requireValid("database", id);
        final String token = tokenResolver.resolve(headers);

        final ListingWindow window = new ListingWindow(
                Objects.requireNonNullElse(offset, 0),
                Objects.requireNonNullElse(limit, webConfig.getDefaultLimit()));

        final ListingResult result = databaseLister.list(token, databaseId, ListingMode.WINDOWED_EXHAUSTIVE, window);

        logger.fine("Returning " + result.ids().size() + " of " + result.totalVisited() + " pages from database " + databaseId);

        return new DatabasePagesResponse(result.totalVisited(), window.offset(), window.limit(), result.ids());
    }
}
