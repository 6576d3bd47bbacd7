package notionstore.application.web;

import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import notionstore.application.web.auth.RequestTokenResolver;
import notionstore.application.web.format.ResponseFormat;
import notionstore.application.web.format.ResponseFormatSelector;
import notionstore.domain.document.NotionDocument;
import notionstore.domain.document.NotionDocumentLoader;
import notionstore.domain.properties.PropertyMapNormalizer;
import notionstore.domain.properties.PropertyValue;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Serves a single page as JSON or markdown, using the Notion token sent with the request.
 */
@Path("/page")
public class PageResource {
    public static final String MARKDOWN_TYPE = "text/markdown; charset=utf-8";
    public static final String KEYS_BY_ID = "id";

    @Inject
    private RequestTokenResolver tokenResolver;

    @Inject
    private ResponseFormatSelector formatSelector;

    @Inject
    private NotionDocumentLoader documentLoader;

    @Inject
    private PropertyMapNormalizer propertyMapNormalizer;

    @Inject
    private Logger logger;

    @GET
    @Path("{id}")
    public Response getPage(@PathParam("id") final String id,
                            @QueryParam("frontmatter") @DefaultValue("false") final boolean frontmatter,
                            @QueryParam("keys") @DefaultValue("name") final String keys,
                            @Context final HttpHeaders headers) {
        return page(id, frontmatter, KEYS_BY_ID.equalsIgnoreCase(keys), headers.getRequestHeaders());
    }

    public Response page(final String id, final boolean frontmatter, final MultivaluedMap<String, String> headers) {
        return page(id, frontmatter, false, headers);
    }

    /**
     * With {@code keyById} the JSON properties are keyed by the Notion property id instead of its display name.
     * Markdown frontmatter always uses display names.
     */
    public Response page(final String id,
                         final boolean frontmatter,
                         final boolean keyById,
                         final MultivaluedMap<String, String> headers) {
        final String pageId = ResourceIds.requireValid("page", id);
        final String token = tokenResolver.resolve(headers);
        final ResponseFormat format = formatSelector.select(headers);

        logger.fine("Serving page " + pageId + " as " + format);

        final NotionDocument document = documentLoader.load(token, pageId);

        if (format == ResponseFormat.MARKDOWN) {
            return Response.ok(documentLoader.content(document, frontmatter), MARKDOWN_TYPE).build();
        }

        final Map<String, PropertyValue> properties = keyById
                ? propertyMapNormalizer.normalizeById(document.page())
                : document.properties();

        return Response.ok(
                        new PageJsonResponse(document.id(), properties, document.markdown()),
                        MediaType.APPLICATION_JSON_TYPE)
                .build();
    }
}
