package notionstore.domain.document;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import notionstore.domain.exceptionhandling.StorageExceptionMapping;
import notionstore.domain.injection.Preferred;
import notionstore.domain.properties.FrontmatterRenderer;
import notionstore.domain.properties.PropertyMapNormalizer;
import notionstore.domain.render.PageRenderer;
import notionstore.domain.storage.StorageErrorKind;
import notionstore.domain.storage.StorageFailure;
import notionstore.infrastructure.notion.NotionClient;
import notionstore.infrastructure.notion.api.NotionPage;
import org.apache.commons.lang3.StringUtils;

import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Fetches a page, renders its blocks and normalizes its properties.
 */
@ApplicationScoped
public class NotionDocumentLoader {
    @Inject
    @Preferred
    private NotionClient notionClient;

    @Inject
    private PageRenderer pageRenderer;

    @Inject
    private PropertyMapNormalizer propertyMapNormalizer;

    @Inject
    private FrontmatterRenderer frontmatterRenderer;

    @Inject
    private StorageExceptionMapping exceptionMapping;

    @Inject
    private Logger logger;

    public NotionDocument load(final String token, final String pageId) {
        checkArgument(StringUtils.isNotBlank(pageId));

        final NotionPage page = Try.of(() -> notionClient.getPage(token, pageId))
                .getOrElseThrow(exceptionMapping::translate);

        final String markdown = Try.of(() -> pageRenderer.render(token, pageId))
                .getOrElseThrow(ex -> renderFailure(pageId, ex));

        return new NotionDocument(page, propertyMapNormalizer.normalize(page), markdown);
    }

    /**
     * The body served for a document, with the properties prepended as frontmatter when requested.
     */
    public String content(final NotionDocument document, final boolean frontmatter) {
        return frontmatter
                ? frontmatterRenderer.render(document.properties(), document.markdown())
                : document.markdown();
    }

    private StorageFailure renderFailure(final String pageId, final Throwable cause) {
        logger.log(Level.SEVERE, "Failed to render notion page " + pageId, cause);

        return new StorageFailure(StorageErrorKind.UNEXPECTED, "failed to render notion page", cause)
                .withContext("page", pageId)
                .withContext("source", StringUtils.defaultIfBlank(cause.getMessage(), cause.getClass().getSimpleName()));
    }
}
