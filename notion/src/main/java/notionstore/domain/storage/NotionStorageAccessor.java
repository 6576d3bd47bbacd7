package notionstore.domain.storage;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import notionstore.domain.config.NotionConfig;
import notionstore.domain.date.DateParser;
import notionstore.domain.document.NotionDatabaseLister;
import notionstore.domain.document.NotionDocument;
import notionstore.domain.document.NotionDocumentLoader;
import notionstore.domain.path.PathResolver;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.logging.Logger;

/**
 * Exposes a Notion workspace as a flat, read only directory of markdown files. Each page is a file
 * named after its id, and the root lists the pages of the configured database.
 */
@ApplicationScoped
public class NotionStorageAccessor implements StorageAccessor {
    public static final String SCHEME = "notion";
    public static final String ROOT = "/";

    @Inject
    private NotionConfig notionConfig;

    @Inject
    private PathResolver pathResolver;

    @Inject
    private NotionDocumentLoader documentLoader;

    @Inject
    private NotionDatabaseLister databaseLister;

    @Inject
    private DateParser dateParser;

    @Inject
    private Logger logger;

    @Override
    public AccessorInfo info() {
        return new AccessorInfo(SCHEME, ROOT, new Capability(true, true, notionConfig.getDatabaseId().isPresent()));
    }

    @Override
    public Metadata stat(final String path) {
        if (pathResolver.isRoot(path)) {
            return Metadata.directory();
        }

        final NotionDocument document = documentLoader.load(requireToken(), pathResolver.resolve(path));
        final byte[] content = render(document);

        return Metadata.file(NotionLister.CONTENT_TYPE)
                .withContentLength(content.length)
                .withLastModified(lastModified(document));
    }

    @Override
    public ReadResult read(final String path, final ReadRange range) {
        if (!range.isFull()) {
            throw new StorageFailure(StorageErrorKind.UNSUPPORTED, "range reads are not supported for notion")
                    .withContext("path", path)
                    .withContext("offset", Long.toString(range.offset()))
                    .withContext("size", String.valueOf(range.size()));
        }

        final byte[] content = render(documentLoader.load(requireToken(), pathResolver.resolve(path)));

        return new ReadResult(content, content.length);
    }

    @Override
    public Lister list(final String path) {
        final String databaseId = notionConfig.getDatabaseId()
                .orElseThrow(() -> new StorageFailure(StorageErrorKind.UNSUPPORTED, "list requires a database_id")
                        .withContext("path", String.valueOf(path)));

        if (!pathResolver.isRootDirectory(path)) {
            throw new StorageFailure(StorageErrorKind.NOT_A_DIRECTORY, "only root directory is listable")
                    .withContext("path", String.valueOf(path));
        }

        final String token = requireToken();
        logger.fine("Listing pages of database " + databaseId);

        return new NotionLister(databaseLister.listAll(token, databaseId).ids(), pathResolver);
    }

    private byte[] render(final NotionDocument document) {
        return documentLoader.content(document, notionConfig.isFrontmatter()).getBytes(StandardCharsets.UTF_8);
    }

    @Nullable
    private Instant lastModified(final NotionDocument document) {
        final String lastEdited = document.page().lastEditedTime();
        if (StringUtils.isBlank(lastEdited)) {
            return null;
        }

        return Try.of(() -> dateParser.parseDate(lastEdited).toInstant())
                .onFailure(ex -> logger.warning("Ignoring invalid last_edited_time " + lastEdited + " of page " + document.id()))
                .getOrNull();
    }

    private String requireToken() {
        return notionConfig.getToken()
                .orElseThrow(() -> new StorageFailure(StorageErrorKind.CONFIG_INVALID, "notion token is required")
                        .withContext("config", "sb.notion.token"));
    }
}
