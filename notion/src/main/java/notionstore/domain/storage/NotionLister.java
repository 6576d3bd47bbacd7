package notionstore.domain.storage;

import notionstore.domain.path.PathResolver;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Yields one file entry per page id, in listing order.
 */
public class NotionLister implements Lister {
    public static final String CONTENT_TYPE = "text/markdown";

    private final Iterator<String> pageIds;
    private final PathResolver pathResolver;

    public NotionLister(final List<String> pageIds, final PathResolver pathResolver) {
        this.pageIds = List.copyOf(pageIds).iterator();
        this.pathResolver = pathResolver;
    }

    @Override
    public Optional<Entry> next() {
        if (!pageIds.hasNext()) {
            return Optional.empty();
        }

        return Optional.of(new Entry(pathResolver.toPath(pageIds.next()), Metadata.file(CONTENT_TYPE)));
    }
}
