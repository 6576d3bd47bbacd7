package notionstore.domain.path;

import jakarta.enterprise.context.ApplicationScoped;
import notionstore.domain.storage.StorageErrorKind;
import notionstore.domain.storage.StorageFailure;
import org.apache.commons.lang3.StringUtils;

@ApplicationScoped
public class FlatPathResolver implements PathResolver {
    @Override
    public String resolve(final String path) {
        if (path == null || path.contains("..") || path.contains("/")) {
            throw new StorageFailure(StorageErrorKind.NOT_FOUND, "nested paths are not supported")
                    .withContext("path", String.valueOf(path));
        }

        String pageId = path;
        while (pageId.endsWith(DOCUMENT_SUFFIX)) {
            pageId = StringUtils.removeEnd(pageId, DOCUMENT_SUFFIX);
        }

        if (pageId.isEmpty()) {
            throw new StorageFailure(StorageErrorKind.NOT_FOUND, "page id is required in path")
                    .withContext("path", path);
        }

        return pageId;
    }

    @Override
    public boolean isRoot(final String path) {
        return StringUtils.isEmpty(path) || "/".equals(path);
    }

    @Override
    public boolean isRootDirectory(final String path) {
        return isRoot(path) || "./".equals(path) || "/.".equals(path);
    }
}
