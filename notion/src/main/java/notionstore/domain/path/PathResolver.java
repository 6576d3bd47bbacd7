package notionstore.domain.path;

/**
 * Maps accessor paths to page ids. The namespace is flat: every page lives directly under the root.
 */
public interface PathResolver {
    /**
     * The suffix appended to page ids to form file names.
     */
    String DOCUMENT_SUFFIX = ".md";

    /**
     * Resolves a file path to a page id.
     *
     * @param path The path, which must not be the root
     * @return The page id
     * @throws notionstore.domain.storage.StorageFailure NOT_FOUND if the path is nested, climbs the hierarchy, or is empty
     */
    String resolve(String path);

    /**
     * True if the path names the root container.
     */
    boolean isRoot(String path);

    /**
     * True if the path names the root container in any of the forms a listing may use.
     */
    boolean isRootDirectory(String path);

    /**
     * The file name of a page.
     */
    default String toPath(final String pageId) {
        return pageId + DOCUMENT_SUFFIX;
    }
}
