package notionstore.domain.storage;

/**
 * A read only storage interface over some remote content source.
 * All methods throw {@link StorageFailure} and nothing else.
 */
public interface StorageAccessor {
    /**
     * Describes the accessor and which operations it supports.
     */
    AccessorInfo info();

    /**
     * Returns the metadata of the entry at the path. The root path is always a directory.
     */
    Metadata stat(String path);

    /**
     * Reads the content at the path.
     *
     * @param path  The path of the file to read
     * @param range The range to read. Implementations may reject anything but a full range.
     * @return The content and its size
     */
    ReadResult read(String path, ReadRange range);

    /**
     * Lists the entries under the path.
     */
    Lister list(String path);
}
