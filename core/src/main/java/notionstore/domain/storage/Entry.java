package notionstore.domain.storage;

/**
 * One item yielded by a listing. The path is relative to the root of the accessor.
 */
public record Entry(String path, Metadata metadata) {
}
