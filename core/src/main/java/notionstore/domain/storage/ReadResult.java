package notionstore.domain.storage;

/**
 * The bytes returned by a read and the size declared for them.
 */
public record ReadResult(byte[] content, long size) {
}
