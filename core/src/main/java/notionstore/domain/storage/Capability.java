package notionstore.domain.storage;

/**
 * The operations an accessor supports.
 */
public record Capability(boolean stat, boolean read, boolean list) {
}
