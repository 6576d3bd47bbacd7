package notionstore.domain.storage;

/**
 * The closed set of failures a storage caller can receive.
 */
public enum StorageErrorKind {
    /**
     * The remote service rejected the request as invalid, or a local argument was invalid.
     */
    INVALID_INPUT,
    /**
     * Authentication or authorization failed.
     */
    PERMISSION_DENIED,
    /**
     * The record or collection does not exist, or the path can not name one.
     */
    NOT_FOUND,
    /**
     * A listing was requested for something other than the root container.
     */
    NOT_A_DIRECTORY,
    /**
     * The operation, or a variation of it, is not available.
     */
    UNSUPPORTED,
    /**
     * The accessor was configured without something it needs.
     */
    CONFIG_INVALID,
    /**
     * Anything else. These are logged where they are created.
     */
    UNEXPECTED
}
