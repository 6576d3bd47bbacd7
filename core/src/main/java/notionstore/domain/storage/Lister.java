package notionstore.domain.storage;

import java.util.Optional;

/**
 * A forward only, single pass enumeration of entries. Once {@link #next()} has returned an empty
 * result the lister is exhausted and can not be restarted.
 */
public interface Lister {
    Optional<Entry> next();
}
