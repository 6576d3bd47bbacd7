package notionstore.application.web;

import notionstore.domain.storage.StorageErrorKind;
import notionstore.domain.storage.StorageFailure;
import org.apache.commons.lang3.StringUtils;

final class ResourceIds {
    private ResourceIds() {
    }

    /**
     * Ids are embedded in Notion API URLs, so anything that looks like a path is rejected.
     */
    static String requireValid(final String kind, final String id) {
        if (StringUtils.isBlank(id) || id.contains("/") || id.contains("..")) {
            throw new StorageFailure(StorageErrorKind.INVALID_INPUT, "invalid " + kind + " id")
                    .withContext("id", String.valueOf(id));
        }

        return id;
    }
}
