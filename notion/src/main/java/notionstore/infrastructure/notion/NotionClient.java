package notionstore.infrastructure.notion;

import notionstore.infrastructure.notion.api.NotionBlockChildrenResponse;
import notionstore.infrastructure.notion.api.NotionDatabaseQueryResponse;
import notionstore.infrastructure.notion.api.NotionPage;
import org.jspecify.annotations.Nullable;

/**
 * The Notion REST API. Implementations throw the exceptions from notionstore.domain.exceptions
 * and leave translation to the caller.
 */
public interface NotionClient {
    /**
     * The largest page size the Notion API accepts.
     */
    int MAX_PAGE_SIZE = 100;

    NotionPage getPage(String token, String pageId);

    NotionDatabaseQueryResponse queryDatabase(String token, String databaseId, @Nullable String cursor, int pageSize);

    NotionBlockChildrenResponse getBlockChildren(String token, String blockId, @Nullable String cursor, int pageSize);
}
