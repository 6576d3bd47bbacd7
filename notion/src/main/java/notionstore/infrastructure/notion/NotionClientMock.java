package notionstore.infrastructure.notion;

import jakarta.enterprise.context.ApplicationScoped;
import notionstore.domain.exceptions.InvalidResponse;
import notionstore.domain.exceptions.MissingResponse;
import notionstore.infrastructure.notion.api.NotionBlock;
import notionstore.infrastructure.notion.api.NotionBlockChildrenResponse;
import notionstore.infrastructure.notion.api.NotionDatabaseQueryResponse;
import notionstore.infrastructure.notion.api.NotionPage;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An in memory workspace that pages through databases and block children the way the API does.
 * Cursors are the index of the next item, which is enough to catch a caller that drops or reuses them.
 */
@ApplicationScoped
public class NotionClientMock implements NotionClient {
    private static final String CURSOR_PREFIX = "mock-cursor-";
    private static final String NOT_FOUND_BODY = "{\"object\":\"error\",\"status\":404,\"code\":\"object_not_found\",\"message\":\"Could not find object with ID: %s.\"}";

    private final Map<String, NotionPage> pages = new ConcurrentHashMap<>();
    private final Map<String, List<String>> databases = new ConcurrentHashMap<>();
    private final Map<String, List<NotionBlock>> blocks = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> queryCounts = new ConcurrentHashMap<>();

    public NotionClientMock addPage(final NotionPage page) {
        pages.put(page.id(), page);
        return this;
    }

    /**
     * Adds the pages to a database, in order, creating the database if required.
     */
    public NotionClientMock addDatabase(final String databaseId, final List<NotionPage> databasePages) {
        databasePages.forEach(this::addPage);
        databases.computeIfAbsent(databaseId, id -> new CopyOnWriteArrayList<>())
                .addAll(databasePages.stream().map(NotionPage::id).toList());
        return this;
    }

    public NotionClientMock addBlocks(final String parentId, final List<NotionBlock> children) {
        blocks.computeIfAbsent(parentId, id -> new CopyOnWriteArrayList<>()).addAll(children);
        return this;
    }

    /**
     * Any call made against the id throws the exception.
     */
    public NotionClientMock addFailure(final String id, final RuntimeException exception) {
        failures.put(id, exception);
        return this;
    }

    public int getQueryCount(final String databaseId) {
        return queryCounts.getOrDefault(databaseId, new AtomicInteger()).get();
    }

    public void clear() {
        pages.clear();
        databases.clear();
        blocks.clear();
        failures.clear();
        queryCounts.clear();
    }

    @Override
    public NotionPage getPage(final String token, final String pageId) {
        throwIfFailing(pageId);

        final NotionPage page = pages.get(pageId);
        if (page == null) {
            throw new MissingResponse("Expected status code 200, but got 404", NOT_FOUND_BODY.formatted(pageId));
        }
        return page;
    }

    @Override
    public NotionDatabaseQueryResponse queryDatabase(
            final String token,
            final String databaseId,
            @Nullable final String cursor,
            final int pageSize) {
        queryCounts.computeIfAbsent(databaseId, id -> new AtomicInteger()).incrementAndGet();
        throwIfFailing(databaseId);

        final List<String> ids = databases.get(databaseId);
        if (ids == null) {
            throw new MissingResponse("Expected status code 200, but got 404", NOT_FOUND_BODY.formatted(databaseId));
        }

        final int start = parseCursor(cursor);
        final int end = Math.min(ids.size(), start + Math.min(pageSize, MAX_PAGE_SIZE));
        final List<NotionPage> results = new ArrayList<>();
        for (int i = start; i < end; ++i) {
            results.add(pages.get(ids.get(i)));
        }

        return new NotionDatabaseQueryResponse(results, nextCursor(end, ids.size()), end < ids.size());
    }

    @Override
    public NotionBlockChildrenResponse getBlockChildren(
            final String token,
            final String blockId,
            @Nullable final String cursor,
            final int pageSize) {
        throwIfFailing(blockId);

        final List<NotionBlock> children = blocks.getOrDefault(blockId, List.of());
        final int start = parseCursor(cursor);
        final int end = Math.min(children.size(), start + Math.min(pageSize, MAX_PAGE_SIZE));

        return new NotionBlockChildrenResponse(
                List.copyOf(children.subList(Math.min(start, end), end)),
                nextCursor(end, children.size()),
                end < children.size());
    }

    private void throwIfFailing(final String id) {
        final RuntimeException failure = failures.get(id);
        if (failure != null) {
            throw failure;
        }
    }

    @Nullable
    private String nextCursor(final int end, final int size) {
        return end < size ? CURSOR_PREFIX + end : null;
    }

    private int parseCursor(@Nullable final String cursor) {
        if (StringUtils.isBlank(cursor)) {
            return 0;
        }

        if (!cursor.startsWith(CURSOR_PREFIX)) {
            throw new InvalidResponse("Expected status code 200, but got 400",
                    "{\"object\":\"error\",\"status\":400,\"code\":\"validation_error\",\"message\":\"start_cursor should be a valid cursor.\"}",
                    400);
        }

        return Integer.parseInt(cursor.substring(CURSOR_PREFIX.length()));
    }
}
