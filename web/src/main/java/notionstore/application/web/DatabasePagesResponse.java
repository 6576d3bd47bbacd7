package notionstore.application.web;

import java.util.List;

/**
 * One window of a database listing. The total counts every page in the database, not just the window.
 */
public record DatabasePagesResponse(int total, int offset, int limit, List<String> pages) {
}
