package notionstore.domain.render;

/**
 * Converts the block content of a page into markdown.
 */
public interface PageRenderer {
    /**
     * @param token  The integration token used to fetch the blocks
     * @param pageId The page to render
     * @return The markdown body, without any frontmatter
     */
    String render(String token, String pageId);
}
