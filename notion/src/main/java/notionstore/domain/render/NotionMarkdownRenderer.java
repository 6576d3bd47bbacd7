package notionstore.domain.render;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import notionstore.domain.config.NotionConfig;
import notionstore.domain.injection.Preferred;
import notionstore.infrastructure.notion.NotionClient;
import notionstore.infrastructure.notion.api.NotionAnnotations;
import notionstore.infrastructure.notion.api.NotionBlock;
import notionstore.infrastructure.notion.api.NotionBlockChildrenResponse;
import notionstore.infrastructure.notion.api.NotionBlockContent;
import notionstore.infrastructure.notion.api.NotionRichText;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Renders Notion blocks as markdown. Block children are fetched page by page, and nested blocks are
 * followed down to the configured render depth. Unsupported block types are skipped.
 * <p>
 * Client exceptions are not translated here. Callers decide how a rendering failure is reported.
 */
@ApplicationScoped
public class NotionMarkdownRenderer implements PageRenderer {
    private static final String INDENT = "    ";
    private static final Set<String> LIST_TYPES = Set.of("bulleted_list_item", "numbered_list_item", "to_do", "toggle");
    // These link to other pages or databases, so their children are not part of this page
    private static final Set<String> LINKED_TYPES = Set.of("child_page", "child_database");

    @Inject
    @Preferred
    private NotionClient notionClient;

    @Inject
    private NotionConfig notionConfig;

    @Inject
    private Logger logger;

    @Override
    public String render(final String token, final String pageId) {
        final String markdown = renderBlocks(token, fetchChildren(token, pageId), 0);
        return markdown.isEmpty() ? "" : markdown + "\n";
    }

    /**
     * Renders a list of sibling blocks. Consecutive list items of the same type are separated by a single newline,
     * everything else by a blank line.
     */
    private String renderBlocks(final String token, final List<NotionBlock> blocks, final int depth) {
        final StringBuilder builder = new StringBuilder();
        String previousType = null;
        int number = 0;

        for (final NotionBlock block : blocks) {
            final String type = Objects.requireNonNullElse(block.type(), "");
            number = "numbered_list_item".equals(type)
                    ? ("numbered_list_item".equals(previousType) ? number + 1 : 1)
                    : 0;

            final String rendered = renderBlock(token, block, depth, number);
            if (rendered.isEmpty()) {
                continue;
            }

            if (!builder.isEmpty()) {
                builder.append(LIST_TYPES.contains(type) && type.equals(previousType) ? "\n" : "\n\n");
            }

            builder.append(rendered);
            previousType = type;
        }

        return builder.toString();
    }

    private String renderBlock(final String token, final NotionBlock block, final int depth, final int number) {
        final NotionBlockContent content = block.getContent();
        final String type = Objects.requireNonNullElse(block.type(), "");
        final String text = richTextToMarkdown(content.getRichText());

        final String rendered = switch (type) {
            case "paragraph" -> text;
            case "heading_1" -> "# " + text;
            case "heading_2" -> "## " + text;
            case "heading_3" -> "### " + text;
            case "bulleted_list_item", "toggle" -> "- " + text;
            case "numbered_list_item" -> number + ". " + text;
            case "to_do" -> (content.isChecked() ? "- [x] " : "- [ ] ") + text;
            case "quote" -> prefixLines(text, "> ");
            case "callout" -> prefixLines(calloutText(content, text), "> ");
            case "code" -> "```" + Objects.requireNonNullElse(content.language(), "")
                    + "\n" + plainText(content.getRichText()) + "\n```";
            case "equation" -> "$$\n" + Objects.requireNonNullElse(content.expression(), "") + "\n$$";
            case "divider" -> "---";
            case "image" -> content.getLinkUrl()
                    .map(url -> "![" + plainText(content.getCaption()) + "](" + url + ")")
                    .orElse("");
            case "bookmark", "embed", "link_preview" -> content.getLinkUrl()
                    .map(url -> "[" + StringUtils.defaultIfBlank(plainText(content.getCaption()), url) + "](" + url + ")")
                    .orElse("");
            case "child_page" -> "[" + StringUtils.defaultIfBlank(content.title(), block.id()) + "](" + block.id() + ".md)";
            case "child_database" -> "**" + StringUtils.defaultIfBlank(content.title(), block.id()) + "**";
            default -> {
                logger.fine("Skipping unsupported block type " + block.type() + " in block " + block.id());
                yield "";
            }
        };

        if (!block.hasChildren() || LINKED_TYPES.contains(type)) {
            return rendered;
        }

        if (depth + 1 > notionConfig.getRenderDepth()) {
            logger.fine("Not rendering children of block " + block.id() + " beyond depth " + depth);
            return rendered;
        }

        final String children = renderBlocks(token, fetchChildren(token, block.id()), depth + 1);
        if (children.isEmpty()) {
            return rendered;
        }

        if (LIST_TYPES.contains(type)) {
            return rendered + "\n" + prefixLines(children, INDENT);
        }

        if ("quote".equals(type) || "callout".equals(type)) {
            return rendered + "\n>\n" + prefixLines(children, "> ");
        }

        return rendered.isEmpty() ? children : rendered + "\n\n" + children;
    }

    /**
     * Fetches every child of a block, following cursors until the API reports no more results.
     */
    private List<NotionBlock> fetchChildren(final String token, final String blockId) {
        final List<NotionBlock> children = new ArrayList<>();
        String cursor = null;

        do {
            final NotionBlockChildrenResponse response = notionClient.getBlockChildren(
                    token, blockId, cursor, NotionClient.MAX_PAGE_SIZE);
            children.addAll(response.getResults());
            cursor = response.hasMore() ? response.nextCursor() : null;
        } while (cursor != null);

        logger.fine("Fetched " + children.size() + " child blocks of " + blockId);

        return children;
    }

    private String calloutText(final NotionBlockContent content, final String text) {
        if (content.icon() == null || StringUtils.isBlank(content.icon().emoji())) {
            return text;
        }

        return content.icon().emoji() + " " + text;
    }

    /**
     * Converts rich text runs into inline markdown. Underline has no markdown equivalent and is dropped.
     */
    public String richTextToMarkdown(final List<NotionRichText> richText) {
        return richText.stream()
                .map(this::runToMarkdown)
                .collect(Collectors.joining());
    }

    private String runToMarkdown(final NotionRichText run) {
        final String text = run.getPlainText();
        if (StringUtils.isBlank(text)) {
            return text;
        }

        final NotionAnnotations annotations = run.getAnnotations();
        String markdown = annotations.code() ? "`" + text + "`" : text;

        if (annotations.bold()) {
            markdown = "**" + markdown + "**";
        }

        if (annotations.italic()) {
            markdown = "_" + markdown + "_";
        }

        if (annotations.strikethrough()) {
            markdown = "~~" + markdown + "~~";
        }

        if (StringUtils.isNotBlank(run.href())) {
            markdown = "[" + markdown + "](" + run.href() + ")";
        }

        return markdown;
    }

    private static String plainText(final List<NotionRichText> richText) {
        return richText.stream()
                .map(NotionRichText::getPlainText)
                .collect(Collectors.joining());
    }

    private static String prefixLines(final String text, final String prefix) {
        return text.lines()
                .map(line -> line.isEmpty() ? prefix.stripTrailing() : prefix + line)
                .collect(Collectors.joining("\n"));
    }
}
