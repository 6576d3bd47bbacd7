package notionstore.domain.config;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

/**
 * Represents the configuration of the Notion accessor.
 */
@ApplicationScoped
public class NotionConfig {
    public static final int DEFAULT_RENDER_DEPTH = 3;

    @Inject
    @ConfigProperty(name = "sb.notion.token")
    private Optional<String> token;

    @Inject
    @ConfigProperty(name = "sb.notion.databaseid")
    private Optional<String> databaseId;

    @Inject
    @ConfigProperty(name = "sb.notion.frontmatter", defaultValue = "false")
    private String frontmatter;

    @Inject
    @ConfigProperty(name = "sb.notion.renderdepth", defaultValue = DEFAULT_RENDER_DEPTH + "")
    private String renderDepth;

    /**
     * Blank values are treated as unset, so an empty environment variable does not count as a token.
     */
    public Optional<String> getToken() {
        return token.filter(StringUtils::isNotBlank);
    }

    public Optional<String> getDatabaseId() {
        return databaseId.filter(StringUtils::isNotBlank);
    }

    public boolean isFrontmatter() {
        return Boolean.parseBoolean(frontmatter.toLowerCase());
    }

    public int getRenderDepth() {
        return Try.of(() -> Integer.parseInt(renderDepth))
                .filter(depth -> depth >= 0)
                .getOrElse(DEFAULT_RENDER_DEPTH);
    }
}
