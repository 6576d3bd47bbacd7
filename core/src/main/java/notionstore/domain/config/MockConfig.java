package notionstore.domain.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Switches the Notion client to the in-memory workspace for tests and offline runs.
 */
@ApplicationScoped
public class MockConfig {
    @Inject
    @ConfigProperty(name = "sb.infrastructure.mock", defaultValue = "false")
    private String mock;

    public boolean isMock() {
        return Boolean.parseBoolean(mock.trim().toLowerCase());
    }
}
