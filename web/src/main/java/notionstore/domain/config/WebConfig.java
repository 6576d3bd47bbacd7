package notionstore.domain.config;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class WebConfig {
    public static final int DEFAULT_LIMIT = 20;

    @Inject
    @ConfigProperty(name = "sb.web.defaultlimit", defaultValue = DEFAULT_LIMIT + "")
    private String defaultLimit;

    /**
     * The number of database pages returned when a request does not set a limit.
     */
    public int getDefaultLimit() {
        return Try.of(() -> Integer.parseInt(defaultLimit))
                .filter(limit -> limit > 0)
                .getOrElse(DEFAULT_LIMIT);
    }
}
