package notionstore.domain.logging;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class LogConfig {
    private LogConfig() {
    }

    /**
     * Quiets the root logger so only warnings reach the console, unless verbose logging was requested.
     */
    public static void init(final boolean verbose) {
        final Level level = verbose ? Level.FINE : Level.WARNING;
        final Logger rootLogger = LogManager.getLogManager().getLogger("");
        rootLogger.setLevel(level);
        for (final Handler h : rootLogger.getHandlers()) {
            h.setLevel(level);
        }
    }
}
