package notionstore.application.cli;

import io.vavr.control.Try;
import jakarta.inject.Inject;
import notionstore.Marker;
import notionstore.domain.exceptionhandling.ExceptionHandler;
import notionstore.domain.logging.LogConfig;
import notionstore.domain.storage.AccessorInfo;
import notionstore.domain.storage.Entry;
import notionstore.domain.storage.Lister;
import notionstore.domain.storage.Metadata;
import notionstore.domain.storage.ReadRange;
import notionstore.domain.storage.StorageAccessor;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.weld.environment.se.Weld;
import org.jboss.weld.environment.se.WeldContainer;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Runs one storage operation against the configured Notion workspace:
 * <pre>
 * Main info
 * Main list [path]
 * Main stat &lt;path&gt;
 * Main read &lt;path&gt;
 * </pre>
 */
public class Main {
    private static final String USAGE = "Usage: Main info | list [path] | stat <path> | read <path>";

    @Inject
    private StorageAccessor storageAccessor;

    @Inject
    private ExceptionHandler exceptionHandler;

    public static void main(final String[] args) {
        LogConfig.init(ConfigProvider.getConfig()
                .getOptionalValue("sb.log.verbose", Boolean.class)
                .orElse(false));

        final int exitCode;
        /*
         Beans are spread across the core, notion and cli jars, so Weld scans from the marker class
         in the shared root package.
         */
        try (WeldContainer weldContainer = new Weld().addBeanClass(Main.class).addPackages(true, Marker.class).initialize()) {
            exitCode = weldContainer.select(Main.class).get().entry(args, System.out, System.err);
        }

        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * @return The process exit code
     */
    public int entry(final String[] args, final PrintStream out, final PrintStream err) {
        if (args.length == 0 || StringUtils.isBlank(args[0])) {
            err.println(USAGE);
            return 2;
        }

        return Try.run(() -> runCommand(args, out))
                .map(ignored -> 0)
                .onFailure(e -> err.println("Failed to " + args[0] + ": " + exceptionHandler.getExceptionMessage(e)))
                .getOrElse(1);
    }

    private void runCommand(final String[] args, final PrintStream out) {
        switch (args[0]) {
            case "info" -> printInfo(storageAccessor.info(), out);
            case "list" -> printEntries(storageAccessor.list(args.length > 1 ? args[1] : "/"), out);
            case "stat" -> printMetadata(storageAccessor.stat(getPath(args)), out);
            case "read" -> out.print(new String(
                    storageAccessor.read(getPath(args), ReadRange.full()).content(),
                    StandardCharsets.UTF_8));
            default -> throw new IllegalArgumentException("Unknown command " + args[0] + ". " + USAGE);
        }
    }

    private String getPath(final String[] args) {
        if (args.length > 1 && StringUtils.isNotBlank(args[1])) {
            return args[1];
        }

        throw new IllegalArgumentException("No path specified. " + USAGE);
    }

    private void printInfo(final AccessorInfo info, final PrintStream out) {
        out.println("scheme: " + info.scheme());
        out.println("root: " + info.root());
        out.println("stat: " + info.capability().stat());
        out.println("read: " + info.capability().read());
        out.println("list: " + info.capability().list());
    }

    private void printEntries(final Lister lister, final PrintStream out) {
        Optional<Entry> entry = lister.next();
        while (entry.isPresent()) {
            out.println(entry.get().path());
            entry = lister.next();
        }
    }

    private void printMetadata(final Metadata metadata, final PrintStream out) {
        out.println("mode: " + metadata.mode());
        metadata.getContentLength().ifPresent(length -> out.println("content-length: " + length));
        if (metadata.contentType() != null) {
            out.println("content-type: " + metadata.contentType());
        }
        metadata.getLastModified().ifPresent(modified -> out.println("last-modified: " + modified));
    }
}
