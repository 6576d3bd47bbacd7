package notionstore.domain.logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.enterprise.inject.spi.InjectionPoint;

import java.util.logging.Logger;

/**
 * Produces a JUL logger named after the class it is injected into.
 */
@ApplicationScoped
public class Loggers {
    @Produces
    public Logger getLogger(final InjectionPoint injectionPoint) {
        final Class<?> owner = injectionPoint.getMember().getDeclaringClass();
        return Logger.getLogger(owner.getName());
    }
}
