package notionstore.domain.exceptionhandling;

import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import notionstore.domain.exceptions.Timeout;
import notionstore.domain.storage.StorageErrorKind;
import notionstore.domain.storage.StorageFailure;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(LoggingExceptionHandler.class)
class LoggingExceptionHandlerTest {

    @Inject
    private LoggingExceptionHandler exceptionHandler;

    @Test
    void testNullException() {
        assertEquals("Exception was null", exceptionHandler.getExceptionMessage(null));
    }

    @Test
    void testInternalExceptionUsesMessage() {
        assertEquals("bad path", exceptionHandler.getExceptionMessage(new IllegalArgumentException("bad path")));
    }

    @Test
    void testBlankMessageFallsBackToToString() {
        assertEquals("java.lang.IllegalStateException", exceptionHandler.getExceptionMessage(new IllegalStateException()));
    }

    @Test
    void testExpectedStorageFailureIsSummarised() {
        final StorageFailure failure = new StorageFailure(StorageErrorKind.NOT_FOUND, "object_not_found")
                .withContext("path", "abc.md");
        assertEquals("NOT_FOUND => object_not_found { path: abc.md }", exceptionHandler.getExceptionMessage(failure));
    }

    @Test
    void testUnexpectedStorageFailureIncludesStackTrace() {
        final StorageFailure failure = new StorageFailure(StorageErrorKind.UNEXPECTED, "failed to render notion page");
        assertTrue(exceptionHandler.getExceptionMessage(failure).contains("at notionstore."));
    }

    @Test
    void testExternalExceptionIncludesStackTrace() {
        assertTrue(exceptionHandler.getExceptionMessage(new Timeout("too slow")).contains("Timeout: too slow"));
    }
}
