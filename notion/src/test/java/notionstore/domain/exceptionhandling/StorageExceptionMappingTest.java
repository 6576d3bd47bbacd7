package notionstore.domain.exceptionhandling;

import io.smallrye.config.inject.ConfigExtension;
import io.vavr.control.Try;
import jakarta.inject.Inject;
import notionstore.domain.exceptions.InvalidHeader;
import notionstore.domain.exceptions.InvalidResponse;
import notionstore.domain.exceptions.MissingResponse;
import notionstore.domain.exceptions.Timeout;
import notionstore.domain.exceptions.UnauthorizedResponse;
import notionstore.domain.json.JsonDeserializerJackson;
import notionstore.domain.logger.Loggers;
import notionstore.domain.storage.StorageErrorKind;
import notionstore.domain.storage.StorageFailure;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(StorageExceptionMapping.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(Loggers.class)
class StorageExceptionMappingTest {

    private static final String NOT_FOUND_BODY = """
            {"object":"error","status":404,"code":"object_not_found","message":"Could not find page with ID: abc."}""";

    @Inject
    private StorageExceptionMapping mapping;

    @Test
    void testStatusTable() {
        assertEquals(StorageErrorKind.INVALID_INPUT, StorageExceptionMapping.kindForStatus(400));
        assertEquals(StorageErrorKind.PERMISSION_DENIED, StorageExceptionMapping.kindForStatus(401));
        assertEquals(StorageErrorKind.PERMISSION_DENIED, StorageExceptionMapping.kindForStatus(403));
        assertEquals(StorageErrorKind.NOT_FOUND, StorageExceptionMapping.kindForStatus(404));
        assertEquals(StorageErrorKind.UNEXPECTED, StorageExceptionMapping.kindForStatus(409));
        assertEquals(StorageErrorKind.UNEXPECTED, StorageExceptionMapping.kindForStatus(429));
        assertEquals(StorageErrorKind.UNEXPECTED, StorageExceptionMapping.kindForStatus(500));
    }

    @Test
    void testMissingResponseKeepsNotionMessage() {
        final StorageFailure failure = mapping.translate(new MissingResponse("Expected status code 200, but got 404", NOT_FOUND_BODY));

        assertEquals(StorageErrorKind.NOT_FOUND, failure.getKind());
        assertEquals("Could not find page with ID: abc.", failure.getMessage());
        assertEquals("object_not_found", failure.getContext().get("code"));
        assertEquals("404", failure.getContext().get("status"));
    }

    @Test
    void testUnauthorized() {
        assertEquals(StorageErrorKind.PERMISSION_DENIED,
                mapping.translate(new UnauthorizedResponse("Expected status code 200, but got 401", "", 401)).getKind());
        assertEquals(StorageErrorKind.PERMISSION_DENIED,
                mapping.translate(new UnauthorizedResponse("Expected status code 200, but got 403", "", 403)).getKind());
    }

    @Test
    void testBadRequestIsInvalidInput() {
        final StorageFailure failure = mapping.translate(new InvalidResponse("Expected status code 200, but got 400",
                "{\"object\":\"error\",\"status\":400,\"code\":\"validation_error\",\"message\":\"body failed validation\"}",
                400));

        assertEquals(StorageErrorKind.INVALID_INPUT, failure.getKind());
        assertEquals("validation_error", failure.getContext().get("code"));
    }

    @Test
    void testServerErrorWithHtmlBody() {
        final StorageFailure failure = mapping.translate(new InvalidResponse("Expected status code 200, but got 502",
                "<html>Bad Gateway</html>", 502));

        assertEquals(StorageErrorKind.UNEXPECTED, failure.getKind());
        assertEquals("Expected status code 200, but got 502", failure.getMessage());
        assertFalse(failure.getContext().containsKey("code"));
    }

    @Test
    void testLocalFailuresAreUnexpected() {
        assertEquals(StorageErrorKind.UNEXPECTED, mapping.translate(new InvalidHeader("token contains a newline")).getKind());
        assertEquals(StorageErrorKind.UNEXPECTED, mapping.translate(new Timeout("read timed out")).getKind());
        assertEquals(StorageErrorKind.UNEXPECTED, mapping.translate(new IllegalStateException()).getKind());
    }

    @Test
    void testCancellation() {
        final StorageFailure failure = mapping.translate(new CancellationException());

        assertEquals(StorageErrorKind.UNEXPECTED, failure.getKind());
        assertEquals("true", failure.getContext().get("cancelled"));
    }

    @Test
    void testStorageFailurePassesThrough() {
        final StorageFailure original = new StorageFailure(StorageErrorKind.NOT_A_DIRECTORY, "only root directory is listable");

        assertSame(original, mapping.translate(original));
    }

    @Test
    void testMapTry() {
        final Try<String> mapped = mapping.map(Try.<String>failure(new MissingResponse("gone", NOT_FOUND_BODY)));

        final StorageFailure failure = assertThrows(StorageFailure.class, mapped::get);
        assertEquals(StorageErrorKind.NOT_FOUND, failure.getKind());
        assertEquals("ok", mapping.map(Try.success("ok")).get());
    }
}
