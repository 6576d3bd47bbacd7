package notionstore.application.web.auth;

import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.MultivaluedMap;
import notionstore.domain.logger.Loggers;
import notionstore.domain.storage.StorageErrorKind;
import notionstore.domain.storage.StorageFailure;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(RequestTokenResolver.class)
@AddBeanClasses(BearerTokenExtractor.class)
@AddBeanClasses(AuthHeaderTokenExtractor.class)
@AddBeanClasses(Loggers.class)
class RequestTokenResolverTest {

    @Inject
    private RequestTokenResolver resolver;

    @Test
    void testBearerWinsOverAuthHeader() {
        final MultivaluedMap<String, String> headers = new MultivaluedHashMap<>();
        headers.add("Auth", "from-auth");
        headers.add("Authorization", "Bearer from-bearer");

        assertEquals("from-bearer", resolver.resolve(headers));
    }

    @Test
    void testFallsBackToAuthHeader() {
        final MultivaluedMap<String, String> headers = new MultivaluedHashMap<>();
        headers.add("Authorization", "Basic abc");
        headers.add("Auth", "from-auth");

        assertEquals("from-auth", resolver.resolve(headers));
    }

    @Test
    void testMissingTokenIsPermissionDenied() {
        final StorageFailure failure = assertThrows(StorageFailure.class, () -> resolver.resolve(new MultivaluedHashMap<>()));

        assertEquals(StorageErrorKind.PERMISSION_DENIED, failure.getKind());
    }

    @Test
    void testTokenWithLineBreakIsRejected() {
        final MultivaluedMap<String, String> headers = new MultivaluedHashMap<>();
        headers.add("Auth", "abc\ndef");

        assertEquals(StorageErrorKind.PERMISSION_DENIED,
                assertThrows(StorageFailure.class, () -> resolver.resolve(headers)).getKind());
    }
}
