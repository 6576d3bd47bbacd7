package notionstore.domain.response;

import jakarta.ws.rs.core.Response;
import notionstore.domain.exceptions.InvalidResponse;
import notionstore.domain.exceptions.MissingResponse;
import notionstore.domain.exceptions.UnauthorizedResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OkResponseValidationTest {

    private static final String URI = "https://api.notion.com/v1/pages/abc";

    private final OkResponseValidation validation = new OkResponseValidation();

    @Test
    void testSuccessPassesThrough() {
        final Response response = Response.ok().build();

        assertSame(response, validation.validate(response, URI));
    }

    @Test
    void testNotFound() {
        assertThrows(MissingResponse.class, () -> validation.validate(Response.status(404).build(), URI));
    }

    @Test
    void testUnauthorizedKeepsStatus() {
        final UnauthorizedResponse unauthorized = assertThrows(UnauthorizedResponse.class,
                () -> validation.validate(Response.status(403).build(), URI));

        assertEquals(403, unauthorized.getCode());
    }

    @Test
    void testOtherStatusesAreInvalid() {
        final InvalidResponse invalid = assertThrows(InvalidResponse.class,
                () -> validation.validate(Response.status(429).build(), URI));

        assertEquals(429, invalid.getCode());
    }
}
