package notionstore.application.web;

import jakarta.ws.rs.core.Response;
import notionstore.domain.storage.StorageErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StorageFailureMapperTest {

    @Test
    void testStatuses() {
        assertEquals(Response.Status.BAD_REQUEST, StorageFailureMapper.statusFor(StorageErrorKind.INVALID_INPUT));
        assertEquals(Response.Status.UNAUTHORIZED, StorageFailureMapper.statusFor(StorageErrorKind.PERMISSION_DENIED));
        assertEquals(Response.Status.NOT_FOUND, StorageFailureMapper.statusFor(StorageErrorKind.NOT_FOUND));
        assertEquals(Response.Status.BAD_REQUEST, StorageFailureMapper.statusFor(StorageErrorKind.UNSUPPORTED));
        assertEquals(Response.Status.INTERNAL_SERVER_ERROR, StorageFailureMapper.statusFor(StorageErrorKind.UNEXPECTED));
    }
}
