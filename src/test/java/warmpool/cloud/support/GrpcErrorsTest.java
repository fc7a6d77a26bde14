package warmpool.cloud.support;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.junit.jupiter.api.Test;
import warmpool.orchestrator.provider.ResourceNotFoundException;

import static org.junit.jupiter.api.Assertions.*;

class GrpcErrorsTest {

    @Test
    void notFoundIsTranslated() {
        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                () -> GrpcErrors.call("secret s1", () -> {
                    throw Status.NOT_FOUND.asRuntimeException();
                }));

        assertEquals("secret s1", e.resource());
        assertInstanceOf(StatusRuntimeException.class, e.getCause());
    }

    @Test
    void otherErrorsPropagate() {
        StatusRuntimeException e = assertThrows(StatusRuntimeException.class,
                () -> GrpcErrors.call("secret s1", () -> {
                    throw Status.PERMISSION_DENIED.asRuntimeException();
                }));

        assertEquals(Status.Code.PERMISSION_DENIED, e.getStatus().getCode());
        assertEquals("ok", GrpcErrors.call("x", () -> "ok"));
    }
}
