package warmpool.cloud.support;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import warmpool.orchestrator.provider.ResourceNotFoundException;

import java.util.function.Supplier;

/**
 * Maps gRPC failures onto the provider error contract: NOT_FOUND becomes
 * {@link ResourceNotFoundException}, anything else propagates unchanged.
 */
public final class GrpcErrors {

    private GrpcErrors() {}

    public static boolean isNotFound(StatusRuntimeException e) {
        return e.getStatus().getCode() == Status.Code.NOT_FOUND;
    }

    public static <T> T call(String resource, Supplier<T> call) {
        try {
            return call.get();
        } catch (StatusRuntimeException e) {
            if (isNotFound(e)) {
                throw new ResourceNotFoundException(resource, e);
            }
            throw e;
        }
    }
}
