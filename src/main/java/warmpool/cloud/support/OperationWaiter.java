package warmpool.cloud.support;

import com.google.protobuf.Any;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import io.grpc.Status;
import warmpool.orchestrator.error.PoolException;
import warmpool.orchestrator.provider.ResourceNotFoundException;
import yandex.cloud.api.operation.OperationOuterClass;
import yandex.cloud.api.operation.OperationServiceGrpc;
import yandex.cloud.sdk.utils.OperationUtils;

import java.time.Duration;

/**
 * Waits for long-running Yandex Cloud operations with the SDK's
 * {@link OperationUtils} and maps failed operations to pool errors.
 */
public class OperationWaiter {

    private final OperationServiceGrpc.OperationServiceBlockingStub operations;
    private final Duration timeout;

    public OperationWaiter(OperationServiceGrpc.OperationServiceBlockingStub operations, Duration timeout) {
        this.operations = operations;
        this.timeout = timeout;
    }

    /**
     * Block until the operation is done.
     *
     * @param what resource description used in errors
     * @throws ResourceNotFoundException if the operation failed with NOT_FOUND
     * @throws PoolException             on any other operation error, timeout or interrupt
     */
    public OperationOuterClass.Operation await(OperationOuterClass.Operation op, String what) {
        OperationOuterClass.Operation done = op;
        if (!op.getDone()) {
            try {
                done = OperationUtils.wait(operations, op, timeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PoolException("Interrupted while waiting for operation " + op.getId() + " (" + what + ")", e);
            } catch (RuntimeException e) {
                throw new PoolException("Operation " + op.getId() + " (" + what + ") not done within "
                        + timeout.toSeconds() + "s: " + e.getMessage(), e);
            }
        }
        return check(done, what);
    }

    static OperationOuterClass.Operation check(OperationOuterClass.Operation done, String what) {
        if (done.hasError()) {
            if (done.getError().getCode() == Status.Code.NOT_FOUND.value()) {
                throw new ResourceNotFoundException(what);
            }
            throw new PoolException(what + ": " + done.getError().getMessage());
        }
        return done;
    }

    public static <T extends Message> T unpack(Any any, Class<T> type) {
        try {
            return any.unpack(type);
        } catch (InvalidProtocolBufferException e) {
            throw new PoolException("Unexpected operation payload, wanted " + type.getSimpleName(), e);
        }
    }
}
