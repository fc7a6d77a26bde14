package warmpool.cloud.auth;

import warmpool.cloud.config.CloudConfig;
import yandex.cloud.api.apploadbalancer.v1.BackendGroupServiceGrpc;
import yandex.cloud.api.apploadbalancer.v1.TargetGroupServiceGrpc;
import yandex.cloud.api.apploadbalancer.v1.VirtualHostServiceGrpc;
import yandex.cloud.api.compute.v1.InstanceServiceGrpc;
import yandex.cloud.api.lockbox.v1.PayloadServiceGrpc;
import yandex.cloud.api.lockbox.v1.SecretServiceGrpc;
import yandex.cloud.api.operation.OperationServiceGrpc;
import yandex.cloud.sdk.ServiceFactory;
import yandex.cloud.sdk.auth.Auth;

import java.time.Duration;

/**
 * Authenticated gRPC stubs for every Yandex Cloud service the pool talks to.
 */
public class CloudSession {
    private final OperationServiceGrpc.OperationServiceBlockingStub operationService;
    private final InstanceServiceGrpc.InstanceServiceBlockingStub instanceService;
    private final TargetGroupServiceGrpc.TargetGroupServiceBlockingStub targetGroupService;
    private final BackendGroupServiceGrpc.BackendGroupServiceBlockingStub backendGroupService;
    private final VirtualHostServiceGrpc.VirtualHostServiceBlockingStub virtualHostService;
    private final SecretServiceGrpc.SecretServiceBlockingStub secretService;
    private final PayloadServiceGrpc.PayloadServiceBlockingStub payloadService;

    public CloudSession(CloudConfig config) {
        ServiceFactory factory = buildFactory(config);

        this.operationService = factory.create(
                OperationServiceGrpc.OperationServiceBlockingStub.class,
                OperationServiceGrpc::newBlockingStub
        );
        this.instanceService = factory.create(
                InstanceServiceGrpc.InstanceServiceBlockingStub.class,
                InstanceServiceGrpc::newBlockingStub
        );
        this.targetGroupService = factory.create(
                TargetGroupServiceGrpc.TargetGroupServiceBlockingStub.class,
                TargetGroupServiceGrpc::newBlockingStub
        );
        this.backendGroupService = factory.create(
                BackendGroupServiceGrpc.BackendGroupServiceBlockingStub.class,
                BackendGroupServiceGrpc::newBlockingStub
        );
        this.virtualHostService = factory.create(
                VirtualHostServiceGrpc.VirtualHostServiceBlockingStub.class,
                VirtualHostServiceGrpc::newBlockingStub
        );
        this.secretService = factory.create(
                SecretServiceGrpc.SecretServiceBlockingStub.class,
                SecretServiceGrpc::newBlockingStub
        );
        this.payloadService = factory.create(
                PayloadServiceGrpc.PayloadServiceBlockingStub.class,
                PayloadServiceGrpc::newBlockingStub
        );
    }

    private static ServiceFactory buildFactory(CloudConfig config) {
        var credentials = Auth.oauthTokenBuilder();
        if (config.oauthToken() == null || config.oauthToken().isBlank()) {
            credentials.fromEnv("OAUTH_TOKEN");
        } else {
            credentials.oauth(config.oauthToken());
        }
        return ServiceFactory.builder()
                .credentialProvider(credentials)
                .requestTimeout(Duration.ofMinutes(1))
                .build();
    }

    public OperationServiceGrpc.OperationServiceBlockingStub getOperationService() { return operationService; }
    public InstanceServiceGrpc.InstanceServiceBlockingStub getInstanceService() { return instanceService; }
    public TargetGroupServiceGrpc.TargetGroupServiceBlockingStub getTargetGroupService() { return targetGroupService; }
    public BackendGroupServiceGrpc.BackendGroupServiceBlockingStub getBackendGroupService() { return backendGroupService; }
    public VirtualHostServiceGrpc.VirtualHostServiceBlockingStub getVirtualHostService() { return virtualHostService; }
    public SecretServiceGrpc.SecretServiceBlockingStub getSecretService() { return secretService; }
    public PayloadServiceGrpc.PayloadServiceBlockingStub getPayloadService() { return payloadService; }
}
