package warmpool.cloud.compute;

import com.google.protobuf.FieldMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.cloud.auth.CloudSession;
import warmpool.cloud.config.CloudConfig;
import warmpool.cloud.support.GrpcErrors;
import warmpool.cloud.support.OperationWaiter;
import warmpool.orchestrator.model.ComputeInstance;
import warmpool.orchestrator.model.LaunchSpec;
import warmpool.orchestrator.provider.ComputeProvider;
import warmpool.orchestrator.provider.ResourceNotFoundException;
import yandex.cloud.api.compute.v1.InstanceOuterClass;
import yandex.cloud.api.compute.v1.InstanceServiceOuterClass;
import yandex.cloud.api.operation.OperationOuterClass;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compute Cloud instances; pool state lives in instance labels.
 */
public class YandexComputeProvider implements ComputeProvider {

    private static final Logger log = LoggerFactory.getLogger(YandexComputeProvider.class);

    private static final Set<InstanceOuterClass.Instance.Status> LIVE = EnumSet.of(
            InstanceOuterClass.Instance.Status.PROVISIONING,
            InstanceOuterClass.Instance.Status.STARTING,
            InstanceOuterClass.Instance.Status.RUNNING,
            InstanceOuterClass.Instance.Status.RESTARTING,
            InstanceOuterClass.Instance.Status.UPDATING);

    private static final int PAGE_SIZE = 1000;

    private final CloudSession session;
    private final OperationWaiter waiter;
    private final CloudConfig cfg;
    private final String userData;

    public YandexComputeProvider(CloudSession session, OperationWaiter waiter, CloudConfig cfg, String poolName) {
        this.session = session;
        this.waiter = waiter;
        this.cfg = cfg;
        this.userData = CloudInitBuilder.buildUserData(cfg.sshUser(), cfg.sshPublicKey(), poolName, cfg.agentPort());
    }

    /**
     * The list API filters by name only, so labels are matched here.
     */
    @Override
    public List<ComputeInstance> listInstances(String labelKey, String labelValue) {
        List<ComputeInstance> result = new ArrayList<>();
        String pageToken = "";
        do {
            var resp = session.getInstanceService().list(
                    InstanceServiceOuterClass.ListInstancesRequest.newBuilder()
                            .setFolderId(cfg.folderId())
                            .setPageSize(PAGE_SIZE)
                            .setPageToken(pageToken)
                            .build());
            for (InstanceOuterClass.Instance inst : resp.getInstancesList()) {
                if (labelValue.equals(inst.getLabelsMap().get(labelKey))) {
                    result.add(toComputeInstance(inst));
                }
            }
            pageToken = resp.getNextPageToken();
        } while (!pageToken.isEmpty());
        return result;
    }

    @Override
    public Optional<ComputeInstance> getInstance(String instanceId) {
        try {
            InstanceOuterClass.Instance inst = GrpcErrors.call("instance " + instanceId, () ->
                    session.getInstanceService().get(InstanceServiceOuterClass.GetInstanceRequest.newBuilder()
                            .setInstanceId(instanceId)
                            .build()));
            return Optional.of(toComputeInstance(inst));
        } catch (ResourceNotFoundException e) {
            return Optional.empty();
        }
    }

    /**
     * Sends the create request and waits for the operation, so a subnet
     * without capacity fails here rather than later.
     */
    @Override
    public String launchInstance(LaunchSpec spec) {
        var req = InstanceRequestBuilder.build(cfg, spec, userData);
        OperationOuterClass.Operation op = session.getInstanceService().create(req);

        String instanceId = OperationWaiter.unpack(op.getMetadata(),
                InstanceServiceOuterClass.CreateInstanceMetadata.class).getInstanceId();
        log.info("Create sent: name={} id={} subnet={}", spec.name(), instanceId, spec.subnetId());

        waiter.await(op, "create instance " + spec.name());
        return instanceId;
    }

    @Override
    public void updateLabels(String instanceId, Map<String, String> set, Set<String> remove) {
        String resource = "instance " + instanceId;
        InstanceOuterClass.Instance inst = GrpcErrors.call(resource, () ->
                session.getInstanceService().get(InstanceServiceOuterClass.GetInstanceRequest.newBuilder()
                        .setInstanceId(instanceId)
                        .build()));

        Map<String, String> labels = new HashMap<>(inst.getLabelsMap());
        remove.forEach(labels::remove);
        labels.putAll(set);

        OperationOuterClass.Operation op = GrpcErrors.call(resource, () ->
                session.getInstanceService().update(InstanceServiceOuterClass.UpdateInstanceRequest.newBuilder()
                        .setInstanceId(instanceId)
                        .setUpdateMask(FieldMask.newBuilder().addPaths("labels").build())
                        .putAllLabels(labels)
                        .build()));
        waiter.await(op, resource);
    }

    @Override
    public void terminate(String instanceId) {
        String resource = "instance " + instanceId;
        OperationOuterClass.Operation op = GrpcErrors.call(resource, () ->
                session.getInstanceService().delete(InstanceServiceOuterClass.DeleteInstanceRequest.newBuilder()
                        .setInstanceId(instanceId)
                        .build()));
        waiter.await(op, resource);
    }

    static ComputeInstance toComputeInstance(InstanceOuterClass.Instance inst) {
        String privateIp = null;
        String publicIp = null;
        String subnetId = null;
        if (inst.getNetworkInterfacesCount() > 0) {
            var nic = inst.getNetworkInterfaces(0);
            var addr = nic.getPrimaryV4Address();
            subnetId = nic.getSubnetId();
            privateIp = addr.getAddress().isEmpty() ? null : addr.getAddress();
            publicIp = addr.hasOneToOneNat() && !addr.getOneToOneNat().getAddress().isEmpty()
                    ? addr.getOneToOneNat().getAddress()
                    : null;
        }
        Instant createdAt = inst.hasCreatedAt()
                ? Instant.ofEpochSecond(inst.getCreatedAt().getSeconds(), inst.getCreatedAt().getNanos())
                : null;
        return new ComputeInstance(inst.getId(), inst.getName(), inst.getLabelsMap(), privateIp, publicIp,
                subnetId, LIVE.contains(inst.getStatus()), createdAt);
    }
}
