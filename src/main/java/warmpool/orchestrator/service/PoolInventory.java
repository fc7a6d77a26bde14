package warmpool.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.orchestrator.config.PoolConfig;
import warmpool.orchestrator.model.ComputeInstance;
import warmpool.orchestrator.model.InstanceStatus;
import warmpool.orchestrator.model.PoolInstance;
import warmpool.orchestrator.model.PoolStats;
import warmpool.orchestrator.provider.ComputeProvider;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the pool. Every call re-queries the compute provider and
 * derives status, tenant and addresses from instance labels; nothing is cached.
 */
public class PoolInventory {

    private static final Logger log = LoggerFactory.getLogger(PoolInventory.class);

    public static final String POOL_LABEL = "pool";
    public static final String STATUS_LABEL = "status";
    public static final String TENANT_ID_LABEL = "tenant-id";
    public static final String TENANT_KEY_LABEL = "tenant-key";

    private final ComputeProvider compute;
    private final TenantNaming naming;
    private final PoolConfig config;

    public PoolInventory(ComputeProvider compute, TenantNaming naming, PoolConfig config) {
        this.compute = compute;
        this.naming = naming;
        this.config = config;
    }

    /**
     * Snapshot of all live pool instances, in provider listing order.
     */
    public List<PoolInstance> listInstances() {
        List<PoolInstance> instances = compute.listInstances(POOL_LABEL, config.poolName()).stream()
                .filter(ComputeInstance::live)
                .map(this::toPoolInstance)
                .toList();
        log.debug("Pool '{}' listing: {} live instances", config.poolName(), instances.size());
        return instances;
    }

    public List<PoolInstance> listAvailable() {
        return listInstances().stream()
                .filter(PoolInstance::isAvailable)
                .toList();
    }

    /**
     * Find a live pool instance by id.
     */
    public Optional<PoolInstance> findById(String instanceId) {
        return compute.getInstance(instanceId)
                .filter(ComputeInstance::live)
                .filter(i -> config.poolName().equals(i.label(POOL_LABEL)))
                .map(this::toPoolInstance);
    }

    /**
     * Find the instance assigned to a tenant.
     */
    public Optional<PoolInstance> findByTenant(String tenantId) {
        return listInstances().stream()
                .filter(i -> i.isAssignedTo(tenantId))
                .findFirst();
    }

    public PoolStats stats() {
        return PoolStats.of(listInstances());
    }

    PoolInstance toPoolInstance(ComputeInstance raw) {
        InstanceStatus status = InstanceStatus.fromLabel(raw.label(STATUS_LABEL));
        // an available instance never has an owner, whatever stale labels say
        String tenantId = status == InstanceStatus.ASSIGNED ? raw.label(TENANT_ID_LABEL) : null;
        String tenantKey = status == InstanceStatus.ASSIGNED ? raw.label(TENANT_KEY_LABEL) : null;
        return PoolInstance.builder()
                .id(raw.id())
                .status(status)
                .privateIp(raw.privateIp())
                .publicIp(raw.publicIp())
                .subnetId(raw.subnetId())
                .tenantId(tenantId)
                .tenantKey(tenantKey)
                .secretName(naming.bootstrapSecretName(raw.id()))
                .launchedAt(raw.createdAt())
                .build();
    }
}
