package warmpool.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.orchestrator.config.PoolConfig;
import warmpool.orchestrator.error.PoolException;
import warmpool.orchestrator.error.RemoteCommandTimedOutException;
import warmpool.orchestrator.model.ApiProvider;
import warmpool.orchestrator.model.KeyUpdateResult;
import warmpool.orchestrator.model.PoolInstance;
import warmpool.orchestrator.model.RemoteCommand;
import warmpool.orchestrator.model.RemoteCommandRequest;
import warmpool.orchestrator.provider.HealthProbe;
import warmpool.orchestrator.provider.ResourceNotFoundException;
import warmpool.orchestrator.provider.SecretStore;
import warmpool.orchestrator.util.Backoff;
import warmpool.orchestrator.util.BoundedPoller;
import warmpool.orchestrator.util.PollOutcome;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies tenant API key changes by restarting the workload container with
 * platform keys merged under the tenant's own keys.
 */
public class CredentialRotator {

    private static final Logger log = LoggerFactory.getLogger(CredentialRotator.class);

    static final int MIN_KEY_LENGTH = 10;

    private final SecretStore secrets;
    private final RemoteCommandExecutor executor;
    private final HealthProbe healthProbe;
    private final PoolInventory inventory;
    private final BoundedPoller poller;
    private final CredentialMerger merger;
    private final TenantNaming naming;
    private final PoolConfig config;

    public CredentialRotator(SecretStore secrets, RemoteCommandExecutor executor, HealthProbe healthProbe,
                             PoolInventory inventory, BoundedPoller poller, CredentialMerger merger,
                             TenantNaming naming, PoolConfig config) {
        this.secrets = secrets;
        this.executor = executor;
        this.healthProbe = healthProbe;
        this.inventory = inventory;
        this.poller = poller;
        this.merger = merger;
        this.naming = naming;
        this.config = config;
    }

    /**
     * Store a tenant key for one provider, then restart to apply it.
     *
     * @throws IllegalArgumentException if the key is shorter than 10 characters
     */
    public KeyUpdateResult setTenantKey(String instanceId, ApiProvider provider, String apiKey) {
        if (apiKey == null || apiKey.trim().length() < MIN_KEY_LENGTH) {
            throw new IllegalArgumentException("API key is required");
        }
        String secretName = naming.tenantKeysSecretName(instanceId);
        Map<String, String> keys = new LinkedHashMap<>(secrets.read(secretName).orElse(Map.of()));
        keys.put(provider.envName(), apiKey.trim());
        secrets.write(secretName, keys);
        log.info("Stored {} key for instance {}", provider.id(), instanceId);
        return restartAfterKeyChange(instanceId, provider);
    }

    /**
     * Drop a tenant key so the platform key (if any) applies again.
     */
    public KeyUpdateResult removeTenantKey(String instanceId, ApiProvider provider) {
        String secretName = naming.tenantKeysSecretName(instanceId);
        Map<String, String> keys = new LinkedHashMap<>(secrets.read(secretName).orElse(Map.of()));
        if (keys.remove(provider.envName()) == null) {
            log.info("No {} key stored for instance {}", provider.id(), instanceId);
        }
        if (keys.isEmpty()) {
            try {
                secrets.delete(secretName);
            } catch (ResourceNotFoundException e) {
                log.info("Tenant key secret {} already absent", secretName);
            }
        } else {
            secrets.write(secretName, keys);
        }
        return restartAfterKeyChange(instanceId, provider);
    }

    /**
     * Environment the workload runs with: platform keys overridden by tenant
     * keys, filtered to provider and passthrough variables.
     */
    public Map<String, String> mergedEnvironment(String instanceId) {
        Map<String, String> platform = secrets.read(config.platformSecretName()).orElse(Map.of());
        Map<String, String> tenant = secrets.read(naming.tenantKeysSecretName(instanceId)).orElse(Map.of());
        return merger.containerEnvironment(platform, tenant);
    }

    /**
     * Restart the workload container with the merged environment and wait for
     * its health endpoint.
     *
     * @throws RemoteCommandTimedOutException restart or health wait exceeded its bound
     * @throws PoolException                  instance unknown or restart failed
     */
    public RemoteCommand restartWithMergedKeys(String instanceId) {
        PoolInstance instance = inventory.findById(instanceId)
                .orElseThrow(() -> new PoolException("Instance " + instanceId + " not found in pool"));

        RemoteCommandRequest request = new RemoteCommandRequest(List.of(
                "workload", "restart",
                "--container", config.containerName(),
                "--image", config.containerImage(),
                "--port", Integer.toString(config.workloadPort()),
                "--preserve-env", config.tokenEnvName()),
                mergedEnvironment(instanceId),
                config.restartTimeout().toSeconds());

        RemoteCommand command = executor.runRemoteScript(instanceId, request, config.restartTimeout());
        awaitHealthy(instance, command.id());
        log.info("Workload on {} restarted and healthy", instanceId);
        return command;
    }

    private void awaitHealthy(PoolInstance instance, String commandId) {
        String address = Optional.ofNullable(instance.privateIp()).orElse(instance.publicIp());
        PollOutcome<Boolean> healthy = poller.poll(
                "workload health on " + instance.id(),
                config.healthTimeout(),
                Backoff.fixed(config.healthPollInterval()),
                () -> healthProbe.isHealthy(address) ? Optional.of(Boolean.TRUE) : Optional.empty());

        if (healthy.isTimedOut()) {
            throw new RemoteCommandTimedOutException(instance.id(), commandId, config.healthTimeout(),
                    "Workload on " + instance.id() + " did not become healthy within "
                            + config.healthTimeout().toSeconds() + "s",
                    healthy.lastError().orElse(null));
        }
    }

    private KeyUpdateResult restartAfterKeyChange(String instanceId, ApiProvider provider) {
        try {
            RemoteCommand command = restartWithMergedKeys(instanceId);
            return KeyUpdateResult.applied(provider, command.id());
        } catch (PoolException e) {
            log.warn("Restart after {} key change on {} failed: {}", provider.id(), instanceId, e.getMessage());
            return KeyUpdateResult.savedWithoutRestart(provider, e.getMessage());
        }
    }
}
