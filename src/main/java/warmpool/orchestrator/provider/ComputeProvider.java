package warmpool.orchestrator.provider;

import warmpool.orchestrator.model.ComputeInstance;
import warmpool.orchestrator.model.LaunchSpec;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compute control plane: instances and their labels.
 */
public interface ComputeProvider {

    /**
     * List instances carrying the given label.
     *
     * @param labelKey   label key
     * @param labelValue required value
     * @return matching instances, live or not
     */
    List<ComputeInstance> listInstances(String labelKey, String labelValue);

    /**
     * Get a single instance.
     *
     * @param instanceId provider instance id
     * @return the instance if it exists
     */
    Optional<ComputeInstance> getInstance(String instanceId);

    /**
     * Launch one instance. Returns once the provider accepted the request;
     * the instance may still be booting.
     *
     * @param spec placement, name and initial labels
     * @return new instance id
     */
    String launchInstance(LaunchSpec spec);

    /**
     * Set and remove labels. Last writer wins; no compare-and-swap.
     *
     * @param instanceId provider instance id
     * @param set        labels to add or overwrite
     * @param remove     label keys to drop
     * @throws ResourceNotFoundException if the instance does not exist
     */
    void updateLabels(String instanceId, Map<String, String> set, Set<String> remove);

    /**
     * Terminate an instance.
     *
     * @param instanceId provider instance id
     * @throws ResourceNotFoundException if the instance does not exist
     */
    void terminate(String instanceId);
}
