package warmpool.orchestrator.provider;

import warmpool.orchestrator.model.BackendTarget;
import warmpool.orchestrator.model.HealthCheckSpec;
import warmpool.orchestrator.model.RouteMatch;

import java.util.Optional;

/**
 * Shared load balancer control plane: target groups, targets and routing rules.
 * Delete and deregister calls throw {@link ResourceNotFoundException} when the
 * resource is already gone.
 */
public interface LoadBalancerControl {

    /**
     * Create a health-checked target group, or return the one already
     * carrying that name.
     *
     * @return target group id
     */
    String createTargetGroup(String name, HealthCheckSpec healthCheck);

    /**
     * Find a target group by the name it was created with.
     */
    Optional<String> findTargetGroup(String name);

    void deleteTargetGroup(String targetGroupId);

    void registerTarget(String targetGroupId, BackendTarget target);

    void deregisterTarget(String targetGroupId, BackendTarget target);

    /**
     * Create a rule forwarding matching traffic to a target group. A rule with
     * the same match that already exists is returned instead.
     *
     * @param name          rule name
     * @param match         path or host match
     * @param priority      ordering among rules; lower wins
     * @param targetGroupId destination
     * @return rule id
     */
    String createRule(String name, RouteMatch match, int priority, String targetGroupId);

    /**
     * Find a rule by its match pattern.
     */
    Optional<String> findRule(RouteMatch match);

    void deleteRule(String ruleId);
}
