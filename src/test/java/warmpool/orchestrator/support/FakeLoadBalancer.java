package warmpool.orchestrator.support;

import warmpool.orchestrator.model.BackendTarget;
import warmpool.orchestrator.model.HealthCheckSpec;
import warmpool.orchestrator.model.RouteMatch;
import warmpool.orchestrator.provider.LoadBalancerControl;
import warmpool.orchestrator.provider.ResourceNotFoundException;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory load balancer. Creates return an existing group or rule of the
 * same name or match. A target group still referenced by a rule cannot be
 * deleted.
 */
public class FakeLoadBalancer implements LoadBalancerControl {

    private record Rule(String name, RouteMatch match, int priority, String targetGroupId) {
    }

    private final Map<String, String> targetGroups = new LinkedHashMap<>();
    private final Map<String, Set<BackendTarget>> targets = new LinkedHashMap<>();
    private final Map<String, Rule> rules = new LinkedHashMap<>();
    private int counter;
    private RuntimeException nextRuleFailure;
    private RuntimeException nextRegisterFailure;

    public synchronized void failNextRule(RuntimeException error) {
        this.nextRuleFailure = error;
    }

    public synchronized void failNextRegister(RuntimeException error) {
        this.nextRegisterFailure = error;
    }

    public synchronized int targetGroupCount() {
        return targetGroups.size();
    }

    public synchronized int ruleCount() {
        return rules.size();
    }

    public synchronized Set<BackendTarget> targets(String targetGroupId) {
        return Set.copyOf(targets.getOrDefault(targetGroupId, Set.of()));
    }

    public synchronized int priorityOf(String ruleId) {
        return rules.get(ruleId).priority();
    }

    @Override
    public synchronized String createTargetGroup(String name, HealthCheckSpec healthCheck) {
        Optional<String> existing = findTargetGroup(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        String id = "tg-" + (++counter);
        targetGroups.put(id, name);
        targets.put(id, new HashSet<>());
        return id;
    }

    @Override
    public synchronized Optional<String> findTargetGroup(String name) {
        return targetGroups.entrySet().stream()
                .filter(e -> e.getValue().equals(name))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    @Override
    public synchronized void deleteTargetGroup(String targetGroupId) {
        if (!targetGroups.containsKey(targetGroupId)) {
            throw new ResourceNotFoundException("target group " + targetGroupId);
        }
        if (rules.values().stream().anyMatch(r -> r.targetGroupId().equals(targetGroupId))) {
            throw new IllegalStateException("target group " + targetGroupId + " is in use");
        }
        targetGroups.remove(targetGroupId);
        targets.remove(targetGroupId);
    }

    @Override
    public synchronized void registerTarget(String targetGroupId, BackendTarget target) {
        if (nextRegisterFailure != null) {
            RuntimeException e = nextRegisterFailure;
            nextRegisterFailure = null;
            throw e;
        }
        requireGroup(targetGroupId).add(target);
    }

    @Override
    public synchronized void deregisterTarget(String targetGroupId, BackendTarget target) {
        if (!requireGroup(targetGroupId).remove(target)) {
            throw new ResourceNotFoundException("target " + target.ipAddress());
        }
    }

    @Override
    public synchronized String createRule(String name, RouteMatch match, int priority, String targetGroupId) {
        if (nextRuleFailure != null) {
            RuntimeException e = nextRuleFailure;
            nextRuleFailure = null;
            throw e;
        }
        requireGroup(targetGroupId);
        Optional<String> existing = findRule(match);
        if (existing.isPresent()) {
            return existing.get();
        }
        String id = "rule-" + (++counter);
        rules.put(id, new Rule(name, match, priority, targetGroupId));
        return id;
    }

    @Override
    public synchronized Optional<String> findRule(RouteMatch match) {
        return rules.entrySet().stream()
                .filter(e -> e.getValue().match().equals(match))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    @Override
    public synchronized void deleteRule(String ruleId) {
        if (rules.remove(ruleId) == null) {
            throw new ResourceNotFoundException("rule " + ruleId);
        }
    }

    private Set<BackendTarget> requireGroup(String targetGroupId) {
        Set<BackendTarget> set = targets.get(targetGroupId);
        if (set == null) {
            throw new ResourceNotFoundException("target group " + targetGroupId);
        }
        return set;
    }
}
