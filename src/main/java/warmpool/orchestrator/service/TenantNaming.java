package warmpool.orchestrator.service;

import warmpool.orchestrator.config.PoolConfig;
import warmpool.orchestrator.model.BootstrapSecret;
import warmpool.orchestrator.model.RouteMatch;
import warmpool.orchestrator.model.RoutingMode;

import java.util.Locale;

/**
 * Deterministic names derived from a tenant key: service name, match pattern,
 * public URL, rule priority and secret names. Same key, same names, so every
 * create call is retry-safe without a central counter.
 */
public final class TenantNaming {

    private static final int SUBDOMAIN_LENGTH = 8;

    private final PoolConfig config;

    public TenantNaming(PoolConfig config) {
        this.config = config;
    }

    /** First 8 characters of the key, lower-cased, restricted to [a-z0-9-] */
    public String subdomain(String tenantKey) {
        if (tenantKey == null || tenantKey.isBlank()) {
            throw new IllegalArgumentException("tenantKey is required");
        }
        String cleaned = tenantKey.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "");
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("tenantKey has no usable characters: " + tenantKey);
        }
        return cleaned.length() <= SUBDOMAIN_LENGTH ? cleaned : cleaned.substring(0, SUBDOMAIN_LENGTH);
    }

    public String serviceName(String tenantKey) {
        return config.servicePrefix() + "-" + subdomain(tenantKey);
    }

    public RouteMatch match(String tenantKey) {
        String sub = subdomain(tenantKey);
        return config.routingMode() == RoutingMode.PATH
                ? RouteMatch.path(sub)
                : RouteMatch.host(sub, config.domain());
    }

    public String url(String tenantKey) {
        String sub = subdomain(tenantKey);
        return config.routingMode() == RoutingMode.PATH
                ? "http://" + config.albDnsName() + "/" + sub
                : "https://" + sub + "." + config.domain();
    }

    /**
     * Rule priority: 32-bit rolling hash {@code h = 31*h + c} of the service
     * name folded into {@code [min, max)}.
     */
    public int priority(String serviceName) {
        int hash = serviceName.hashCode();
        int range = config.priorityMax() - config.priorityMin();
        return config.priorityMin() + Math.abs(hash % range);
    }

    public String bootstrapSecretName(String instanceId) {
        return BootstrapSecret.nameFor(config.bootstrapSecretPattern(), instanceId);
    }

    public String tenantKeysSecretName(String instanceId) {
        return BootstrapSecret.nameFor(config.tenantKeysSecretPattern(), instanceId);
    }
}
