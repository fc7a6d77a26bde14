package warmpool.orchestrator.config;

import warmpool.orchestrator.model.HealthCheckSpec;
import warmpool.orchestrator.model.ReleasePolicy;
import warmpool.orchestrator.model.RoutingMode;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration holder for pool and provisioning settings.
 * All settings have sensible defaults.
 */
public final class PoolConfig {

    /** Exclusive upper bound for rule priorities; route names carry five digits. */
    public static final int PRIORITY_LIMIT = 100000;

    // Pool settings
    private String poolName = "warmpool";
    private int targetSpare = 2;
    private Duration coldStartTimeout = Duration.ofSeconds(180);
    private Duration coldStartPollInterval = Duration.ofSeconds(5);
    private ReleasePolicy rollbackPolicy = ReleasePolicy.RETURN_TO_POOL;

    // Scheduler settings
    private Duration replenishInterval = Duration.ofSeconds(60);
    private boolean reconcileEnabled = false;
    private int reconcileTolerance = 1;
    private Duration reconcileInterval = Duration.ofMinutes(10);

    // Remote command settings
    private Duration scriptTimeout = Duration.ofSeconds(120);
    private Duration restartTimeout = Duration.ofSeconds(180);
    private Duration healthTimeout = Duration.ofSeconds(30);
    private Duration commandPollInterval = Duration.ofSeconds(1);
    private Duration healthPollInterval = Duration.ofSeconds(1);

    // Routing settings
    private String domain = "";
    private String albDnsName = "";
    private String servicePrefix = "tenant";
    private int priorityMin = 1;
    private int priorityMax = 50000;

    // Workload settings
    private int workloadPort = 8080;
    private String healthPath = "/health";
    private Duration healthCheckInterval = Duration.ofSeconds(30);
    private Duration healthCheckTimeout = Duration.ofSeconds(5);
    private int healthyThreshold = 2;
    private int unhealthyThreshold = 3;
    private String containerName = "workload";
    private String containerImage = "";
    private String tokenEnvName = "GATEWAY_TOKEN";
    private List<String> passthroughEnv = List.of("HOSTED_USAGE_REPORT_URL", "USAGE_SERVICE_KEY");

    // Secret naming
    private String bootstrapSecretPattern = "pool/instance/{id}/token";
    private String bootstrapSecretEntry = "token";
    private String tenantKeysSecretPattern = "pool/instance/{id}/tenant-keys";
    private String platformSecretName = "pool/platform-credentials";

    private PoolConfig() {
    }

    public static PoolConfig defaults() {
        return new PoolConfig();
    }

    public static PoolConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Override defaults from {@code POOL_*} variables.
     */
    public static PoolConfig fromEnv(Map<String, String> env) {
        PoolConfig config = new PoolConfig();

        String name = env.get("POOL_NAME");
        if (isSet(name)) {
            config.poolName = name.trim();
        }

        String spare = env.get("POOL_TARGET_SPARE");
        if (isSet(spare)) {
            config.targetSpare = Integer.parseInt(spare.trim());
        }

        String coldStart = env.get("POOL_COLD_START_TIMEOUT_SECONDS");
        if (isSet(coldStart)) {
            config.coldStartTimeout = Duration.ofSeconds(Long.parseLong(coldStart.trim()));
        }

        String replenish = env.get("POOL_REPLENISH_INTERVAL_SECONDS");
        if (isSet(replenish)) {
            config.replenishInterval = Duration.ofSeconds(Long.parseLong(replenish.trim()));
        }

        String rollback = env.get("POOL_ROLLBACK_POLICY");
        if (isSet(rollback)) {
            config.rollbackPolicy = ReleasePolicy.valueOf(rollback.trim().toUpperCase(Locale.ROOT));
        }

        String reconcile = env.get("POOL_RECONCILE_ENABLED");
        if (isSet(reconcile)) {
            config.reconcileEnabled = Boolean.parseBoolean(reconcile.trim());
        }

        String tolerance = env.get("POOL_RECONCILE_TOLERANCE");
        if (isSet(tolerance)) {
            config.reconcileTolerance = Integer.parseInt(tolerance.trim());
        }

        String domain = env.get("POOL_DOMAIN");
        if (isSet(domain)) {
            config.domain = domain.trim();
        }

        String albDns = env.get("POOL_ALB_DNS_NAME");
        if (isSet(albDns)) {
            config.albDnsName = albDns.trim();
        }

        String prefix = env.get("POOL_SERVICE_PREFIX");
        if (isSet(prefix)) {
            config.servicePrefix = prefix.trim();
        }

        String priorityMin = env.get("POOL_PRIORITY_MIN");
        if (isSet(priorityMin)) {
            config.priorityMin = Integer.parseInt(priorityMin.trim());
        }

        String priorityMax = env.get("POOL_PRIORITY_MAX");
        if (isSet(priorityMax)) {
            config.priorityMax = Integer.parseInt(priorityMax.trim());
        }

        String port = env.get("POOL_WORKLOAD_PORT");
        if (isSet(port)) {
            config.workloadPort = Integer.parseInt(port.trim());
        }

        String image = env.get("POOL_CONTAINER_IMAGE");
        if (isSet(image)) {
            config.containerImage = image.trim();
        }

        String platformSecret = env.get("POOL_PLATFORM_SECRET");
        if (isSet(platformSecret)) {
            config.platformSecretName = platformSecret.trim();
        }

        return config.validate();
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * @throws IllegalArgumentException on inconsistent settings
     */
    public PoolConfig validate() {
        if (targetSpare < 0) {
            throw new IllegalArgumentException("targetSpare must be non-negative");
        }
        if (priorityMin < 1 || priorityMax <= priorityMin || priorityMax > PRIORITY_LIMIT) {
            throw new IllegalArgumentException("priority range must satisfy 1 <= min < max <= " + PRIORITY_LIMIT);
        }
        if (reconcileTolerance < 0) {
            throw new IllegalArgumentException("reconcileTolerance must be non-negative");
        }
        if (!bootstrapSecretPattern.contains("{id}") || !tenantKeysSecretPattern.contains("{id}")) {
            throw new IllegalArgumentException("secret name patterns must contain {id}");
        }
        return this;
    }

    // Getters
    public String poolName() {
        return poolName;
    }

    public int targetSpare() {
        return targetSpare;
    }

    public Duration coldStartTimeout() {
        return coldStartTimeout;
    }

    public Duration coldStartPollInterval() {
        return coldStartPollInterval;
    }

    public ReleasePolicy rollbackPolicy() {
        return rollbackPolicy;
    }

    public Duration replenishInterval() {
        return replenishInterval;
    }

    public boolean reconcileEnabled() {
        return reconcileEnabled;
    }

    public int reconcileTolerance() {
        return reconcileTolerance;
    }

    public Duration reconcileInterval() {
        return reconcileInterval;
    }

    public Duration scriptTimeout() {
        return scriptTimeout;
    }

    public Duration restartTimeout() {
        return restartTimeout;
    }

    public Duration healthTimeout() {
        return healthTimeout;
    }

    public Duration commandPollInterval() {
        return commandPollInterval;
    }

    public Duration healthPollInterval() {
        return healthPollInterval;
    }

    public String domain() {
        return domain;
    }

    public String albDnsName() {
        return albDnsName;
    }

    /** Path routing unless a custom domain is configured */
    public RoutingMode routingMode() {
        return domain == null || domain.isBlank() ? RoutingMode.PATH : RoutingMode.HOST;
    }

    public String servicePrefix() {
        return servicePrefix;
    }

    public int priorityMin() {
        return priorityMin;
    }

    public int priorityMax() {
        return priorityMax;
    }

    public int workloadPort() {
        return workloadPort;
    }

    public String healthPath() {
        return healthPath;
    }

    public HealthCheckSpec healthCheck() {
        return new HealthCheckSpec(healthPath, workloadPort, healthCheckInterval, healthCheckTimeout,
                healthyThreshold, unhealthyThreshold);
    }

    public String containerName() {
        return containerName;
    }

    public String containerImage() {
        return containerImage;
    }

    public String tokenEnvName() {
        return tokenEnvName;
    }

    public List<String> passthroughEnv() {
        return passthroughEnv;
    }

    public String bootstrapSecretPattern() {
        return bootstrapSecretPattern;
    }

    public String bootstrapSecretEntry() {
        return bootstrapSecretEntry;
    }

    public String tenantKeysSecretPattern() {
        return tenantKeysSecretPattern;
    }

    public String platformSecretName() {
        return platformSecretName;
    }

    // Fluent setters for testing/customization
    public PoolConfig withPoolName(String name) {
        this.poolName = name;
        return this;
    }

    public PoolConfig withTargetSpare(int spare) {
        this.targetSpare = spare;
        return this;
    }

    public PoolConfig withColdStartTimeout(Duration timeout) {
        this.coldStartTimeout = timeout;
        return this;
    }

    public PoolConfig withColdStartPollInterval(Duration interval) {
        this.coldStartPollInterval = interval;
        return this;
    }

    public PoolConfig withRollbackPolicy(ReleasePolicy policy) {
        this.rollbackPolicy = policy;
        return this;
    }

    public PoolConfig withPriorityRange(int min, int max) {
        this.priorityMin = min;
        this.priorityMax = max;
        return this;
    }

    public PoolConfig withReplenishInterval(Duration interval) {
        this.replenishInterval = interval;
        return this;
    }

    public PoolConfig withReconcile(boolean enabled, int tolerance) {
        this.reconcileEnabled = enabled;
        this.reconcileTolerance = tolerance;
        return this;
    }

    public PoolConfig withScriptTimeout(Duration timeout) {
        this.scriptTimeout = timeout;
        return this;
    }

    public PoolConfig withRestartTimeout(Duration timeout) {
        this.restartTimeout = timeout;
        return this;
    }

    public PoolConfig withHealthTimeout(Duration timeout) {
        this.healthTimeout = timeout;
        return this;
    }

    public PoolConfig withCommandPollInterval(Duration interval) {
        this.commandPollInterval = interval;
        return this;
    }

    public PoolConfig withDomain(String domain) {
        this.domain = domain;
        return this;
    }

    public PoolConfig withAlbDnsName(String dnsName) {
        this.albDnsName = dnsName;
        return this;
    }

    public PoolConfig withServicePrefix(String prefix) {
        this.servicePrefix = prefix;
        return this;
    }

    public PoolConfig withContainerImage(String image) {
        this.containerImage = image;
        return this;
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "pool='" + poolName + '\'' +
                ", targetSpare=" + targetSpare +
                ", routing=" + routingMode() +
                ", rollback=" + rollbackPolicy +
                ", reconcile=" + reconcileEnabled +
                '}';
    }
}
