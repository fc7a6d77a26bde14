package warmpool.orchestrator.model;

/**
 * How tenant traffic is matched on the shared load balancer.
 */
public enum RoutingMode {
    /** Path prefix {@code /<sub>}; used when no custom domain is configured */
    PATH,
    /** Host header {@code <sub>.<domain>} */
    HOST
}
