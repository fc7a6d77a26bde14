package warmpool.orchestrator.provider;

/**
 * The control-plane bindings one pool runs against.
 */
public record CloudProviders(
        ComputeProvider compute,
        LoadBalancerControl loadBalancer,
        SecretStore secrets,
        RemoteCommandService commands,
        HealthProbe healthProbe) {
}
