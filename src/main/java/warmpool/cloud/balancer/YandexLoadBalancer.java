package warmpool.cloud.balancer;

import com.google.protobuf.FieldMask;
import com.google.protobuf.Int64Value;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.cloud.auth.CloudSession;
import warmpool.cloud.config.CloudConfig;
import warmpool.cloud.support.GrpcErrors;
import warmpool.cloud.support.OperationWaiter;
import warmpool.orchestrator.error.PoolException;
import warmpool.orchestrator.model.BackendTarget;
import warmpool.orchestrator.model.HealthCheckSpec;
import warmpool.orchestrator.model.RouteMatch;
import warmpool.orchestrator.model.RoutingMode;
import warmpool.orchestrator.provider.LoadBalancerControl;
import warmpool.orchestrator.provider.ResourceNotFoundException;
import warmpool.orchestrator.util.BoundedPoller;
import yandex.cloud.api.apploadbalancer.v1.BackendGroupOuterClass;
import yandex.cloud.api.apploadbalancer.v1.BackendGroupServiceOuterClass;
import yandex.cloud.api.apploadbalancer.v1.TargetGroupOuterClass;
import yandex.cloud.api.apploadbalancer.v1.TargetGroupServiceOuterClass;
import yandex.cloud.api.apploadbalancer.v1.VirtualHostOuterClass;
import yandex.cloud.api.apploadbalancer.v1.VirtualHostServiceOuterClass;
import yandex.cloud.api.operation.OperationOuterClass;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Application Load Balancer binding.
 *
 * <p>A tenant target group is an ALB target group plus a backend group of the
 * same name that carries the HTTP health check. Creating either again returns
 * the existing one. Path rules are routes in the shared virtual host (see
 * {@link RouteTable}) matching {@code /<sub>} and everything below
 * {@code /<sub>/}; host rules are one virtual host per tenant.</p>
 */
public class YandexLoadBalancer implements LoadBalancerControl {

    private static final Logger log = LoggerFactory.getLogger(YandexLoadBalancer.class);

    private static final int PAGE_SIZE = 1000;
    private static final Duration ROUTE_WRITE_TIMEOUT = Duration.ofMinutes(2);

    private final CloudSession session;
    private final OperationWaiter waiter;
    private final CloudConfig cfg;
    private final RouteTable routes;

    public YandexLoadBalancer(CloudSession session, OperationWaiter waiter, CloudConfig cfg, BoundedPoller poller) {
        this.session = session;
        this.waiter = waiter;
        this.cfg = cfg;
        this.routes = new RouteTable(new GrpcSharedHost(), poller, ROUTE_WRITE_TIMEOUT);
    }

    // ===== target groups =====

    @Override
    public String createTargetGroup(String name, HealthCheckSpec healthCheck) {
        Optional<String> existing = findTargetGroup(name);
        String targetGroupId;
        if (existing.isPresent()) {
            targetGroupId = existing.get();
            log.info("Target group {} already exists ({})", name, targetGroupId);
        } else {
            OperationOuterClass.Operation op = session.getTargetGroupService().create(
                    TargetGroupServiceOuterClass.CreateTargetGroupRequest.newBuilder()
                            .setFolderId(cfg.folderId())
                            .setName(name)
                            .build());
            targetGroupId = OperationWaiter.unpack(op.getMetadata(),
                    TargetGroupServiceOuterClass.CreateTargetGroupMetadata.class).getTargetGroupId();
            waiter.await(op, "create target group " + name);
        }

        if (findBackendGroup(name).isPresent()) {
            log.info("Backend group {} already exists", name);
            return targetGroupId;
        }
        try {
            createBackendGroup(name, targetGroupId, healthCheck);
        } catch (RuntimeException e) {
            if (existing.isEmpty()) {
                try {
                    deleteTargetGroupOnly(targetGroupId);
                } catch (RuntimeException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw e;
        }
        return targetGroupId;
    }

    private void createBackendGroup(String name, String targetGroupId, HealthCheckSpec hc) {
        var check = BackendGroupOuterClass.HealthCheck.newBuilder()
                .setTimeout(protoDuration(hc.timeout()))
                .setInterval(protoDuration(hc.interval()))
                .setHealthyThreshold(hc.healthyThreshold())
                .setUnhealthyThreshold(hc.unhealthyThreshold())
                .setHealthcheckPort(hc.port())
                .setHttp(BackendGroupOuterClass.HealthCheck.HttpHealthCheck.newBuilder()
                        .setPath(hc.path())
                        .build())
                .build();

        var backend = BackendGroupOuterClass.HttpBackend.newBuilder()
                .setName(name)
                .setBackendWeight(Int64Value.of(100))
                .setPort(hc.port())
                .setTargetGroups(BackendGroupOuterClass.TargetGroupsBackend.newBuilder()
                        .addTargetGroupIds(targetGroupId)
                        .build())
                .addHealthchecks(check)
                .build();

        OperationOuterClass.Operation op = session.getBackendGroupService().create(
                BackendGroupServiceOuterClass.CreateBackendGroupRequest.newBuilder()
                        .setFolderId(cfg.folderId())
                        .setName(name)
                        .setHttp(BackendGroupOuterClass.HttpBackendGroup.newBuilder()
                                .addBackends(backend)
                                .build())
                        .build());
        waiter.await(op, "create backend group " + name);
    }

    @Override
    public Optional<String> findTargetGroup(String name) {
        var resp = session.getTargetGroupService().list(
                TargetGroupServiceOuterClass.ListTargetGroupsRequest.newBuilder()
                        .setFolderId(cfg.folderId())
                        .setFilter("name=\"" + name + "\"")
                        .build());
        return resp.getTargetGroupsList().stream()
                .filter(tg -> name.equals(tg.getName()))
                .map(TargetGroupOuterClass.TargetGroup::getId)
                .findFirst();
    }

    /**
     * Deletes the backend groups pointing at the target group first; the
     * target group cannot be removed while referenced.
     */
    @Override
    public void deleteTargetGroup(String targetGroupId) {
        for (String backendGroupId : backendGroupsReferencing(targetGroupId)) {
            try {
                OperationOuterClass.Operation op = GrpcErrors.call("backend group " + backendGroupId, () ->
                        session.getBackendGroupService().delete(
                                BackendGroupServiceOuterClass.DeleteBackendGroupRequest.newBuilder()
                                        .setBackendGroupId(backendGroupId)
                                        .build()));
                waiter.await(op, "backend group " + backendGroupId);
                log.info("Deleted backend group {}", backendGroupId);
            } catch (ResourceNotFoundException e) {
                log.info("Backend group {} already absent", backendGroupId);
            }
        }
        deleteTargetGroupOnly(targetGroupId);
    }

    private void deleteTargetGroupOnly(String targetGroupId) {
        String resource = "target group " + targetGroupId;
        OperationOuterClass.Operation op = GrpcErrors.call(resource, () ->
                session.getTargetGroupService().delete(
                        TargetGroupServiceOuterClass.DeleteTargetGroupRequest.newBuilder()
                                .setTargetGroupId(targetGroupId)
                                .build()));
        waiter.await(op, resource);
    }

    private List<String> backendGroupsReferencing(String targetGroupId) {
        List<String> ids = new ArrayList<>();
        String pageToken = "";
        do {
            var resp = session.getBackendGroupService().list(
                    BackendGroupServiceOuterClass.ListBackendGroupsRequest.newBuilder()
                            .setFolderId(cfg.folderId())
                            .setPageSize(PAGE_SIZE)
                            .setPageToken(pageToken)
                            .build());
            for (BackendGroupOuterClass.BackendGroup group : resp.getBackendGroupsList()) {
                if (group.hasHttp() && group.getHttp().getBackendsList().stream()
                        .anyMatch(b -> b.hasTargetGroups()
                                && b.getTargetGroups().getTargetGroupIdsList().contains(targetGroupId))) {
                    ids.add(group.getId());
                }
            }
            pageToken = resp.getNextPageToken();
        } while (!pageToken.isEmpty());
        return ids;
    }

    private Optional<String> findBackendGroup(String name) {
        var resp = session.getBackendGroupService().list(
                BackendGroupServiceOuterClass.ListBackendGroupsRequest.newBuilder()
                        .setFolderId(cfg.folderId())
                        .setFilter("name=\"" + name + "\"")
                        .build());
        return resp.getBackendGroupsList().stream()
                .filter(bg -> name.equals(bg.getName()))
                .map(BackendGroupOuterClass.BackendGroup::getId)
                .findFirst();
    }

    // ===== targets =====

    @Override
    public void registerTarget(String targetGroupId, BackendTarget target) {
        String resource = "target group " + targetGroupId;
        OperationOuterClass.Operation op = GrpcErrors.call(resource, () ->
                session.getTargetGroupService().addTargets(
                        TargetGroupServiceOuterClass.AddTargetsRequest.newBuilder()
                                .setTargetGroupId(targetGroupId)
                                .addTargets(toTarget(target))
                                .build()));
        waiter.await(op, resource);
    }

    @Override
    public void deregisterTarget(String targetGroupId, BackendTarget target) {
        String resource = "target " + target.ipAddress() + " in " + targetGroupId;
        OperationOuterClass.Operation op = GrpcErrors.call(resource, () ->
                session.getTargetGroupService().removeTargets(
                        TargetGroupServiceOuterClass.RemoveTargetsRequest.newBuilder()
                                .setTargetGroupId(targetGroupId)
                                .addTargets(toTarget(target))
                                .build()));
        waiter.await(op, resource);
    }

    private static TargetGroupOuterClass.Target toTarget(BackendTarget target) {
        var builder = TargetGroupOuterClass.Target.newBuilder()
                .setIpAddress(target.ipAddress());
        if (target.subnetId() != null) {
            builder.setSubnetId(target.subnetId());
        }
        return builder.build();
    }

    // ===== rules =====

    @Override
    public String createRule(String name, RouteMatch match, int priority, String targetGroupId) {
        String backendGroupId = findBackendGroup(name)
                .orElseThrow(() -> new PoolException("Backend group " + name + " not found"));
        if (match.mode() == RoutingMode.PATH) {
            String routeName = RouteTable.routeName(priority, name);
            routes.insert(pathRoute(routeName, match.primary(), backendGroupId));
            return RuleId.route(routes.hostName(), routeName).toString();
        }
        Optional<String> existing = findRule(match);
        if (existing.isPresent()) {
            log.info("Virtual host for {} already exists", match.primary());
            return existing.get();
        }
        return createVirtualHost(name, match, backendGroupId);
    }

    private String createVirtualHost(String name, RouteMatch match, String backendGroupId) {
        OperationOuterClass.Operation op = session.getVirtualHostService().create(
                VirtualHostServiceOuterClass.CreateVirtualHostRequest.newBuilder()
                        .setHttpRouterId(cfg.httpRouterId())
                        .setName(name)
                        .addAllAuthority(match.values())
                        .addRoutes(route(name, VirtualHostOuterClass.StringMatch.newBuilder()
                                .setPrefixMatch("/")
                                .build(), backendGroupId))
                        .build());
        waiter.await(op, "virtual host " + name);
        return RuleId.virtualHost(name).toString();
    }

    /**
     * Route matching the path itself and everything below it, but not longer
     * paths sharing its prefix ({@code /abf} must not catch {@code /abfdefgh}).
     */
    static VirtualHostOuterClass.Route pathRoute(String routeName, String path, String backendGroupId) {
        return route(routeName, VirtualHostOuterClass.StringMatch.newBuilder()
                .setRegexMatch(pathRegex(path))
                .build(), backendGroupId);
    }

    static String pathRegex(String path) {
        return "^" + path.replaceAll("[^A-Za-z0-9/_-]", "\\\\$0") + "(/.*)?$";
    }

    private static VirtualHostOuterClass.Route route(String name, VirtualHostOuterClass.StringMatch path,
                                                     String backendGroupId) {
        return VirtualHostOuterClass.Route.newBuilder()
                .setName(name)
                .setHttp(VirtualHostOuterClass.HttpRoute.newBuilder()
                        .setMatch(VirtualHostOuterClass.HttpRouteMatch.newBuilder()
                                .setPath(path)
                                .build())
                        .setRoute(VirtualHostOuterClass.HttpRouteAction.newBuilder()
                                .setBackendGroupId(backendGroupId)
                                .build())
                        .build())
                .build();
    }

    @Override
    public Optional<String> findRule(RouteMatch match) {
        if (match.mode() == RoutingMode.PATH) {
            String regex = pathRegex(match.primary());
            return routes.find(r -> r.hasHttp() && r.getHttp().hasMatch()
                            && regex.equals(r.getHttp().getMatch().getPath().getRegexMatch()))
                    .map(r -> RuleId.route(routes.hostName(), r.getName()).toString());
        }

        String pageToken = "";
        do {
            var resp = session.getVirtualHostService().list(
                    VirtualHostServiceOuterClass.ListVirtualHostsRequest.newBuilder()
                            .setHttpRouterId(cfg.httpRouterId())
                            .setPageSize(PAGE_SIZE)
                            .setPageToken(pageToken)
                            .build());
            for (VirtualHostOuterClass.VirtualHost host : resp.getVirtualHostsList()) {
                if (host.getAuthorityList().contains(match.primary())) {
                    return Optional.of(RuleId.virtualHost(host.getName()).toString());
                }
            }
            pageToken = resp.getNextPageToken();
        } while (!pageToken.isEmpty());
        return Optional.empty();
    }

    @Override
    public void deleteRule(String ruleId) {
        RuleId id = RuleId.parse(ruleId);
        if (id.isRoute()) {
            routes.remove(id.routeName());
            return;
        }
        OperationOuterClass.Operation op = GrpcErrors.call("rule " + ruleId, () ->
                session.getVirtualHostService().delete(
                        VirtualHostServiceOuterClass.DeleteVirtualHostRequest.newBuilder()
                                .setHttpRouterId(cfg.httpRouterId())
                                .setVirtualHostName(id.virtualHost())
                                .build()));
        waiter.await(op, "rule " + ruleId);
    }

    /** gRPC view of the shared virtual host. */
    private final class GrpcSharedHost implements SharedHost {

        @Override
        public String name() {
            return cfg.virtualHost();
        }

        @Override
        public List<VirtualHostOuterClass.Route> routes() {
            try {
                return session.getVirtualHostService().get(
                        VirtualHostServiceOuterClass.GetVirtualHostRequest.newBuilder()
                                .setHttpRouterId(cfg.httpRouterId())
                                .setVirtualHostName(cfg.virtualHost())
                                .build()).getRoutesList();
            } catch (StatusRuntimeException e) {
                if (GrpcErrors.isNotFound(e)) {
                    throw new PoolException("Shared virtual host " + cfg.virtualHost() + " not found on router "
                            + cfg.httpRouterId(), e);
                }
                throw e;
            }
        }

        @Override
        public void replaceRoutes(List<VirtualHostOuterClass.Route> routes) {
            OperationOuterClass.Operation op = session.getVirtualHostService().update(
                    VirtualHostServiceOuterClass.UpdateVirtualHostRequest.newBuilder()
                            .setHttpRouterId(cfg.httpRouterId())
                            .setVirtualHostName(cfg.virtualHost())
                            .setUpdateMask(FieldMask.newBuilder().addPaths("routes").build())
                            .addAllRoutes(routes)
                            .build());
            waiter.await(op, "virtual host " + cfg.virtualHost());
        }

        @Override
        public void removeRoute(String routeName) {
            String resource = "route " + routeName;
            OperationOuterClass.Operation op = GrpcErrors.call(resource, () ->
                    session.getVirtualHostService().removeRoute(
                            VirtualHostServiceOuterClass.RemoveRouteRequest.newBuilder()
                                    .setHttpRouterId(cfg.httpRouterId())
                                    .setVirtualHostName(cfg.virtualHost())
                                    .setRouteName(routeName)
                                    .build()));
            waiter.await(op, resource);
        }
    }

    private static com.google.protobuf.Duration protoDuration(Duration d) {
        return com.google.protobuf.Duration.newBuilder()
                .setSeconds(d.getSeconds())
                .setNanos(d.getNano())
                .build();
    }
}
