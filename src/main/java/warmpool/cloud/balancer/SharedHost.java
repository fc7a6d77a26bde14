package warmpool.cloud.balancer;

import yandex.cloud.api.apploadbalancer.v1.VirtualHostOuterClass;

import java.util.List;

/**
 * The virtual host that carries every path-mode tenant route.
 */
interface SharedHost {

    String name();

    List<VirtualHostOuterClass.Route> routes();

    /** Replace the whole route list; the router has no single-route insert. */
    void replaceRoutes(List<VirtualHostOuterClass.Route> routes);

    /**
     * @throws warmpool.orchestrator.provider.ResourceNotFoundException if no such route
     */
    void removeRoute(String routeName);
}
