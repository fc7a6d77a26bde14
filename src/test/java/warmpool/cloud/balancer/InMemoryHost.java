package warmpool.cloud.balancer;

import warmpool.orchestrator.provider.ResourceNotFoundException;
import yandex.cloud.api.apploadbalancer.v1.VirtualHostOuterClass;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Shared virtual host kept in memory. Can replay another writer's stale list
 * right after a write, or drop writes entirely.
 */
class InMemoryHost implements SharedHost {

    private List<VirtualHostOuterClass.Route> routes = new ArrayList<>();
    private int writes;
    private boolean dropWrites;
    private Consumer<InMemoryHost> afterNextWrite;

    synchronized void overwrite(List<VirtualHostOuterClass.Route> routes) {
        this.routes = new ArrayList<>(routes);
    }

    synchronized void afterNextWrite(Consumer<InMemoryHost> hook) {
        this.afterNextWrite = hook;
    }

    synchronized void dropWrites() {
        this.dropWrites = true;
    }

    synchronized int writes() {
        return writes;
    }

    synchronized List<String> routeNames() {
        return routes.stream().map(VirtualHostOuterClass.Route::getName).toList();
    }

    @Override
    public String name() {
        return "tenants";
    }

    @Override
    public synchronized List<VirtualHostOuterClass.Route> routes() {
        return List.copyOf(routes);
    }

    @Override
    public synchronized void replaceRoutes(List<VirtualHostOuterClass.Route> routes) {
        writes++;
        if (!dropWrites) {
            this.routes = new ArrayList<>(routes);
        }
        if (afterNextWrite != null) {
            Consumer<InMemoryHost> hook = afterNextWrite;
            afterNextWrite = null;
            hook.accept(this);
        }
    }

    @Override
    public synchronized void removeRoute(String routeName) {
        if (!routes.removeIf(r -> routeName.equals(r.getName()))) {
            throw new ResourceNotFoundException("route " + routeName);
        }
    }
}
