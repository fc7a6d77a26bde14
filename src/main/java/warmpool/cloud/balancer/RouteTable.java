package warmpool.cloud.balancer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.orchestrator.error.PoolException;
import warmpool.orchestrator.util.Backoff;
import warmpool.orchestrator.util.BoundedPoller;
import warmpool.orchestrator.util.PollOutcome;
import yandex.cloud.api.apploadbalancer.v1.VirtualHostOuterClass;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Priority-ordered tenant routes in the shared virtual host. The priority is
 * encoded in the route name ({@code p00042-tenant-abc}); routes without that
 * prefix sort last.
 *
 * <p>Inserting rewrites the host's route list, so writes from this process are
 * serialized. A writer in another process can still replace the list between
 * our read and write: every insert re-reads the host and writes again until
 * its route is present or the timeout passes.</p>
 */
class RouteTable {

    private static final Logger log = LoggerFactory.getLogger(RouteTable.class);

    private static final Pattern ROUTE_NAME = Pattern.compile("^p(\\d{5})-.+$");
    private static final Backoff BACKOFF = Backoff.exponential(Duration.ofMillis(500), Duration.ofSeconds(5), 0.2);

    private final SharedHost host;
    private final BoundedPoller poller;
    private final Duration timeout;

    RouteTable(SharedHost host, BoundedPoller poller, Duration timeout) {
        this.host = host;
        this.poller = poller;
        this.timeout = timeout;
    }

    String hostName() {
        return host.name();
    }

    /**
     * Add the route unless one of the same name exists.
     *
     * @throws PoolException if the route does not stay in the host within the timeout
     */
    synchronized void insert(VirtualHostOuterClass.Route route) {
        String name = route.getName();
        PollOutcome<String> outcome = poller.poll("route " + name, timeout, BACKOFF, () -> {
            List<VirtualHostOuterClass.Route> current = host.routes();
            if (contains(current, name)) {
                return Optional.of(name);
            }
            host.replaceRoutes(withRoute(current, route));
            if (contains(host.routes(), name)) {
                return Optional.of(name);
            }
            log.warn("Route {} missing from {} after write, another writer replaced the list", name, host.name());
            return Optional.empty();
        });
        outcome.orElseThrow(o -> new PoolException("Route " + name + " not kept by virtual host " + host.name()
                + " after " + o.attempts() + " attempts", o.lastError().orElse(null)));
        if (outcome.attempts() > 1) {
            log.info("Route {} in place after {} attempts", name, outcome.attempts());
        }
    }

    synchronized void remove(String routeName) {
        host.removeRoute(routeName);
    }

    Optional<VirtualHostOuterClass.Route> find(Predicate<VirtualHostOuterClass.Route> filter) {
        return host.routes().stream().filter(filter).findFirst();
    }

    static List<VirtualHostOuterClass.Route> withRoute(List<VirtualHostOuterClass.Route> routes,
                                                       VirtualHostOuterClass.Route route) {
        List<String> names = routes.stream().map(VirtualHostOuterClass.Route::getName).toList();
        List<VirtualHostOuterClass.Route> result = new ArrayList<>(routes);
        result.add(insertionIndex(names, priorityOf(route.getName())), route);
        return result;
    }

    private static boolean contains(List<VirtualHostOuterClass.Route> routes, String name) {
        return routes.stream().anyMatch(r -> name.equals(r.getName()));
    }

    static String routeName(int priority, String name) {
        return String.format("p%05d-%s", priority, name);
    }

    /** Priority encoded in a route name; foreign routes sort last. */
    static int priorityOf(String routeName) {
        Matcher m = ROUTE_NAME.matcher(routeName);
        return m.matches() ? Integer.parseInt(m.group(1)) : Integer.MAX_VALUE;
    }

    /** Position before the first route with a higher priority number. */
    static int insertionIndex(List<String> routeNames, int priority) {
        for (int i = 0; i < routeNames.size(); i++) {
            if (priorityOf(routeNames.get(i)) > priority) {
                return i;
            }
        }
        return routeNames.size();
    }
}
