package warmpool.orchestrator.model;

import java.util.List;

/**
 * Match pattern of a tenant routing rule.
 *
 * @param mode   path or host matching
 * @param values path patterns ({@code /abc}, {@code /abc/*}) or host names
 */
public record RouteMatch(RoutingMode mode, List<String> values) {

    public RouteMatch {
        values = List.copyOf(values);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("route match needs at least one value");
        }
    }

    public static RouteMatch path(String subdomain) {
        return new RouteMatch(RoutingMode.PATH, List.of("/" + subdomain, "/" + subdomain + "/*"));
    }

    public static RouteMatch host(String subdomain, String domain) {
        return new RouteMatch(RoutingMode.HOST, List.of(subdomain + "." + domain));
    }

    /** Path prefix for PATH mode, host name for HOST mode */
    public String primary() {
        return values.get(0);
    }
}
