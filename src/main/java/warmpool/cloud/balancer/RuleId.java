package warmpool.cloud.balancer;

/**
 * Provider id of a tenant rule. A path rule is a named route inside the
 * shared virtual host ({@code route:<host>/<route>}); a host rule is a
 * whole virtual host ({@code vhost:<host>}).
 */
record RuleId(String virtualHost, String routeName) {

    private static final String ROUTE = "route:";
    private static final String VHOST = "vhost:";

    static RuleId route(String virtualHost, String routeName) {
        return new RuleId(virtualHost, routeName);
    }

    static RuleId virtualHost(String virtualHost) {
        return new RuleId(virtualHost, null);
    }

    static RuleId parse(String id) {
        if (id.startsWith(ROUTE)) {
            String rest = id.substring(ROUTE.length());
            int slash = rest.indexOf('/');
            if (slash > 0 && slash < rest.length() - 1) {
                return route(rest.substring(0, slash), rest.substring(slash + 1));
            }
        } else if (id.startsWith(VHOST) && id.length() > VHOST.length()) {
            return virtualHost(id.substring(VHOST.length()));
        }
        throw new IllegalArgumentException("Not a rule id: " + id);
    }

    boolean isRoute() {
        return routeName != null;
    }

    @Override
    public String toString() {
        return isRoute() ? ROUTE + virtualHost + "/" + routeName : VHOST + virtualHost;
    }
}
