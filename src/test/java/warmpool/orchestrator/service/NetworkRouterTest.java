package warmpool.orchestrator.service;

import org.junit.jupiter.api.*;
import warmpool.orchestrator.error.RouteCreateFailedException;
import warmpool.orchestrator.model.BackendTarget;
import warmpool.orchestrator.model.RouteMatch;
import warmpool.orchestrator.model.TenantRoute;
import warmpool.orchestrator.support.TestPool;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NetworkRouter: route lifecycle on the shared load balancer.
 */
class NetworkRouterTest {

    private TestPool pool;
    private NetworkRouter router;

    @BeforeEach
    void setUp() {
        pool = TestPool.withDefaults();
        router = pool.deps.router();
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    void createRouteBuildsGroupAndRule() {
        TenantRoute route = router.createRoute("abcdef1234");

        assertEquals("tenant-abcdef12", route.serviceName());
        assertTrue(route.hasRule());
        assertEquals(RouteMatch.path("abcdef12"), route.match());
        assertEquals(pool.deps.naming().priority("tenant-abcdef12"), route.priority());
        assertEquals(route.priority(), pool.loadBalancer.priorityOf(route.ruleId()));
        assertEquals(1, pool.loadBalancer.targetGroupCount());
        assertEquals(1, pool.loadBalancer.ruleCount());
    }

    @Test
    @DisplayName("Creating the same route twice reuses the group and rule")
    void createRouteIsRetrySafe() {
        TenantRoute first = router.createRoute("abcdef1234");
        TenantRoute second = router.createRoute("abcdef1234");

        assertEquals(first.targetGroupId(), second.targetGroupId());
        assertEquals(first.ruleId(), second.ruleId());
        assertEquals(1, pool.loadBalancer.targetGroupCount());
        assertEquals(1, pool.loadBalancer.ruleCount());
    }

    @Test
    @DisplayName("A target group left by a failed cleanup is picked up again")
    void createRouteAdoptsLeftoverTargetGroup() {
        String leftover = pool.loadBalancer.createTargetGroup("tenant-abcdef12", pool.config.healthCheck());

        TenantRoute route = router.createRoute("abcdef1234");

        assertEquals(leftover, route.targetGroupId());
        assertTrue(route.hasRule());
        assertEquals(1, pool.loadBalancer.targetGroupCount());
    }

    @Test
    @DisplayName("Rule failure removes the target group it just created")
    void ruleFailureCleansUp() {
        pool.loadBalancer.failNextRule(new IllegalStateException("priority taken"));

        RouteCreateFailedException e = assertThrows(RouteCreateFailedException.class,
                () -> router.createRoute("abcdef1234"));

        assertEquals("abcdef1234", e.tenantKey());
        assertTrue(e.getMessage().contains("priority taken"));
        assertEquals(0, pool.loadBalancer.targetGroupCount());
        assertEquals(0, pool.loadBalancer.ruleCount());
    }

    @Test
    @DisplayName("Create then delete leaves nothing behind, and delete can repeat")
    void deleteIsIdempotent() {
        TenantRoute route = router.createRoute("abcdef1234");
        router.registerTarget(route, router.targetFor("10.0.0.5", "subnet-a"));

        router.deleteRoute(route);
        assertDoesNotThrow(() -> router.deleteRoute(route));
        assertDoesNotThrow(() -> router.deleteRoute("abcdef1234"));

        assertEquals(0, pool.loadBalancer.targetGroupCount());
        assertEquals(0, pool.loadBalancer.ruleCount());
    }

    @Test
    @DisplayName("Routes can be removed by tenant key alone")
    void deleteByTenantKey() {
        router.createRoute("abcdef1234");
        router.createRoute("zzzz9999");

        router.deleteRoute("abcdef1234");

        assertEquals(1, pool.loadBalancer.targetGroupCount());
        assertEquals(1, pool.loadBalancer.ruleCount());
        assertTrue(router.lookupTargetGroup("abcdef1234").isEmpty());
        assertTrue(router.lookupRule("zzzz9999").isPresent());
    }

    @Test
    void registerAndDeregisterTarget() {
        TenantRoute route = router.createRoute("abcdef1234");
        BackendTarget target = router.targetFor("10.0.0.5", "subnet-a");

        router.registerTarget(route, target);
        assertEquals(Set.of(new BackendTarget("10.0.0.5", "subnet-a", 8080)),
                pool.loadBalancer.targets(route.targetGroupId()));

        router.deregisterTarget(route.targetGroupId(), target);
        assertDoesNotThrow(() -> router.deregisterTarget(route.targetGroupId(), target));
        assertTrue(pool.loadBalancer.targets(route.targetGroupId()).isEmpty());
    }

    @Test
    void sameKeyYieldsSameNames() {
        TenantRoute first = router.createRoute("abcdef1234");
        router.deleteRoute(first);
        TenantRoute second = router.createRoute("abcdef1234");

        assertEquals(List.of(first.serviceName(), first.match(), first.priority()),
                List.of(second.serviceName(), second.match(), second.priority()));
    }
}
