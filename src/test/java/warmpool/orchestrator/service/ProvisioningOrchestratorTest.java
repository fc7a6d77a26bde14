package warmpool.orchestrator.service;

import org.junit.jupiter.api.*;
import warmpool.orchestrator.config.PoolConfig;
import warmpool.orchestrator.error.PartialProvisioningFailureException;
import warmpool.orchestrator.error.RouteCreateFailedException;
import warmpool.orchestrator.model.BackendTarget;
import warmpool.orchestrator.model.CleanupReport;
import warmpool.orchestrator.model.InstanceStatus;
import warmpool.orchestrator.model.ProvisionedTenant;
import warmpool.orchestrator.model.ReleasePolicy;
import warmpool.orchestrator.model.TeardownRequest;
import warmpool.orchestrator.model.TenantInstanceStatus;
import warmpool.orchestrator.support.TestPool;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static warmpool.orchestrator.model.CleanupReport.Outcome.*;
import static warmpool.orchestrator.service.ProvisioningOrchestrator.*;

/**
 * Tests for ProvisioningOrchestrator: create with rollback, and teardown.
 */
class ProvisioningOrchestratorTest {

    private TestPool pool;
    private ProvisioningOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        pool = TestPool.withDefaults();
        orchestrator = pool.deps.orchestrator();
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    @DisplayName("Create assigns, routes and registers the instance")
    void createTenantInstance() {
        String id = pool.addReadyInstance(InstanceStatus.AVAILABLE);
        pool.addReadyInstance(InstanceStatus.AVAILABLE);

        ProvisionedTenant tenant = orchestrator.createTenantInstance("tenant-a", "abcdef1234");

        assertEquals(id, tenant.instanceId());
        assertEquals("http://alb.example.net/abcdef12", tenant.url());
        assertEquals("token-" + id, tenant.secret().value());
        assertEquals(Set.of(new BackendTarget(tenant.privateIp(), "subnet-a", 8080)),
                pool.loadBalancer.targets(tenant.route().targetGroupId()));
        assertEquals(TenantInstanceStatus.RUNNING, orchestrator.describeTenantInstance(id));
    }

    @Test
    @DisplayName("Route failure puts the instance back in the pool")
    void routeFailureRollsBack() {
        String id = pool.addReadyInstance(InstanceStatus.AVAILABLE);
        pool.addReadyInstance(InstanceStatus.AVAILABLE);
        pool.loadBalancer.failNextRule(new IllegalStateException("quota exceeded"));

        PartialProvisioningFailureException e = assertThrows(PartialProvisioningFailureException.class,
                () -> orchestrator.createTenantInstance("tenant-a"));

        assertInstanceOf(RouteCreateFailedException.class, e.getCause());
        assertEquals(SKIPPED, e.cleanup().outcome(STEP_DELETE_ROUTE));
        assertEquals(DONE, e.cleanup().outcome(STEP_RELEASE_INSTANCE));
        assertTrue(pool.deps.inventory().findById(id).orElseThrow().isAvailable());
        assertEquals(0, pool.loadBalancer.targetGroupCount());
    }

    @Test
    @DisplayName("Registration failure removes the route before releasing")
    void registerFailureRemovesRoute() {
        pool.addReadyInstance(InstanceStatus.AVAILABLE);
        pool.addReadyInstance(InstanceStatus.AVAILABLE);
        pool.loadBalancer.failNextRegister(new IllegalStateException("subnet not attached"));

        PartialProvisioningFailureException e = assertThrows(PartialProvisioningFailureException.class,
                () -> orchestrator.createTenantInstance("tenant-a"));

        assertEquals(DONE, e.cleanup().outcome(STEP_DELETE_ROUTE));
        assertTrue(e.cleanup().isClean());
        assertEquals(0, pool.loadBalancer.targetGroupCount());
        assertEquals(0, pool.loadBalancer.ruleCount());
    }

    @Test
    void rollbackCanTerminate() {
        TestPool terminating = new TestPool(PoolConfig.defaults().withRollbackPolicy(ReleasePolicy.TERMINATE));
        try {
            String id = terminating.addReadyInstance(InstanceStatus.AVAILABLE);
            terminating.loadBalancer.failNextRule(new IllegalStateException("quota exceeded"));

            assertThrows(PartialProvisioningFailureException.class,
                    () -> terminating.deps.orchestrator().createTenantInstance("tenant-a"));

            assertTrue(terminating.compute.terminated().contains(id));
        } finally {
            terminating.close();
        }
    }

    @Test
    @DisplayName("Teardown removes every resource and can be repeated")
    void teardownIsComplete() {
        pool.addReadyInstance(InstanceStatus.AVAILABLE);
        ProvisionedTenant tenant = orchestrator.createTenantInstance("tenant-a", "abcdef1234");
        pool.secrets.write(pool.deps.naming().tenantKeysSecretName(tenant.instanceId()),
                Map.of("OPENAI_API_KEY", "tenant-openai"));

        CleanupReport report = orchestrator.deleteTenantInstance(TeardownRequest.of(tenant));

        assertTrue(report.isClean());
        for (String step : new String[]{STEP_DEREGISTER_TARGET, STEP_DELETE_RULE, STEP_DELETE_TARGET_GROUP,
                STEP_TERMINATE_INSTANCE, STEP_DELETE_BOOTSTRAP_SECRET, STEP_DELETE_TENANT_KEYS}) {
            assertEquals(DONE, report.outcome(step), step);
        }
        assertEquals(0, pool.loadBalancer.targetGroupCount());
        assertEquals(0, pool.loadBalancer.ruleCount());
        assertTrue(pool.compute.terminated().contains(tenant.instanceId()));
        assertFalse(pool.secrets.exists(tenant.secret().name()));
        assertEquals(TenantInstanceStatus.STOPPED, orchestrator.describeTenantInstance(tenant.instanceId()));

        CleanupReport again = orchestrator.deleteTenantInstance(TeardownRequest.of(tenant));
        assertTrue(again.isClean());
        assertEquals(SKIPPED, again.outcome(STEP_DEREGISTER_TARGET));
    }

    @Test
    @DisplayName("Teardown by tenant key finds the route by name")
    void teardownByKeyOnly() {
        pool.addReadyInstance(InstanceStatus.AVAILABLE);
        orchestrator.createTenantInstance("tenant-a", "abcdef1234");

        CleanupReport report = orchestrator.deleteTenantInstance(new TeardownRequest("abcdef1234", null, null, null));

        assertEquals(DONE, report.outcome(STEP_DELETE_RULE));
        assertEquals(DONE, report.outcome(STEP_DELETE_TARGET_GROUP));
        assertEquals(SKIPPED, report.outcome(STEP_TERMINATE_INSTANCE));
        assertEquals(0, pool.loadBalancer.targetGroupCount());
    }

    @Test
    @DisplayName("A failed step does not stop the remaining steps")
    void teardownContinuesPastFailure() {
        pool.addReadyInstance(InstanceStatus.AVAILABLE);
        ProvisionedTenant tenant = orchestrator.createTenantInstance("tenant-a", "abcdef1234");
        // wrong rule id: the real rule stays and keeps the target group in use
        TeardownRequest request = new TeardownRequest("abcdef1234", tenant.instanceId(),
                tenant.route().targetGroupId(), "rule-999");

        CleanupReport report = orchestrator.deleteTenantInstance(request);

        assertFalse(report.isClean());
        assertEquals(FAILED, report.outcome(STEP_DELETE_TARGET_GROUP));
        assertEquals(DONE, report.outcome(STEP_TERMINATE_INSTANCE));
        assertEquals(DONE, report.outcome(STEP_DELETE_BOOTSTRAP_SECRET));
        assertInstanceOf(IllegalStateException.class, report.failures().get(STEP_DELETE_TARGET_GROUP));
    }

    @Test
    void poolStatsAndMaintenance() {
        assertEquals(2, orchestrator.maintainPool(2).launchedCount());
        assertEquals(2, orchestrator.poolStats().initializing());
    }
}
