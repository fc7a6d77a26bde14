package warmpool.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Test
    void statusLabelsDefaultToInitializing() {
        assertEquals(InstanceStatus.AVAILABLE, InstanceStatus.fromLabel("Available "));
        assertEquals(InstanceStatus.ASSIGNED, InstanceStatus.fromLabel("assigned"));
        assertEquals(InstanceStatus.INITIALIZING, InstanceStatus.fromLabel(null));
        assertEquals(InstanceStatus.INITIALIZING, InstanceStatus.fromLabel("booting"));
    }

    @Test
    void subnetPlacementParsing() {
        SubnetPlacement p = SubnetPlacement.parse(" ru-central1-a:e9bsubnet ");

        assertEquals("ru-central1-a", p.zoneId());
        assertEquals("e9bsubnet", p.subnetId());
        assertEquals("ru-central1-a:e9bsubnet", p.toString());
        assertThrows(IllegalArgumentException.class, () -> SubnetPlacement.parse("no-separator"));
        assertThrows(IllegalArgumentException.class, () -> SubnetPlacement.parse("zone:"));
    }

    @Test
    void apiProviderLookup() {
        assertEquals(ApiProvider.ANTHROPIC, ApiProvider.fromId("anthropic"));
        assertEquals("OPENAI_API_KEY", ApiProvider.OPENAI.envName());
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ApiProvider.fromId("mistral"));
        assertEquals("Invalid provider. Must be one of: anthropic, openai, google", e.getMessage());
    }

    @Test
    void poolStatsCountsSpare() {
        List<PoolInstance> instances = List.of(
                PoolInstance.builder().id("a").status(InstanceStatus.AVAILABLE).build(),
                PoolInstance.builder().id("b").build(),
                PoolInstance.builder().id("c").status(InstanceStatus.ASSIGNED).tenantId("t").build());

        PoolStats stats = PoolStats.of(instances);

        assertEquals(new PoolStats(3, 1, 1, 1), stats);
        assertEquals(2, stats.spare());
    }

    @Test
    void tenantStatusFromInstance() {
        assertEquals(TenantInstanceStatus.STOPPED, TenantInstanceStatus.of(null));
        assertEquals(TenantInstanceStatus.RUNNING, TenantInstanceStatus.of(
                PoolInstance.builder().id("a").status(InstanceStatus.ASSIGNED).build()));
        assertEquals(TenantInstanceStatus.PROVISIONING, TenantInstanceStatus.of(
                PoolInstance.builder().id("a").build()));
    }

    @Test
    void secretsAreMaskedInToString() {
        BootstrapSecret secret = new BootstrapSecret("pool/instance/vm-1/token", "s3cret");
        RemoteCommandRequest request = new RemoteCommandRequest(List.of("echo"), Map.of("API_KEY", "s3cret"), 5);

        assertFalse(secret.toString().contains("s3cret"));
        assertFalse(request.toString().contains("s3cret"));
        assertTrue(request.toString().contains("API_KEY"));
    }

    @Test
    void cleanupReportTracksOutcomes() {
        IllegalStateException error = new IllegalStateException("x");
        CleanupReport report = new CleanupReport().done("a").skipped("b").failed("c", error);

        assertEquals(List.of("a", "b", "c"), List.copyOf(report.steps().keySet()));
        assertEquals(CleanupReport.Outcome.SKIPPED, report.outcome("b"));
        assertSame(error, report.failures().get("c"));
        assertFalse(report.isClean());
    }
}
