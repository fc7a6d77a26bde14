package warmpool.orchestrator.service;

import org.junit.jupiter.api.*;
import warmpool.orchestrator.error.PoolException;
import warmpool.orchestrator.model.ApiProvider;
import warmpool.orchestrator.model.InstanceStatus;
import warmpool.orchestrator.model.KeyUpdateResult;
import warmpool.orchestrator.model.RemoteCommandStatus;
import warmpool.orchestrator.support.FakeRemoteCommands;
import warmpool.orchestrator.support.TestPool;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CredentialRotator: tenant key storage and workload restart.
 */
class CredentialRotatorTest {

    private TestPool pool;
    private CredentialRotator rotator;
    private String instanceId;
    private String keysSecret;

    @BeforeEach
    void setUp() {
        pool = TestPool.withDefaults();
        rotator = pool.deps.credentials();
        instanceId = pool.addReadyInstance(InstanceStatus.ASSIGNED);
        keysSecret = pool.deps.naming().tenantKeysSecretName(instanceId);
        pool.secrets.write(pool.config.platformSecretName(), Map.of(
                "ANTHROPIC_API_KEY", "platform-anthropic",
                "OPENAI_API_KEY", "platform-openai",
                "UNRELATED", "x"));
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    @DisplayName("Tenant key wins over the platform key in the restarted workload")
    void tenantKeyAppliedOnRestart() {
        KeyUpdateResult result = rotator.setTenantKey(instanceId, ApiProvider.ANTHROPIC, "  tenant-anthropic-key ");

        assertTrue(result.restarted());
        assertEquals("cmd-1", result.commandId());
        assertEquals(Map.of("ANTHROPIC_API_KEY", "tenant-anthropic-key"), pool.secrets.read(keysSecret).orElseThrow());

        FakeRemoteCommands.Submission restart = pool.commands.lastSubmission();
        assertEquals(instanceId, restart.instanceId());
        assertEquals(Map.of(
                "ANTHROPIC_API_KEY", "tenant-anthropic-key",
                "OPENAI_API_KEY", "platform-openai"), restart.request().environment());
        List<String> argv = restart.request().argv();
        assertEquals(List.of("workload", "restart"), argv.subList(0, 2));
        assertEquals("GATEWAY_TOKEN", argv.get(argv.indexOf("--preserve-env") + 1));
        assertEquals("registry.example.net/workload:1", argv.get(argv.indexOf("--image") + 1));
    }

    @Test
    void shortKeyRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> rotator.setTenantKey(instanceId, ApiProvider.OPENAI, " short "));

        assertEquals("API key is required", e.getMessage());
        assertFalse(pool.secrets.exists(keysSecret));
        assertTrue(pool.commands.submissions().isEmpty());
    }

    @Test
    @DisplayName("Failed restart still keeps the saved key")
    void restartFailureSavesKey() {
        pool.commands.finishWith(RemoteCommandStatus.FAILED, "", "docker: pull failed");

        KeyUpdateResult result = rotator.setTenantKey(instanceId, ApiProvider.GOOGLE, "gemini-key-0123456789");

        assertFalse(result.restarted());
        assertNull(result.commandId());
        assertTrue(result.message().startsWith("API key saved but container restart failed"));
        assertEquals("gemini-key-0123456789", pool.secrets.read(keysSecret).orElseThrow().get("GEMINI_API_KEY"));
    }

    @Test
    @DisplayName("Workload that never turns healthy fails within the health bound")
    void unhealthyAfterRestart() {
        pool.healthy.set(false);

        KeyUpdateResult result = rotator.setTenantKey(instanceId, ApiProvider.ANTHROPIC, "tenant-anthropic-key");

        assertFalse(result.restarted());
        assertTrue(result.message().contains("did not become healthy within 30s"));
        // one command poll, then the health wait
        assertEquals(Duration.ofSeconds(30), pool.time.totalSlept());
    }

    @Test
    @DisplayName("Removing the last tenant key deletes the secret and restores the platform key")
    void removeLastKey() {
        rotator.setTenantKey(instanceId, ApiProvider.ANTHROPIC, "tenant-anthropic-key");

        KeyUpdateResult result = rotator.removeTenantKey(instanceId, ApiProvider.ANTHROPIC);

        assertTrue(result.restarted());
        assertFalse(pool.secrets.exists(keysSecret));
        assertEquals("platform-anthropic", pool.commands.lastSubmission().request().environment().get("ANTHROPIC_API_KEY"));
    }

    @Test
    void removeKeepsOtherKeys() {
        pool.secrets.write(keysSecret, Map.of("ANTHROPIC_API_KEY", "a-tenant-key", "OPENAI_API_KEY", "o-tenant-key"));

        rotator.removeTenantKey(instanceId, ApiProvider.OPENAI);

        assertEquals(Map.of("ANTHROPIC_API_KEY", "a-tenant-key"), pool.secrets.read(keysSecret).orElseThrow());
    }

    @Test
    void removeWithoutStoredKeys() {
        KeyUpdateResult result = rotator.removeTenantKey(instanceId, ApiProvider.OPENAI);

        assertTrue(result.restarted());
        assertFalse(pool.secrets.exists(keysSecret));
    }

    @Test
    void restartOfUnknownInstance() {
        assertThrows(PoolException.class, () -> rotator.restartWithMergedKeys("vm-404"));
    }
}
