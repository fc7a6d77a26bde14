package warmpool.cloud.secrets;

import org.junit.jupiter.api.Test;
import yandex.cloud.api.lockbox.v1.PayloadOuterClass;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LockboxSecretStoreTest {

    @Test
    void logicalNamesMapToLockboxNames() {
        assertEquals("pool-instance-vm-1-token", LockboxSecretStore.lockboxName("pool/instance/vm-1/token"));
        assertEquals("pool-platform-credentials", LockboxSecretStore.lockboxName("Pool/Platform_Credentials"));
    }

    @Test
    void droppedKeysAreClearedInTheNextVersion() {
        Map<String, String> current = Map.of("ANTHROPIC_API_KEY", "sk-ant-1", "OPENAI_API_KEY", "sk-oa-1");

        Map<String, String> next = LockboxSecretStore.nextVersion(current, Map.of("OPENAI_API_KEY", "sk-oa-2"));

        assertEquals(Map.of("OPENAI_API_KEY", "sk-oa-2", "ANTHROPIC_API_KEY", ""), next);
    }

    @Test
    void clearedEntriesReadAsAbsent() {
        PayloadOuterClass.Payload payload = PayloadOuterClass.Payload.newBuilder()
                .addEntries(PayloadOuterClass.Payload.Entry.newBuilder()
                        .setKey("ANTHROPIC_API_KEY").setTextValue(""))
                .addEntries(PayloadOuterClass.Payload.Entry.newBuilder()
                        .setKey("OPENAI_API_KEY").setTextValue("sk-oa-2"))
                .build();

        Map<String, String> expected = new LinkedHashMap<>();
        expected.put("OPENAI_API_KEY", "sk-oa-2");
        assertEquals(expected, LockboxSecretStore.entries(payload));
    }
}
