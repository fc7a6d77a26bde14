package warmpool.orchestrator.support;

import warmpool.orchestrator.provider.ResourceNotFoundException;
import warmpool.orchestrator.provider.SecretStore;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class FakeSecretStore implements SecretStore {

    private final Map<String, Map<String, String>> secrets = new HashMap<>();
    private final Map<String, RuntimeException> readFailures = new HashMap<>();

    public synchronized void failReads(String name, RuntimeException error) {
        readFailures.put(name, error);
    }

    public synchronized boolean exists(String name) {
        return secrets.containsKey(name);
    }

    @Override
    public synchronized Optional<Map<String, String>> read(String name) {
        RuntimeException failure = readFailures.get(name);
        if (failure != null) {
            throw failure;
        }
        return Optional.ofNullable(secrets.get(name)).map(Map::copyOf);
    }

    @Override
    public synchronized void write(String name, Map<String, String> entries) {
        secrets.put(name, Map.copyOf(entries));
    }

    @Override
    public synchronized void delete(String name) {
        if (secrets.remove(name) == null) {
            throw new ResourceNotFoundException("secret " + name);
        }
    }
}
