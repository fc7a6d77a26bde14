package warmpool.orchestrator.provider;

import java.util.Map;
import java.util.Optional;

/**
 * Secret storage addressed by deterministic names. A secret is a small map of
 * entries; single-value secrets use one well-known entry key.
 */
public interface SecretStore {

    /**
     * Read the current version of a secret.
     *
     * @return entries, or empty if no secret with that name exists
     */
    Optional<Map<String, String>> read(String name);

    /**
     * Create the secret or add a new version replacing all entries.
     */
    void write(String name, Map<String, String> entries);

    /**
     * @throws ResourceNotFoundException if no secret with that name exists
     */
    void delete(String name);
}
