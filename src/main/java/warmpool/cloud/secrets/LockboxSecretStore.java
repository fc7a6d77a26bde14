package warmpool.cloud.secrets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.cloud.auth.CloudSession;
import warmpool.cloud.support.GrpcErrors;
import warmpool.cloud.support.OperationWaiter;
import warmpool.orchestrator.provider.ResourceNotFoundException;
import warmpool.orchestrator.provider.SecretStore;
import yandex.cloud.api.lockbox.v1.PayloadOuterClass;
import yandex.cloud.api.lockbox.v1.PayloadServiceOuterClass;
import yandex.cloud.api.lockbox.v1.SecretOuterClass;
import yandex.cloud.api.lockbox.v1.SecretServiceOuterClass;
import yandex.cloud.api.operation.OperationOuterClass;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lockbox-backed secrets. Logical names such as {@code pool/instance/<id>/token}
 * map to Lockbox names by replacing every character outside {@code [a-z0-9-]}
 * with a hyphen.
 */
public class LockboxSecretStore implements SecretStore {

    private static final Logger log = LoggerFactory.getLogger(LockboxSecretStore.class);

    private static final int PAGE_SIZE = 1000;

    private final CloudSession session;
    private final OperationWaiter waiter;
    private final String folderId;

    public LockboxSecretStore(CloudSession session, OperationWaiter waiter, String folderId) {
        this.session = session;
        this.waiter = waiter;
        this.folderId = folderId;
    }

    static String lockboxName(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "-");
    }

    @Override
    public Optional<Map<String, String>> read(String name) {
        Optional<String> secretId = findSecretId(name);
        if (secretId.isEmpty()) {
            return Optional.empty();
        }
        PayloadOuterClass.Payload payload;
        try {
            payload = GrpcErrors.call("secret " + name, () -> session.getPayloadService().get(
                    PayloadServiceOuterClass.GetPayloadRequest.newBuilder()
                            .setSecretId(secretId.get())
                            .build()));
        } catch (ResourceNotFoundException e) {
            // secret exists but has no active version yet
            return Optional.empty();
        }
        return Optional.of(entries(payload));
    }

    /** Payload entries; an empty value marks a removed key. */
    static Map<String, String> entries(PayloadOuterClass.Payload payload) {
        Map<String, String> entries = new LinkedHashMap<>();
        for (PayloadOuterClass.Payload.Entry entry : payload.getEntriesList()) {
            if (!entry.getTextValue().isEmpty()) {
                entries.put(entry.getKey(), entry.getTextValue());
            }
        }
        return entries;
    }

    /**
     * Adds a version to an existing secret, or creates it. A new version keeps
     * entries it does not mention, so dropped keys are written with an empty
     * value and the secret itself is never deleted.
     */
    @Override
    public void write(String name, Map<String, String> entries) {
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("secret " + name + " needs at least one entry");
        }
        Optional<String> secretId = findSecretId(name);
        if (secretId.isPresent()) {
            Map<String, String> current = read(name).orElse(Map.of());
            OperationOuterClass.Operation op = session.getSecretService().addVersion(
                    SecretServiceOuterClass.AddVersionRequest.newBuilder()
                            .setSecretId(secretId.get())
                            .addAllPayloadEntries(changes(nextVersion(current, entries)))
                            .build());
            waiter.await(op, "secret " + name);
            log.debug("Added version to secret {}", name);
            return;
        }

        OperationOuterClass.Operation op = session.getSecretService().create(
                SecretServiceOuterClass.CreateSecretRequest.newBuilder()
                        .setFolderId(folderId)
                        .setName(lockboxName(name))
                        .addAllVersionPayloadEntries(changes(entries))
                        .build());
        waiter.await(op, "secret " + name);
        log.debug("Created secret {}", name);
    }

    @Override
    public void delete(String name) {
        String secretId = findSecretId(name).orElseThrow(() -> new ResourceNotFoundException("secret " + name));
        deleteById(name, secretId);
    }

    private void deleteById(String name, String secretId) {
        OperationOuterClass.Operation op = GrpcErrors.call("secret " + name, () ->
                session.getSecretService().delete(SecretServiceOuterClass.DeleteSecretRequest.newBuilder()
                        .setSecretId(secretId)
                        .build()));
        waiter.await(op, "secret " + name);
    }

    private Optional<String> findSecretId(String name) {
        String wanted = lockboxName(name);
        String pageToken = "";
        do {
            var resp = session.getSecretService().list(SecretServiceOuterClass.ListSecretsRequest.newBuilder()
                    .setFolderId(folderId)
                    .setPageSize(PAGE_SIZE)
                    .setPageToken(pageToken)
                    .build());
            for (SecretOuterClass.Secret secret : resp.getSecretsList()) {
                if (wanted.equals(secret.getName())) {
                    return Optional.of(secret.getId());
                }
            }
            pageToken = resp.getNextPageToken();
        } while (!pageToken.isEmpty());
        return Optional.empty();
    }

    /** Entries for the next version: the new values plus an empty value for every dropped key. */
    static Map<String, String> nextVersion(Map<String, String> current, Map<String, String> entries) {
        Map<String, String> next = new LinkedHashMap<>(entries);
        for (String key : current.keySet()) {
            next.putIfAbsent(key, "");
        }
        return next;
    }

    private static List<SecretServiceOuterClass.PayloadEntryChange> changes(Map<String, String> entries) {
        return entries.entrySet().stream()
                .map(e -> SecretServiceOuterClass.PayloadEntryChange.newBuilder()
                        .setKey(e.getKey())
                        .setTextValue(e.getValue())
                        .build())
                .toList();
    }
}
