package warmpool.cloud.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.orchestrator.model.SubnetPlacement;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Loads cloud settings from an INI file.
 * Sections [AUTH], [NETWORK], [VM], [SSH], [ALB] are required, [AGENT] is optional.
 *
 * <pre>
 * [NETWORK]
 * subnets = ru-central1-a:e9b..., ru-central1-b:e2l...
 * </pre>
 */
public class IniLoader {

    private static final Logger log = LoggerFactory.getLogger(IniLoader.class);

    /**
     * @return config, or empty if the file is unreadable or a required value is missing
     */
    public static Optional<CloudConfig> load(File file) {
        try {
            Ini ini = new Ini(file);

            Profile.Section auth  = ini.get("AUTH");
            Profile.Section net   = ini.get("NETWORK");
            Profile.Section vm    = ini.get("VM");
            Profile.Section ssh   = ini.get("SSH");
            Profile.Section alb   = ini.get("ALB");
            Profile.Section agent = ini.get("AGENT"); // optional

            if (auth == null || net == null || vm == null || ssh == null || alb == null) {
                log.warn("{}: missing one of [AUTH], [NETWORK], [VM], [SSH], [ALB]", file);
                return Optional.empty();
            }

            String keyPath = opt(ssh, "public_key_path");
            String keyText = opt(ssh, "public_key");
            if ((keyText == null || keyText.isBlank()) && keyPath != null && !keyPath.isBlank()) {
                keyText = Files.readString(new File(keyPath).toPath()).trim();
            }
            if (keyText == null || keyText.isBlank()) {
                log.warn("{}: [SSH] needs public_key or public_key_path", file);
                return Optional.empty();
            }

            CloudConfig cfg = new CloudConfig();

            // AUTH
            cfg.oauthToken = opt(auth, "oauth_token");
            cfg.folderId   = required(auth, "folder_id");

            // NETWORK
            cfg.subnets         = subnets(required(net, "subnets"));
            cfg.securityGroupId = opt(net, "security_group_id");
            cfg.publicIp        = Boolean.parseBoolean(opt(net, "public_ip", "false"));

            // VM
            cfg.imageId     = required(vm, "image_id");
            cfg.platformId  = opt(vm, "platform_id", cfg.platformId);
            cfg.cpu         = Integer.parseInt(opt(vm, "cpu", String.valueOf(cfg.cpu)));
            cfg.ramGb       = Integer.parseInt(opt(vm, "ram_gb", String.valueOf(cfg.ramGb)));
            cfg.diskGb      = Integer.parseInt(opt(vm, "disk_gb", String.valueOf(cfg.diskGb)));
            cfg.preemptible = Boolean.parseBoolean(opt(vm, "preemptible", "false"));

            // SSH
            cfg.sshUser      = required(ssh, "user");
            cfg.sshPublicKey = keyText.trim();

            // ALB
            cfg.httpRouterId = required(alb, "http_router_id");
            cfg.virtualHost  = opt(alb, "virtual_host", "default");

            // AGENT
            if (agent != null) {
                cfg.agentPort  = Integer.parseInt(opt(agent, "port", String.valueOf(cfg.agentPort)));
                cfg.agentToken = opt(agent, "token");
            }

            return Optional.of(cfg);
        } catch (IOException | RuntimeException ex) {
            log.warn("Cannot load cloud config from {}: {}", file, ex.getMessage());
            return Optional.empty();
        }
    }

    static List<SubnetPlacement> subnets(String value) {
        List<SubnetPlacement> result = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                result.add(SubnetPlacement.parse(part));
            }
        }
        if (result.isEmpty()) {
            throw new IllegalArgumentException("[NETWORK] subnets is empty");
        }
        return result;
    }

    // ===== helpers =====
    private static String required(Profile.Section s, String key) {
        String v = opt(s, key);
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException("[" + s.getName() + "] " + key + " is required");
        }
        return v.trim();
    }

    private static String opt(Profile.Section s, String key) {
        return s == null ? null : s.get(key);
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }
}
