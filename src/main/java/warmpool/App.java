package warmpool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.cloud.config.CloudConfig;
import warmpool.cloud.config.IniLoader;
import warmpool.orchestrator.config.Dependencies;
import warmpool.orchestrator.config.PoolConfig;

import java.io.File;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;

/**
 * Headless entry point: keeps the warm pool topped up until the process is
 * stopped. The provisioning API is embedded by callers through
 * {@link Dependencies}.
 *
 * Usage: {@code java -jar warmpool.jar cloud.ini} or {@code POOL_CLOUD_INI=cloud.ini}.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        String iniPath = args.length > 0 ? args[0] : System.getenv("POOL_CLOUD_INI");
        if (iniPath == null || iniPath.isBlank()) {
            log.error("Cloud config path missing: pass it as the first argument or set POOL_CLOUD_INI");
            System.exit(2);
        }

        Optional<CloudConfig> cloud = IniLoader.load(new File(iniPath));
        if (cloud.isEmpty()) {
            log.error("Cloud config {} is incomplete", iniPath);
            System.exit(2);
        }

        PoolConfig config = PoolConfig.fromEnv();
        Dependencies deps = Dependencies.forYandex(config, cloud.get());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            stopped.countDown();
        }, "warmpool-shutdown"));

        deps.startScheduler();
        log.info("Pool '{}' running, target spare {}", config.poolName(), config.targetSpare());
        stopped.await();
    }
}
