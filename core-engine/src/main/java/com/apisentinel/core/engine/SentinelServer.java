package com.apisentinel.core.engine;

import com.apisentinel.core.config.ConfigLoader;
import com.apisentinel.core.config.SentinelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Runs the standalone engine with its HTTP query server.
 *
 * <p>
 * Configuration comes from {@code SENTINEL_CONFIG_PATH} or the bundled
 * {@code sentinel.yml}. The process runs until terminated; the shutdown hook
 * stops the server and drains in-flight analyses.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelServer {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelServer.class);

    private SentinelServer() {
        // utility class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        SentinelConfig config = ConfigLoader.load();
        SentinelEngine engine = new SentinelEngine(config);
        QueryServer server = new QueryServer(engine);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down API Sentinel");
            server.stop();
            engine.close();
            stopped.countDown();
        }, "sentinel-shutdown"));

        engine.start();
        server.start(config.getServerPort());
        stopped.await();
    }
}
