package tacoq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.server.ManagerNettyServer;

import java.util.concurrent.CountDownLatch;

/**
 * Manager entry point.
 *
 * Reads configuration from the environment, starts the HTTP server and the
 * background loops, and stops them on JVM shutdown.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        ManagerConfig config = ManagerConfig.fromEnv();
        int port = config.serverPort();

        log.info("Starting TacoQ manager on port {}...", port);
        if (!ManagerNettyServer.start(port, config)) {
            log.error("Manager did not start, exiting");
            System.exit(1);
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping manager...");
            ManagerNettyServer.stop();
            shutdown.countDown();
        }, "tacoq-shutdown"));

        shutdown.await();
    }
}
