package com.syncmirror;

import com.syncmirror.client.SyncClient;
import com.syncmirror.client.SyncClientConfig;
import com.syncmirror.client.SyncClientListener;
import com.syncmirror.client.SyncStatus;
import com.syncmirror.state.Milestone;
import com.syncmirror.state.SyncStateSnapshot;
import com.syncmirror.transport.netty.NettyTransportClient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point for a headless state mirror.
 *
 * Connects to the authority at SYNC_ENDPOINT_URL (or the first argument), logs every
 * state change, milestone and status transition, and keeps running until the JVM
 * is asked to stop.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws InterruptedException {
        SyncClientConfig config;
        try {
            SyncClientConfig fromEnv = SyncClientConfig.fromEnv();
            // Allow endpoint override via command line argument
            config = args.length > 0
                    ? fromEnv.toBuilder().endpointUrl(args[0]).build()
                    : fromEnv;
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        logger.info("===========================================");
        logger.info("  Sync Mirror Client");
        logger.info("  Endpoint: {}", config.getEndpoint());
        logger.info("  Pool size: {}", config.getPoolSize());
        logger.info("===========================================");

        NettyTransportClient transport = new NettyTransportClient(1, (int) config.getConnectTimeoutMs(), 0);
        SyncClient client = new SyncClient(config, transport);
        client.addListener(new LoggingListener());

        CountDownLatch stopped = new CountDownLatch(1);

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, disconnecting...");
            client.close();
            stopped.countDown();
        }));

        client.connect().whenComplete((ignored, error) -> {
            if (error != null) {
                logger.warn("Initial connect failed, retrying in the background: {}", error.getMessage());
            }
        });

        stopped.await();
    }

    private static final class LoggingListener implements SyncClientListener {

        @Override
        public void onStatusChange(SyncStatus status, String description) {
            logger.info("[{}] {}", status.getLabel(), description);
        }

        @Override
        public void onStateChange(SyncStateSnapshot previous, SyncStateSnapshot current) {
            logger.info("State v{}: value={} phase={} trend={}",
                    current.getVersion(), current.getValue(), current.getPhase(), current.getTrend());
        }

        @Override
        public void onMilestone(Milestone milestone, SyncStateSnapshot state) {
            logger.info("Milestone reached: {} at {}", milestone.getName(), state.getValue());
        }
    }
}
