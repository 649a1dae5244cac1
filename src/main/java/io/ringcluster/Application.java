package io.ringcluster;

import io.ringcluster.cluster.executor.ExecutorMsg;
import io.ringcluster.cluster.executor.QueueExecutorMailbox;
import io.ringcluster.config.impl.ClusterConfig;
import io.ringcluster.config.type.ConfigLoader;
import io.ringcluster.core.model.NodeId;
import io.ringcluster.node.ClusterNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Main class to start a RingCluster node.
 */
@Slf4j
public class Application {
    public static void main(final String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: java -jar ringcluster.jar <cluster-config.yaml> [name@host:port ...]");
            System.exit(1);
        }

        final ClusterConfig cfg = ConfigLoader.load(args[0]);
        log.info("Loaded config {}", cfg);

        /* No actor executor in standalone mode: drain its mailbox and log what arrives */
        final BlockingQueue<ExecutorMsg> executorQueue = new LinkedBlockingQueue<>();
        final QueueExecutorMailbox mailbox = new QueueExecutorMailbox(executorQueue);

        final ClusterNode node = ClusterNode.start(cfg, mailbox);
        final List<NodeId> seeds = new ArrayList<>(cfg.getSeeds());
        for (int i = 1; i < args.length; i++) {
            seeds.add(NodeId.parse(args[i]));
        }
        for (final NodeId seed : seeds) {
            log.info("Joining seed {}", seed);
            node.join(seed);
        }

        final Thread main = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            mailbox.close();
            node.close();
            main.interrupt();
        }, "shutdown-hook"));

        try {
            while (node.isRunning()) {
                final ExecutorMsg msg = executorQueue.poll(1, TimeUnit.SECONDS);
                if (msg instanceof ExecutorMsg.EnvelopeMsg e) {
                    log.info("Envelope {} -> {}: {}", e.envelope().from(), e.envelope().to(), e.envelope().body());
                }
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Exiting");
    }
}
