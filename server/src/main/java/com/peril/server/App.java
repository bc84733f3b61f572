package com.peril.server;

import com.peril.pubsub.AckType;
import com.peril.pubsub.queue.ExchangeTopology;
import com.peril.pubsub.queue.QueueBindingManager;
import com.peril.pubsub.queue.QueueDurability;
import com.peril.pubsub.config.BrokerConfig;
import com.peril.pubsub.config.BrokerConnector;
import com.peril.pubsub.publish.MqPublisher;
import com.peril.pubsub.routing.GameLog;
import com.peril.pubsub.routing.PlayingState;
import com.peril.pubsub.routing.Routing;
import com.peril.pubsub.worker.MessageSubscriber;
import com.peril.pubsub.worker.Subscription;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Peril server process.
 * <pre>
 *   App            declare topology, consume game logs until interrupted
 *   App pause      publish a paused PlayingState and exit
 *   App resume     publish a resumed PlayingState and exit
 * </pre>
 */
public class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        try {
            BrokerConfig cfg = BrokerConfig.load();
            log.info("[CONF] {}", cfg);

            Connection conn = new BrokerConnector(cfg).connect("peril-server");
            Channel ch = conn.createChannel();
            new ExchangeTopology(cfg.deadLetterExchange).declare(ch);
            MqPublisher publisher = new MqPublisher(ch, cfg.persistentMessages);

            String command = args.length > 0 ? args[0].trim().toLowerCase() : "";
            switch (command) {
                case "pause":
                case "resume":
                    boolean paused = command.equals("pause");
                    publisher.publishJson(Routing.EXCHANGE_PERIL_DIRECT, Routing.PAUSE_KEY, new PlayingState(paused), PlayingState.class);
                    log.info("[BOOT] Game {}", paused ? "paused" : "resumed");
                    conn.close();
                    return;
                case "":
                    break;
                default:
                    log.error("Unknown command '{}'. Usage: App [pause|resume]", command);
                    conn.close();
                    System.exit(2);
                    return;
            }

            MessageSubscriber subscriber = new MessageSubscriber(conn,
                    new QueueBindingManager(cfg.deadLetterExchange), cfg.prefetch);
            Subscription logs = subscriber.subscribeBinary(
                    Routing.EXCHANGE_PERIL_TOPIC,
                    Routing.GAME_LOG_SLUG,
                    Routing.wildcard(Routing.GAME_LOG_SLUG),
                    QueueDurability.DURABLE,
                    GameLog.class,
                    App::handleGameLog);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutdown signal received. Closing connection...");
                logs.close();
                try {
                    if (conn.isOpen()) conn.close();
                } catch (Exception e) {
                    log.warn("Error while closing MQ connection", e);
                }
                log.info("Shutdown complete.");
            }));

            new CountDownLatch(1).await();

        } catch (Throwable t) {
            log.error("Fatal error in App.main", t);
            System.exit(1);
        }
    }

    static AckType handleGameLog(GameLog gl) {
        log.info("[GAME] {} {}: {}", gl.currentTime(), gl.username(), gl.message());
        return AckType.ACK;
    }
}
