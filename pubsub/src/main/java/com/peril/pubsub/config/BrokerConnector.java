package com.peril.pubsub.config;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Opens broker connections from a {@link BrokerConfig}. The caller owns the returned
 * connection and passes it to the publisher and subscriber explicitly.
 */
public class BrokerConnector {
    private static final Logger log = LoggerFactory.getLogger(BrokerConnector.class);

    private final BrokerConfig cfg;
    private final ConnectionFactory factory;

    public BrokerConnector(BrokerConfig cfg) {
        this(cfg, new ConnectionFactory());
    }

    BrokerConnector(BrokerConfig cfg, ConnectionFactory factory) {
        this.cfg = cfg;
        this.factory = factory;
        factory.setHost(cfg.host);
        factory.setPort(cfg.port);
        factory.setUsername(cfg.username);
        factory.setPassword(cfg.password);
        factory.setVirtualHost(cfg.vhost);
        factory.setAutomaticRecoveryEnabled(cfg.automaticRecovery);
        factory.setNetworkRecoveryInterval(cfg.networkRecoveryIntervalMs);
    }

    public Connection connect(String connectionName) throws IOException, TimeoutException {
        Connection conn = factory.newConnection(connectionName);
        log.info("[MQ] Connected to {}:{} vhost={} user={} as '{}' (automaticRecovery={})",
                cfg.host, cfg.port, cfg.vhost, cfg.username, connectionName, factory.isAutomaticRecoveryEnabled());
        return conn;
    }
}
