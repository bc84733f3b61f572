package com.peril.pubsub.config;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BrokerConnectorTest {

    @Test
    void configuresFactoryAndOpensNamedConnection() throws Exception {
        Properties p = new Properties();
        p.setProperty("rabbitmq.host", "mq");
        p.setProperty("rabbitmq.port", "5680");
        p.setProperty("rabbitmq.username", "peril");
        p.setProperty("rabbitmq.password", "secret");
        p.setProperty("rabbitmq.virtualHost", "/game");
        p.setProperty("rabbitmq.automaticRecovery", "false");
        p.setProperty("rabbitmq.networkRecoveryIntervalMs", "1500");
        BrokerConfig cfg = BrokerConfig.fromProperties(p);

        ConnectionFactory factory = mock(ConnectionFactory.class);
        Connection conn = mock(Connection.class);
        when(factory.newConnection("peril-client")).thenReturn(conn);

        BrokerConnector connector = new BrokerConnector(cfg, factory);

        verify(factory).setHost("mq");
        verify(factory).setPort(5680);
        verify(factory).setUsername("peril");
        verify(factory).setPassword("secret");
        verify(factory).setVirtualHost("/game");
        verify(factory).setAutomaticRecoveryEnabled(false);
        verify(factory).setNetworkRecoveryInterval(1500L);

        assertSame(conn, connector.connect("peril-client"));
    }
}
