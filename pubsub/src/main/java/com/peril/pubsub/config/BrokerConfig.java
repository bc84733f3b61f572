package com.peril.pubsub.config;

import com.peril.pubsub.routing.Routing;

import java.io.InputStream;
import java.util.Properties;

/**
 * Broker connection and pub/sub settings.
 * Values come from {@code peril.properties} on the classpath; every key can be
 * overridden by a system property of the same name or by an environment variable
 * (upper-cased, dots replaced with underscores, e.g. {@code RABBITMQ_HOST}).
 */
public class BrokerConfig {
    public static final String RESOURCE = "peril.properties";

    public final String host; public final int port; public final String username; public final String password; public final String vhost;
    public final boolean automaticRecovery; public final long networkRecoveryIntervalMs;
    public final String deadLetterExchange;
    public final int prefetch; public final boolean persistentMessages;

    private BrokerConfig(Properties p) {
        this.host = value(p, "rabbitmq.host", "localhost");
        this.port = Integer.parseInt(value(p, "rabbitmq.port", "5672"));
        this.username = value(p, "rabbitmq.username", "guest");
        this.password = value(p, "rabbitmq.password", "guest");
        this.vhost = value(p, "rabbitmq.virtualHost", "/");
        this.automaticRecovery = Boolean.parseBoolean(value(p, "rabbitmq.automaticRecovery", "true"));
        this.networkRecoveryIntervalMs = Long.parseLong(value(p, "rabbitmq.networkRecoveryIntervalMs", "3000"));
        this.deadLetterExchange = value(p, "rabbitmq.deadLetterExchange", Routing.EXCHANGE_PERIL_DLX);
        this.prefetch = Integer.parseInt(value(p, "consumer.prefetch", "0"));
        this.persistentMessages = Boolean.parseBoolean(value(p, "publisher.persistent", "false"));

        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("rabbitmq.port out of range: " + port);
        }
        if (prefetch < 0) {
            throw new IllegalArgumentException("consumer.prefetch must be >= 0");
        }
        if (deadLetterExchange.isBlank()) {
            throw new IllegalArgumentException("rabbitmq.deadLetterExchange must not be blank");
        }
    }

    public static BrokerConfig load() {
        try (InputStream in = BrokerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            Properties p = new Properties();
            if (in != null) p.load(in);
            return new BrokerConfig(p);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load " + RESOURCE, e);
        }
    }

    public static BrokerConfig fromProperties(Properties p) {
        return new BrokerConfig(p);
    }

    public static BrokerConfig defaults() {
        return new BrokerConfig(new Properties());
    }

    private static String value(Properties p, String key, String defVal) {
        String env = System.getenv(key.toUpperCase().replace('.', '_'));
        if (env != null && !env.isBlank()) return env.trim();
        String prop = System.getProperty(key);
        if (prop != null && !prop.isBlank()) return prop.trim();
        String file = p.getProperty(key);
        if (file != null && !file.isBlank()) return file.trim();
        return defVal;
    }

    @Override
    public String toString() {
        return "BrokerConfig{amqp://" + username + "@" + host + ":" + port + vhost
                + ", dlx=" + deadLetterExchange + ", prefetch=" + prefetch
                + ", persistent=" + persistentMessages + ", automaticRecovery=" + automaticRecovery + '}';
    }
}
