package com.peril.pubsub.routing;

/**
 * Exchange names and routing-key prefixes shared by every Peril process.
 * Keys are {@code prefix.identifier}; {@link #wildcard(String)} subscribes to a whole category.
 */
public final class Routing {

    public static final String EXCHANGE_PERIL_DIRECT = "peril_direct";
    public static final String EXCHANGE_PERIL_TOPIC = "peril_topic";
    public static final String EXCHANGE_PERIL_DLX = "peril_dlx";

    public static final String PAUSE_KEY = "pause";
    public static final String ARMY_MOVES_PREFIX = "army_moves";
    public static final String WAR_RECOGNITIONS_PREFIX = "war";
    public static final String GAME_LOG_SLUG = "game_logs";

    private Routing() {}

    public static String key(String prefix, String identifier) {
        requireSegment(prefix, "prefix");
        requireSegment(identifier, "identifier");
        return prefix + "." + identifier;
    }

    public static String wildcard(String prefix) {
        requireSegment(prefix, "prefix");
        return prefix + ".*";
    }

    private static void requireSegment(String s, String name) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        if (s.indexOf('.') >= 0 || s.indexOf('*') >= 0 || s.indexOf('#') >= 0) {
            throw new IllegalArgumentException(name + " must be a single key segment: " + s);
        }
    }
}
