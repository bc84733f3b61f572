package com.peril.pubsub.queue;

/**
 * How long a declared queue lives. Each policy fixes the three flags passed to
 * {@code queue.declare}.
 */
public enum QueueDurability {
    /** Survives broker restarts, shared, never auto-deleted. */
    DURABLE(true, false, false),
    /** Owned by the declaring connection and deleted with it. */
    TRANSIENT(false, true, true);

    private final boolean durable;
    private final boolean autoDelete;
    private final boolean exclusive;

    QueueDurability(boolean durable, boolean autoDelete, boolean exclusive) {
        this.durable = durable;
        this.autoDelete = autoDelete;
        this.exclusive = exclusive;
    }

    public boolean durable() { return durable; }
    public boolean autoDelete() { return autoDelete; }
    public boolean exclusive() { return exclusive; }
}
