package com.tradingagents.progress.bus;

/**
 * Available bus backends, chosen once at startup from {@code bus.engine}.
 */
public enum BusEngineType {

    /** Synchronous, process-local. Nothing survives a restart. */
    MEMORY("memory"),

    /** Redis pub/sub. Best effort: messages published while a subscriber is disconnected are lost. */
    REDIS_PUBSUB("redis-pubsub"),

    /** Redis Streams with a consumer group. At-least-once: unacknowledged entries are redelivered. */
    REDIS_STREAM("redis-stream");

    private final String configName;

    BusEngineType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static BusEngineType fromConfig(String value) {
        for (BusEngineType type : values()) {
            if (type.configName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported bus engine: " + value);
    }
}
