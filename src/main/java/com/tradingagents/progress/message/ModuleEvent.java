package com.tradingagents.progress.message;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Value of the "event" field of module.* payloads.
 */
public enum ModuleEvent {

    START("start", MessageKind.MODULE_START),
    COMPLETE("complete", MessageKind.MODULE_COMPLETE),
    ERROR("error", MessageKind.MODULE_ERROR);

    private final String wireName;
    private final MessageKind kind;

    ModuleEvent(String wireName, MessageKind kind) {
        this.wireName = wireName;
        this.kind = kind;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public MessageKind kind() {
        return kind;
    }

    public static ModuleEvent forKind(MessageKind kind) {
        for (ModuleEvent event : values()) {
            if (event.kind == kind) {
                return event;
            }
        }
        throw new IllegalArgumentException("Not a module event kind: " + kind);
    }
}
