package com.tradingagents.progress.message;

/**
 * Raised when a payload does not satisfy the schema of its message kind.
 * Such a payload is never handed to a bus engine.
 */
public class SchemaViolationException extends RuntimeException {

    private final MessageKind kind;

    public SchemaViolationException(MessageKind kind, String message) {
        super(kind.wireName() + ": " + message);
        this.kind = kind;
    }

    public MessageKind getKind() {
        return kind;
    }
}
