package com.tradingagents.progress.message;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Required-field schema per message kind plus the rules for the bounded extension map.
 */
public final class PayloadSchema {

    public static final int MAX_EXTENSION_FIELDS = 32;

    public static final String ANALYSIS_ID = "analysis_id";
    public static final String STOCK_SYMBOL = "stock_symbol";

    public enum FieldType { STRING, INTEGER, NUMBER, BOOLEAN, ARRAY }

    private static final Map<MessageKind, Map<String, FieldType>> REQUIRED = new EnumMap<>(MessageKind.class);

    static {
        Map<String, FieldType> progress = new LinkedHashMap<>();
        progress.put(ANALYSIS_ID, FieldType.STRING);
        progress.put("current_step", FieldType.INTEGER);
        progress.put("total_steps", FieldType.INTEGER);
        progress.put("progress_percentage", FieldType.NUMBER);
        progress.put("current_step_name", FieldType.STRING);
        progress.put("current_step_description", FieldType.STRING);
        progress.put("elapsed_time", FieldType.NUMBER);
        progress.put("remaining_time", FieldType.NUMBER);
        progress.put("last_message", FieldType.STRING);
        REQUIRED.put(MessageKind.TASK_PROGRESS, progress);

        Map<String, FieldType> status = new LinkedHashMap<>();
        status.put(ANALYSIS_ID, FieldType.STRING);
        status.put("status", FieldType.STRING);
        status.put("message", FieldType.STRING);
        status.put("timestamp", FieldType.NUMBER);
        REQUIRED.put(MessageKind.TASK_STATUS, status);

        Map<String, FieldType> start = new LinkedHashMap<>();
        start.put(ANALYSIS_ID, FieldType.STRING);
        start.put("module_name", FieldType.STRING);
        start.put("event", FieldType.STRING);
        REQUIRED.put(MessageKind.MODULE_START, start);

        Map<String, FieldType> complete = new LinkedHashMap<>(start);
        complete.put("duration", FieldType.NUMBER);
        REQUIRED.put(MessageKind.MODULE_COMPLETE, complete);

        Map<String, FieldType> error = new LinkedHashMap<>(start);
        error.put("error_message", FieldType.STRING);
        REQUIRED.put(MessageKind.MODULE_ERROR, error);

        Map<String, FieldType> stepUpdate = new LinkedHashMap<>();
        stepUpdate.put(ANALYSIS_ID, FieldType.STRING);
        REQUIRED.put(MessageKind.STEP_UPDATE, stepUpdate);
    }

    private PayloadSchema() {
    }

    public static Map<String, FieldType> requiredFields(MessageKind kind) {
        return Collections.unmodifiableMap(REQUIRED.get(kind));
    }

    /**
     * Validates presence, primitive type and value range of every required field,
     * then checks the remaining keys against the extension rules.
     */
    public static void validate(MessageKind kind, Map<String, Object> payload) {
        if (payload == null) {
            throw new SchemaViolationException(kind, "payload is missing");
        }
        Map<String, FieldType> required = REQUIRED.get(kind);
        for (Map.Entry<String, FieldType> field : required.entrySet()) {
            Object value = payload.get(field.getKey());
            if (value == null) {
                throw new SchemaViolationException(kind, "missing required field '" + field.getKey() + "'");
            }
            if (!hasType(value, field.getValue())) {
                throw new SchemaViolationException(kind, "field '" + field.getKey() + "' must be "
                        + field.getValue().name().toLowerCase() + " but was " + value.getClass().getSimpleName());
            }
        }
        checkValues(kind, payload);

        int extensions = 0;
        for (Map.Entry<String, Object> entry : payload.entrySet()) {
            if (required.containsKey(entry.getKey())) {
                continue;
            }
            if (STOCK_SYMBOL.equals(entry.getKey()) && kind.isModuleEvent()) {
                if (entry.getValue() != null && !(entry.getValue() instanceof String)) {
                    throw new SchemaViolationException(kind, "field 'stock_symbol' must be string");
                }
                continue;
            }
            extensions++;
            checkExtensionValue(kind, entry.getKey(), entry.getValue());
        }
        if (extensions > MAX_EXTENSION_FIELDS) {
            throw new SchemaViolationException(kind, "too many extension fields: " + extensions
                    + " (max " + MAX_EXTENSION_FIELDS + ")");
        }
    }

    /**
     * Checks caller-supplied extension fields on their own, before any payload is built.
     */
    public static void validateExtensions(MessageKind kind, Map<String, ?> extensions) {
        if (extensions == null || extensions.isEmpty()) {
            return;
        }
        Map<String, FieldType> required = REQUIRED.get(kind);
        int counted = 0;
        for (Map.Entry<String, ?> entry : extensions.entrySet()) {
            if (required.containsKey(entry.getKey())) {
                throw new SchemaViolationException(kind,
                        "extension field '" + entry.getKey() + "' shadows a required field");
            }
            if (STOCK_SYMBOL.equals(entry.getKey()) && kind.isModuleEvent()) {
                continue;
            }
            counted++;
            checkExtensionValue(kind, entry.getKey(), entry.getValue());
        }
        if (counted > MAX_EXTENSION_FIELDS) {
            throw new SchemaViolationException(kind, "too many extension fields: " + counted
                    + " (max " + MAX_EXTENSION_FIELDS + ")");
        }
    }

    /**
     * Merges caller-supplied extension fields into a payload. Extensions may not shadow a required field.
     */
    public static Map<String, Object> withExtensions(MessageKind kind, Map<String, Object> base,
                                                     Map<String, ?> extensions) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        if (extensions == null || extensions.isEmpty()) {
            return merged;
        }
        Map<String, FieldType> required = REQUIRED.get(kind);
        for (Map.Entry<String, ?> entry : extensions.entrySet()) {
            if (required.containsKey(entry.getKey())) {
                throw new SchemaViolationException(kind,
                        "extension field '" + entry.getKey() + "' shadows a required field");
            }
            merged.put(entry.getKey(), entry.getValue());
        }
        return merged;
    }

    private static void checkValues(MessageKind kind, Map<String, Object> payload) {
        if (!Topics.isValidAnalysisId((String) payload.get(ANALYSIS_ID))) {
            throw new SchemaViolationException(kind, "invalid analysis_id '" + payload.get(ANALYSIS_ID) + "'");
        }
        switch (kind) {
            case TASK_PROGRESS -> {
                long currentStep = ((Number) payload.get("current_step")).longValue();
                long totalSteps = ((Number) payload.get("total_steps")).longValue();
                double percentage = ((Number) payload.get("progress_percentage")).doubleValue();
                if (currentStep < 0) {
                    throw new SchemaViolationException(kind, "current_step must be >= 0");
                }
                if (totalSteps <= 0) {
                    throw new SchemaViolationException(kind, "total_steps must be > 0");
                }
                if (percentage < 0.0 || percentage > 100.0) {
                    throw new SchemaViolationException(kind, "progress_percentage must be within 0-100");
                }
                requireNonNegative(kind, payload, "elapsed_time");
                requireNonNegative(kind, payload, "remaining_time");
            }
            case TASK_STATUS -> {
                if (!TaskStatus.isKnown((String) payload.get("status"))) {
                    throw new SchemaViolationException(kind, "unknown status '" + payload.get("status") + "'");
                }
            }
            case MODULE_START, MODULE_COMPLETE, MODULE_ERROR -> {
                String expected = ModuleEvent.forKind(kind).wireName();
                if (!expected.equals(payload.get("event"))) {
                    throw new SchemaViolationException(kind, "event must be '" + expected + "'");
                }
                if (kind == MessageKind.MODULE_COMPLETE) {
                    requireNonNegative(kind, payload, "duration");
                }
            }
            default -> {
            }
        }
    }

    private static void requireNonNegative(MessageKind kind, Map<String, Object> payload, String field) {
        if (((Number) payload.get(field)).doubleValue() < 0.0) {
            throw new SchemaViolationException(kind, field + " must be >= 0");
        }
    }

    private static void checkExtensionValue(MessageKind kind, String key, Object value) {
        if (value == null || isPrimitive(value)) {
            return;
        }
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null && !isPrimitive(item)) {
                    throw new SchemaViolationException(kind,
                            "extension field '" + key + "' may only hold primitive array items");
                }
            }
            return;
        }
        throw new SchemaViolationException(kind, "extension field '" + key + "' must be a primitive or an array, got "
                + value.getClass().getSimpleName());
    }

    private static boolean isPrimitive(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private static boolean hasType(Object value, FieldType type) {
        return switch (type) {
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte;
            case NUMBER -> value instanceof Number number && Double.isFinite(number.doubleValue());
            case BOOLEAN -> value instanceof Boolean;
            case ARRAY -> value instanceof Collection<?>;
        };
    }
}
