package com.heroku.relay.model;

/**
 * Row-level operation carried by a change notification.
 */
public enum OperationType {
    INSERT,
    UPDATE,
    DELETE;

    /**
     * Parses the upstream "type" field.
     * @throws IllegalArgumentException for a missing or unknown type
     */
    public static OperationType fromWire(String type) {
        if (type == null) {
            throw new IllegalArgumentException("Change notification has no operation type");
        }
        try {
            return OperationType.valueOf(type.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported operation type: " + type, ex);
        }
    }
}
