package com.retail.herd.service;

/**
 * Thrown when an incoming event cannot be turned into an interaction: a required field is missing
 * or the timestamp cannot be parsed.
 */
public class InvalidEventException extends RuntimeException {

    private final String field;

    public InvalidEventException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
