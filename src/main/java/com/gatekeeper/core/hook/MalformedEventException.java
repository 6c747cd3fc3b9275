package com.gatekeeper.core.hook;

/**
 * The event lacks a field needed to evaluate it. The gate declines and the host
 * applies its default behaviour.
 */
public class MalformedEventException extends Exception {

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
