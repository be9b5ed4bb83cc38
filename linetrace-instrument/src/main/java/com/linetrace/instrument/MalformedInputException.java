package com.linetrace.instrument;

/**
 * The method text could not be located or does not parse as a single method with a body.
 */
public class MalformedInputException extends RuntimeException {
    public MalformedInputException(String message) { super(message); }
    public MalformedInputException(String message, Throwable cause) { super(message, cause); }
}
