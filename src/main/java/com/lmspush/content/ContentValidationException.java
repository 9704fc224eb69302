package com.lmspush.content;

/**
 * Raised when a submission, rule or destination definition is structurally invalid.
 * Rejected synchronously; never enters the push state machine.
 */
public class ContentValidationException extends RuntimeException {

    public ContentValidationException(String message) {
        super(message);
    }
}
