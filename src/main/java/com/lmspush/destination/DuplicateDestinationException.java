package com.lmspush.destination;

/**
 * Thrown when registering a destination under a name that is already taken.
 */
public class DuplicateDestinationException extends RuntimeException {

    public DuplicateDestinationException(String name) {
        super("destination already exists: " + name);
    }
}
