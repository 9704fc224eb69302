package com.lmspush.api;

public class PushNotFoundException extends RuntimeException {

    public PushNotFoundException(String pushId) {
        super("push record not found: " + pushId);
    }
}
