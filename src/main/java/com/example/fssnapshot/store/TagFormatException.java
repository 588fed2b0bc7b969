package com.example.fssnapshot.store;

/**
 * Raised when a serialized tag string cannot be read back.
 */
public class TagFormatException extends IllegalArgumentException {
    public TagFormatException(String message) {
        super(message);
    }
}
