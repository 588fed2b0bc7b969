package com.example.fssnapshot.pattern;

/**
 * Raised when a path template cannot be compiled.
 */
public class PatternException extends IllegalArgumentException {
    private final String pattern;

    public PatternException(String pattern, String message) {
        super(message + ": '" + pattern + "'");
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }
}
