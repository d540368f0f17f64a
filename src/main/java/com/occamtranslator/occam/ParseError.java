package com.occamtranslator.occam;

/**
 * A problem found while parsing. Errors are collected, never thrown: the
 * parser keeps going after each one so a single pass reports as many as it
 * can.
 */
public final class ParseError {
    private final int line;
    private final String message;

    ParseError(int line, String message) {
        this.line = line;
        this.message = message;
    }

    public int line() {
        return line;
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        return "line " + line + ": " + message;
    }
}
