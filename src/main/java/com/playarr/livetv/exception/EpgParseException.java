package com.playarr.livetv.exception;

/**
 * Exception thrown when an XMLTV document cannot be parsed.
 * STACK_EXHAUSTED is the one type the EPG parser recovers from by switching strategy.
 */
public class EpgParseException extends RuntimeException {

    private final ErrorType errorType;

    public enum ErrorType {
        /**
         * The document is not well-formed XML.
         */
        MALFORMED,

        /**
         * The in-memory parser ran out of stack on a deeply nested document.
         */
        STACK_EXHAUSTED,

        /**
         * The underlying file or stream could not be read.
         */
        IO
    }

    public EpgParseException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * True when this failure looks like stack exhaustion, either by type or by message.
     */
    public boolean isStackExhaustion() {
        if (errorType == ErrorType.STACK_EXHAUSTED) {
            return true;
        }
        String message = getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase();
        return lower.contains("stack") || lower.contains("maximum call stack");
    }

    public static EpgParseException malformed(String message, Throwable cause) {
        return new EpgParseException(ErrorType.MALFORMED, "Malformed XMLTV document: " + message, cause);
    }

    public static EpgParseException stackExhausted(Throwable cause) {
        return new EpgParseException(ErrorType.STACK_EXHAUSTED, "Stack exhausted while reading XMLTV into a DOM", cause);
    }

    public static EpgParseException io(String message, Throwable cause) {
        return new EpgParseException(ErrorType.IO, message, cause);
    }
}
