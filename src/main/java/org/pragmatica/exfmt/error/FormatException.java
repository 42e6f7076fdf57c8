package org.pragmatica.exfmt.error;

/**
 * Raised when a formatting call cannot complete: invalid configuration, a misbehaving callback
 * or a tree the formatter cannot walk.
 */
public final class FormatException extends RuntimeException {
    private final FormatError error;

    public FormatException(FormatError error) {
        super(error.message());
        this.error = error;
    }

    public FormatException(FormatError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public FormatError error() {
        return error;
    }
}
