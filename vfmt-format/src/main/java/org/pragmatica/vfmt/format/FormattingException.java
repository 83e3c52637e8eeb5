package org.pragmatica.vfmt.format;

/**
 * Thrown when annotation input or style settings violate their contract.
 */
public final class FormattingException extends RuntimeException {
    private final FormattingError error;

    public FormattingException(FormattingError error) {
        super(error.message(), causeOf(error));
        this.error = error;
    }

    public FormattingError error() {
        return error;
    }

    private static Throwable causeOf(FormattingError error) {
        return error instanceof FormattingError.StyleReadFailed failed ? failed.cause() : null;
    }
}
