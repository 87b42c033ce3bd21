package dev.blanke.cobfuscator;

/**
 * Thrown if a {@link Composition} cannot be run, because a parameter is out of range or could not be read.
 * <p>
 * Compositions are checked before any tree is touched, so a caller can correct the composition and retry.
 */
public final class InvalidCompositionException extends Exception {

    public InvalidCompositionException(final String message) {
        super(message);
    }

    public InvalidCompositionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
