package dev.blanke.cobfuscator.transform;

/**
 * Thrown by a {@link Transform} if the translation unit contains a construct the transformation cannot handle without
 * changing the meaning of the program, for example a function whose address is taken when its parameter list is to be
 * rewritten.
 * <p>
 * The transformation is aborted as a whole; no partially transformed tree is ever returned.
 *
 * @implNote Cannot be a checked {@link Exception}, as it is thrown from within overridden
 *           {@link dev.blanke.cobfuscator.ast.TreeTransformer} methods.
 */
public final class PreconditionViolationException extends RuntimeException {

    public PreconditionViolationException(final String message) {
        super(message);
    }
}
