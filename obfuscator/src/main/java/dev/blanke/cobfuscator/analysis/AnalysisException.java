package dev.blanke.cobfuscator.analysis;

/**
 * An {@code AnalysisException} is thrown if an analysis has no information about a node, typically because the node
 * was synthesized after the analysis ran.
 * <p>
 * It is never fatal: transformations catch it and leave the affected site untouched, as proceeding without the missing
 * information could change the meaning of the program.
 *
 * @implNote Cannot be a checked {@link Exception}, as transformations query analyses from within overridden
 *           {@link dev.blanke.cobfuscator.ast.TreeTransformer} methods.
 */
public final class AnalysisException extends RuntimeException {

    public AnalysisException(final String message) {
        super(message);
    }
}
