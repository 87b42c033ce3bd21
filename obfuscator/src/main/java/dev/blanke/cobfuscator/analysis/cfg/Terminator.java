package dev.blanke.cobfuscator.analysis.cfg;

import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * Describes how control leaves a {@link BasicBlock}.
 */
public interface Terminator {

    /**
     * @return The ids of the blocks control may continue in, in the order of the branches of this terminator.
     */
    List<Integer> successors();

    /**
     * @return This terminator with every block id replaced by the result of the passed function.
     */
    Terminator remap(IntUnaryOperator ids);
}
