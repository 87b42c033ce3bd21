package dev.blanke.cobfuscator.analysis.scope;

/**
 * The span of positions from the declaration of a binding to its last use, both inclusive.
 */
public record LivenessRange(int start, int end) {

    public LivenessRange {
        if (end < start)
            throw new IllegalArgumentException("Range ends before it starts: [" + start + ", " + end + "]");
    }

    public boolean overlaps(final LivenessRange other) {
        return start <= other.end && other.start <= end;
    }
}
