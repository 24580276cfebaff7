package io.github.manjago.stackgp.genetic;

/**
 * Grammar parameters every generated or recombined program must respect.
 *
 * @param minLength minimum instruction count (at least 1)
 * @param maxLength maximum instruction count
 * @param variableSlots variable bank size
 * @param literalMin smallest PUSH literal generated
 * @param literalMax largest PUSH literal generated
 * @param allowJumps whether JMP/JZ may be generated
 */
public record ProgramShape(
    int minLength,
    int maxLength,
    int variableSlots,
    int literalMin,
    int literalMax,
    boolean allowJumps
) {

    public ProgramShape {
        if (minLength < 1) {
            throw new IllegalArgumentException("minLength must be >= 1: " + minLength);
        }
        if (maxLength < minLength) {
            throw new IllegalArgumentException("maxLength < minLength: " + maxLength + " < " + minLength);
        }
        if (variableSlots < 0) {
            throw new IllegalArgumentException("variableSlots must be >= 0: " + variableSlots);
        }
        if (literalMin > literalMax) {
            throw new IllegalArgumentException("literalMin > literalMax: " + literalMin + " > " + literalMax);
        }
    }

    public boolean acceptsLength(int length) {
        return length >= minLength && length <= maxLength;
    }
}
