package io.github.manjago.stackgp.core;

/**
 * Thrown when an instruction sequence violates the grammar:
 * missing or superfluous operand, slot index outside the variable bank,
 * or jump target outside the program.
 */
public class MalformedProgramException extends IllegalArgumentException {

    private final int position;

    public MalformedProgramException(String message) {
        super(message);
        this.position = -1;
    }

    public MalformedProgramException(String message, int position) {
        super("Instruction " + position + ": " + message);
        this.position = position;
    }

    /**
     * @return offending instruction index, or -1 if not tied to a position
     */
    public int getPosition() {
        return position;
    }
}
