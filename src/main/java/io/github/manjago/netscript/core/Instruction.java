package io.github.manjago.netscript.core;

/**
 * One compiled instruction.
 *
 * @param op      operation
 * @param operand constant, name, jump target, argument count or nested function; may be null
 * @param line    source line the instruction was compiled from
 */
public record Instruction(OpCode op, Object operand, int line) {

    public int target() {
        return (Integer) operand;
    }

    public String name() {
        return (String) operand;
    }

    public Instruction withOperand(Object newOperand) {
        return new Instruction(op, newOperand, line);
    }
}
