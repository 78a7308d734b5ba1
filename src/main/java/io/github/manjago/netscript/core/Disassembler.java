package io.github.manjago.netscript.core;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Converts compiled legacy scripts to a readable instruction listing.
 */
public final class Disassembler {

    private Disassembler() {
        // Utility class
    }

    /**
     * Disassemble a single instruction.
     *
     * @return text like {@code LOAD x} or {@code JUMP_IF_FALSE -> 12}
     */
    public static @NotNull String disassemble(@NotNull Instruction instruction) {
        OpCode op = instruction.op();
        Object operand = instruction.operand();
        return switch (op) {
            case POP, DUP, DUP2, GET_INDEX, SET_INDEX, RETURN, HALT -> op.getMnemonic();
            case CONST -> op.getMnemonic() + " " + literal(operand);
            case JUMP, JUMP_IF_FALSE, JUMP_IF_FALSE_OR_POP, JUMP_IF_TRUE_OR_POP ->
                    op.getMnemonic() + " -> " + operand;
            case CLOSURE, FUNC_DECL -> op.getMnemonic() + " " + ((FunctionCode) operand).name();
            case OBJECT -> op.getMnemonic() + " {" + String.join(", ", castKeys(operand)) + "}";
            default -> op.getMnemonic() + " " + operand;
        };
    }

    /**
     * Disassemble a function and, after it, every function nested in it.
     *
     * @return multi-line listing, one block per function
     */
    public static @NotNull String disassemble(@NotNull FunctionCode main) {
        StringBuilder sb = new StringBuilder();
        Deque<FunctionCode> pending = new ArrayDeque<>();
        pending.add(main);
        while (!pending.isEmpty()) {
            FunctionCode code = pending.poll();
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(code).append(":\n");
            for (int i = 0; i < code.size(); i++) {
                Instruction in = code.at(i);
                sb.append(String.format("%4d  [line %3d]  %s%n", i, in.line(), disassemble(in)));
                if (in.operand() instanceof FunctionCode nested) {
                    pending.add(nested);
                }
            }
        }
        return sb.toString();
    }

    private static String literal(Object value) {
        if (value instanceof String s) {
            return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
        }
        return GuestValues.toDisplayString(value);
    }

    @SuppressWarnings("unchecked")
    private static List<String> castKeys(Object operand) {
        return (List<String>) operand;
    }
}
