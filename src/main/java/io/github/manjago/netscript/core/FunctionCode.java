package io.github.manjago.netscript.core;

import java.util.List;

/**
 * Compiled body of a function, or of the whole program for the entry point.
 *
 * @param name         function name ("&lt;main&gt;" for the program, "&lt;anonymous&gt;" for unnamed expressions)
 * @param params       parameter names
 * @param instructions flat instruction list, jump targets are indexes into it
 */
public record FunctionCode(String name, List<String> params, List<Instruction> instructions) {

    public static final String MAIN = "<main>";

    public Instruction at(int index) {
        return instructions.get(index);
    }

    public int size() {
        return instructions.size();
    }

    @Override
    public String toString() {
        return "function " + name + "(" + String.join(", ", params) + ")";
    }
}
