package io.github.manjago.netscript.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Activation record of one function call: code, instruction index, scope and
 * operand stack.
 */
final class Frame {

    final FunctionCode code;
    final Scope scope;
    final List<Object> stack = new ArrayList<>();
    int ip;

    Frame(FunctionCode code, Scope scope) {
        this.code = code;
        this.scope = scope;
    }

    void push(Object value) {
        stack.add(value);
    }

    Object pop() {
        return stack.remove(stack.size() - 1);
    }

    Object peek() {
        return stack.get(stack.size() - 1);
    }

    Object peek(int depth) {
        return stack.get(stack.size() - 1 - depth);
    }
}
