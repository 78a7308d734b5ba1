package io.github.manjago.netscript.core;

/**
 * Instruction set of the legacy script virtual machine.
 * <p>
 * Stack machine: every function frame has its own operand stack. Each
 * instruction carries at most one operand (a constant, a name, a jump target
 * or a nested function).
 */
public enum OpCode {

    // ========== Stack ==========

    /** Push the constant operand. */
    CONST("CONST"),

    /** Discard the top of the stack. */
    POP("POP"),

    /** Duplicate the top of the stack. */
    DUP("DUP"),

    /** Duplicate the two topmost values, keeping their order. */
    DUP2("DUP2"),

    // ========== Variables ==========

    /** Push the value bound to the named variable. */
    LOAD("LOAD"),

    /** Assign the top of the stack to the named variable, leaving it on the stack. */
    STORE("STORE"),

    /** Pop a value and declare the named variable in the current scope. */
    DECLARE("DECLARE"),

    /** Declare the named variable with null unless the current scope already has it. */
    DECLARE_EMPTY("DECLARE_EMPTY"),

    // ========== Properties ==========

    /** obj -> obj[name] */
    GET_MEMBER("GET_MEMBER"),

    /** obj, value -> value (obj[name] = value) */
    SET_MEMBER("SET_MEMBER"),

    /** obj, key -> obj[key] */
    GET_INDEX("GET_INDEX"),

    /** obj, key, value -> value (obj[key] = value) */
    SET_INDEX("SET_INDEX"),

    // ========== Operators ==========

    /** a, b -> a (op) b; operand is the operator symbol. */
    BINARY("BINARY"),

    /** a -> (op) a; operand is "-", "+" or "!". */
    UNARY("UNARY"),

    // ========== Control flow ==========

    /** Jump to the target index. */
    JUMP("JUMP"),

    /** Pop the condition and jump if it is falsy. */
    JUMP_IF_FALSE("JUMP_IF_FALSE"),

    /** Jump keeping the value if it is falsy, otherwise pop it ({@code &&}). */
    JUMP_IF_FALSE_OR_POP("JUMP_IF_FALSE_OR_POP"),

    /** Jump keeping the value if it is truthy, otherwise pop it ({@code ||}). */
    JUMP_IF_TRUE_OR_POP("JUMP_IF_TRUE_OR_POP"),

    // ========== Values ==========

    /** Pop n values into a new array. */
    ARRAY("ARRAY"),

    /** Pop one value per key into a new object. */
    OBJECT("OBJECT"),

    /** Push a closure of the nested function over the current scope. */
    CLOSURE("CLOSURE"),

    /** Declare a hoisted function in the current scope. */
    FUNC_DECL("FUNC_DECL"),

    // ========== Calls ==========

    /** callee, arg1..argN -> result; operand is N. May suspend the machine. */
    CALL("CALL"),

    /** Pop the return value and leave the current frame. */
    RETURN("RETURN"),

    /** End of the program. */
    HALT("HALT");

    private final String mnemonic;

    OpCode(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public String getMnemonic() {
        return mnemonic;
    }
}
