package io.github.manjago.netscript.core;

/**
 * A fault raised by guest code while it runs: a type error, an undefined
 * variable, a rejected host call.
 * <p>
 * The line is the line of the code that was actually executed (after import
 * inlining), or -1 when unknown. Callers map it back to the authored line.
 */
public class ScriptRuntimeException extends RuntimeException {

    private int line;

    public ScriptRuntimeException(String message) {
        this(message, -1);
    }

    public ScriptRuntimeException(String message, int line) {
        super(message);
        this.line = line;
    }

    public ScriptRuntimeException(String message, Throwable cause) {
        super(message, cause);
        this.line = -1;
    }

    public int getLine() {
        return line;
    }

    /**
     * Attach the executing line if none is known yet.
     */
    public ScriptRuntimeException atLine(int line) {
        if (this.line < 0) {
            this.line = line;
        }
        return this;
    }
}
