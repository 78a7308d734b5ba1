package io.github.manjago.netscript.core;

/**
 * Thrown when script source cannot be tokenized or parsed.
 */
public class ScriptSyntaxException extends Exception {

    private final int line;

    public ScriptSyntaxException(String message, int line) {
        super("Line " + line + ": " + message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
