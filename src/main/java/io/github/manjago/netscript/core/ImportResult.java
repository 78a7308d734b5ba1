package io.github.manjago.netscript.core;

/**
 * Script text with its imports inlined.
 *
 * @param code       text to compile
 * @param lineOffset net number of lines added in front of the authored code;
 *                   authored line = executed line - lineOffset
 */
public record ImportResult(String code, int lineOffset) {

    public int authoredLine(int executedLine) {
        return executedLine - lineOffset;
    }
}
