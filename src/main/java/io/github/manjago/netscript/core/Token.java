package io.github.manjago.netscript.core;

/**
 * A lexical token with its position in the source text.
 *
 * @param type    token kind
 * @param lexeme  raw text of the token
 * @param literal parsed value for strings and numbers, otherwise null
 * @param line    1-based line where the token starts
 * @param start   offset of the first character
 * @param end     offset just past the last character
 */
public record Token(TokenType type, String lexeme, Object literal, int line, int start, int end) {

    @Override
    public String toString() {
        return type + " '" + lexeme + "' @" + line;
    }
}
