package io.github.manjago.netscript.core;

/**
 * Token kinds of the legacy script language.
 */
public enum TokenType {
    // Single-character punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, DOT, SEMICOLON, COLON,

    // Operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    PLUS_PLUS, MINUS_MINUS,
    PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_EQUAL, PERCENT_EQUAL,
    BANG, BANG_EQUAL, EQUAL, EQUAL_EQUAL,
    GREATER, GREATER_EQUAL, LESS, LESS_EQUAL,
    AND_AND, OR_OR,

    // Literals
    IDENTIFIER, STRING, NUMBER,

    // Keywords
    VAR, LET, CONST, FUNCTION, RETURN, IF, ELSE, WHILE, FOR, BREAK, CONTINUE,
    TRUE, FALSE, NULL, UNDEFINED, IMPORT, FROM, AS,

    EOF
}
