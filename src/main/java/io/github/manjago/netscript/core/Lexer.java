package io.github.manjago.netscript.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tokenizer for the legacy script language.
 * <p>
 * Keeps the character offsets of every token so that the import resolver can
 * cut declarations out of the original text without reprinting it.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("var", TokenType.VAR);
        map.put("let", TokenType.LET);
        map.put("const", TokenType.CONST);
        map.put("function", TokenType.FUNCTION);
        map.put("return", TokenType.RETURN);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("while", TokenType.WHILE);
        map.put("for", TokenType.FOR);
        map.put("break", TokenType.BREAK);
        map.put("continue", TokenType.CONTINUE);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("null", TokenType.NULL);
        map.put("undefined", TokenType.UNDEFINED);
        map.put("import", TokenType.IMPORT);
        map.put("from", TokenType.FROM);
        map.put("as", TokenType.AS);
        KEYWORDS = Collections.unmodifiableMap(map);
    }

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int tokenLine = 1;

    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Tokenize the whole source.
     *
     * @return tokens, always terminated by an EOF token
     * @throws ScriptSyntaxException on an unexpected character or unterminated literal
     */
    public List<Token> tokenize() throws ScriptSyntaxException {
        while (!isAtEnd()) {
            start = current;
            tokenLine = line;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, current, current));
        return tokens;
    }

    private void scanToken() throws ScriptSyntaxException {
        char c = advance();
        switch (c) {
            case '(' -> addToken(TokenType.LEFT_PAREN);
            case ')' -> addToken(TokenType.RIGHT_PAREN);
            case '{' -> addToken(TokenType.LEFT_BRACE);
            case '}' -> addToken(TokenType.RIGHT_BRACE);
            case '[' -> addToken(TokenType.LEFT_BRACKET);
            case ']' -> addToken(TokenType.RIGHT_BRACKET);
            case ',' -> addToken(TokenType.COMMA);
            case '.' -> addToken(TokenType.DOT);
            case ';' -> addToken(TokenType.SEMICOLON);
            case ':' -> addToken(TokenType.COLON);
            case '+' -> {
                if (match('+')) addToken(TokenType.PLUS_PLUS);
                else addToken(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS);
            }
            case '-' -> {
                if (match('-')) addToken(TokenType.MINUS_MINUS);
                else addToken(match('=') ? TokenType.MINUS_EQUAL : TokenType.MINUS);
            }
            case '*' -> addToken(match('=') ? TokenType.STAR_EQUAL : TokenType.STAR);
            case '%' -> addToken(match('=') ? TokenType.PERCENT_EQUAL : TokenType.PERCENT);
            case '/' -> {
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(match('=') ? TokenType.SLASH_EQUAL : TokenType.SLASH);
                }
            }
            case '!' -> {
                if (match('=')) {
                    match('=');
                    addToken(TokenType.BANG_EQUAL);
                } else {
                    addToken(TokenType.BANG);
                }
            }
            case '=' -> {
                if (match('=')) {
                    match('=');
                    addToken(TokenType.EQUAL_EQUAL);
                } else {
                    addToken(TokenType.EQUAL);
                }
            }
            case '<' -> addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>' -> addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '&' -> {
                if (!match('&')) throw new ScriptSyntaxException("Unexpected character '&'", line);
                addToken(TokenType.AND_AND);
            }
            case '|' -> {
                if (!match('|')) throw new ScriptSyntaxException("Unexpected character '|'", line);
                addToken(TokenType.OR_OR);
            }
            case ' ', '\r', '\t' -> { }
            case '\n' -> line++;
            case '"', '\'' -> string(c);
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    throw new ScriptSyntaxException("Unexpected character '" + c + "'", line);
                }
            }
        }
    }

    private void blockComment() throws ScriptSyntaxException {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                current += 2;
                return;
            }
            if (advance() == '\n') line++;
        }
        throw new ScriptSyntaxException("Unterminated comment", tokenLine);
    }

    private void string(char quote) throws ScriptSyntaxException {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\n') {
                throw new ScriptSyntaxException("Unterminated string", tokenLine);
            }
            if (c == '\\' && !isAtEnd()) {
                char esc = advance();
                switch (esc) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(esc);
                }
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) {
            throw new ScriptSyntaxException("Unterminated string", tokenLine);
        }
        advance(); // closing quote
        addToken(TokenType.STRING, sb.toString());
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        addToken(TokenType.NUMBER, Double.parseDouble(source.substring(start, current)));
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        tokens.add(new Token(type, source.substring(start, current), literal, tokenLine, start, current));
    }
}
