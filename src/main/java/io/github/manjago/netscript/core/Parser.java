package io.github.manjago.netscript.core;

import java.util.ArrayList;
import java.util.List;

import static io.github.manjago.netscript.core.TokenType.*;

/**
 * Recursive-descent parser for the legacy script language.
 * <p>
 * Semicolons may be left out at the end of a line, before a closing brace and
 * at the end of the input. Import declarations are only accepted at the top
 * level of a script.
 */
public class Parser {

    private final String source;
    private final List<Token> tokens;
    private int current = 0;
    private int functionDepth = 0;
    private int loopDepth = 0;

    private Parser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    /**
     * Parse a complete script.
     *
     * @param source script text
     * @return the syntax tree
     * @throws ScriptSyntaxException if the text is not a valid script
     */
    public static Program parse(String source) throws ScriptSyntaxException {
        List<Token> tokens = new Lexer(source).tokenize();
        return new Parser(source, tokens).program();
    }

    private Program program() throws ScriptSyntaxException {
        List<Stmt> body = new ArrayList<>();
        while (!isAtEnd()) {
            if (check(IMPORT)) {
                body.add(importDeclaration());
            } else {
                body.add(declaration());
            }
        }
        return new Program(List.copyOf(body), source);
    }

    // ========== Declarations ==========

    private Stmt.Import importDeclaration() throws ScriptSyntaxException {
        Token start = advance();
        List<String> names = new ArrayList<>();
        String namespace = null;

        if (match(STAR)) {
            consume(AS, "Expected 'as' after '*' in import");
            namespace = consume(IDENTIFIER, "Expected namespace name").lexeme();
        } else {
            consume(LEFT_BRACE, "Expected '{' or '*' after 'import'");
            if (!check(RIGHT_BRACE)) {
                do {
                    if (check(RIGHT_BRACE)) break;
                    names.add(consume(IDENTIFIER, "Expected imported function name").lexeme());
                } while (match(COMMA));
            }
            consume(RIGHT_BRACE, "Expected '}' after imported names");
            if (names.isEmpty()) {
                throw error(previous(), "Import declaration names no functions");
            }
        }
        consume(FROM, "Expected 'from' in import declaration");
        Token ref = consume(STRING, "Expected script name string after 'from'");
        match(SEMICOLON);
        Token end = previous();

        Span span = new Span(start.start(), end.end(), start.line(), end.line());
        return new Stmt.Import(List.copyOf(names), namespace, (String) ref.literal(), span, start.line());
    }

    private Stmt declaration() throws ScriptSyntaxException {
        if (check(IMPORT)) {
            throw error(peek(), "'import' may only appear at the top level of a script");
        }
        if (check(FUNCTION) && checkNext(IDENTIFIER)) {
            return functionDeclaration();
        }
        if (match(VAR, LET, CONST)) {
            return varDeclaration();
        }
        return statement();
    }

    private Stmt.Function functionDeclaration() throws ScriptSyntaxException {
        Token start = advance();
        String name = consume(IDENTIFIER, "Expected function name").lexeme();
        List<String> params = parameters();
        List<Stmt> body = functionBody();
        Token end = previous();
        Span span = new Span(start.start(), end.end(), start.line(), end.line());
        return new Stmt.Function(name, params, body, span, start.line());
    }

    private List<String> parameters() throws ScriptSyntaxException {
        consume(LEFT_PAREN, "Expected '(' before parameters");
        List<String> params = new ArrayList<>();
        if (!check(RIGHT_PAREN)) {
            do {
                params.add(consume(IDENTIFIER, "Expected parameter name").lexeme());
            } while (match(COMMA));
        }
        consume(RIGHT_PAREN, "Expected ')' after parameters");
        return List.copyOf(params);
    }

    private List<Stmt> functionBody() throws ScriptSyntaxException {
        consume(LEFT_BRACE, "Expected '{' before function body");
        int savedLoops = loopDepth;
        functionDepth++;
        loopDepth = 0;
        try {
            return block();
        } finally {
            functionDepth--;
            loopDepth = savedLoops;
        }
    }

    private Stmt varDeclaration() throws ScriptSyntaxException {
        int line = previous().line();
        List<Stmt> declarations = new ArrayList<>();
        do {
            Token name = consume(IDENTIFIER, "Expected variable name");
            Expr initializer = match(EQUAL) ? expression() : null;
            declarations.add(new Stmt.Var(name.lexeme(), initializer, name.line()));
        } while (match(COMMA));
        consumeSemicolon();
        return declarations.size() == 1 ? declarations.get(0) : new Stmt.Block(List.copyOf(declarations), line);
    }

    // ========== Statements ==========

    private Stmt statement() throws ScriptSyntaxException {
        if (match(IF)) return ifStatement();
        if (match(WHILE)) return whileStatement();
        if (match(FOR)) return forStatement();
        if (match(RETURN)) return returnStatement();
        if (match(BREAK)) return loopJump(new Stmt.Break(previous().line()), "break");
        if (match(CONTINUE)) return loopJump(new Stmt.Continue(previous().line()), "continue");
        if (match(LEFT_BRACE)) {
            int line = previous().line();
            return new Stmt.Block(block(), line);
        }
        if (match(SEMICOLON)) return new Stmt.Block(List.of(), previous().line());
        return expressionStatement();
    }

    private Stmt ifStatement() throws ScriptSyntaxException {
        int line = previous().line();
        consume(LEFT_PAREN, "Expected '(' after 'if'");
        Expr condition = expression();
        consume(RIGHT_PAREN, "Expected ')' after if condition");
        Stmt thenBranch = declaration();
        Stmt elseBranch = match(ELSE) ? declaration() : null;
        return new Stmt.If(condition, thenBranch, elseBranch, line);
    }

    private Stmt whileStatement() throws ScriptSyntaxException {
        int line = previous().line();
        consume(LEFT_PAREN, "Expected '(' after 'while'");
        Expr condition = expression();
        consume(RIGHT_PAREN, "Expected ')' after while condition");
        return new Stmt.While(condition, loopBody(), line);
    }

    private Stmt forStatement() throws ScriptSyntaxException {
        int line = previous().line();
        consume(LEFT_PAREN, "Expected '(' after 'for'");

        Stmt init;
        if (match(SEMICOLON)) {
            init = null;
        } else if (match(VAR, LET, CONST)) {
            init = varDeclaration();
        } else {
            init = expressionStatement();
        }

        Expr condition = check(SEMICOLON) ? null : expression();
        consume(SEMICOLON, "Expected ';' after loop condition");
        Expr update = check(RIGHT_PAREN) ? null : expression();
        consume(RIGHT_PAREN, "Expected ')' after for clauses");

        return new Stmt.For(init, condition, update, loopBody(), line);
    }

    private Stmt loopBody() throws ScriptSyntaxException {
        loopDepth++;
        try {
            return declaration();
        } finally {
            loopDepth--;
        }
    }

    private Stmt loopJump(Stmt jump, String keyword) throws ScriptSyntaxException {
        if (loopDepth == 0) {
            throw error(previous(), "'" + keyword + "' outside of a loop");
        }
        consumeSemicolon();
        return jump;
    }

    private Stmt returnStatement() throws ScriptSyntaxException {
        Token keyword = previous();
        if (functionDepth == 0) {
            throw error(keyword, "'return' outside of a function");
        }
        Expr value = null;
        if (!check(SEMICOLON) && !check(RIGHT_BRACE) && !isAtEnd() && peek().line() == keyword.line()) {
            value = expression();
        }
        consumeSemicolon();
        return new Stmt.Return(value, keyword.line());
    }

    private List<Stmt> block() throws ScriptSyntaxException {
        List<Stmt> statements = new ArrayList<>();
        while (!check(RIGHT_BRACE) && !isAtEnd()) {
            statements.add(declaration());
        }
        consume(RIGHT_BRACE, "Expected '}' after block");
        return List.copyOf(statements);
    }

    private Stmt expressionStatement() throws ScriptSyntaxException {
        Expr expr = expression();
        consumeSemicolon();
        return new Stmt.Expression(expr, expr.line());
    }

    // ========== Expressions ==========

    private Expr expression() throws ScriptSyntaxException {
        return assignment();
    }

    private Expr assignment() throws ScriptSyntaxException {
        Expr expr = or();
        if (match(EQUAL, PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_EQUAL, PERCENT_EQUAL)) {
            Token op = previous();
            Expr value = assignment();
            requireTarget(expr, op);
            return new Expr.Assign(expr, op.lexeme(), value, op.line());
        }
        return expr;
    }

    private Expr or() throws ScriptSyntaxException {
        Expr expr = and();
        while (match(OR_OR)) {
            Token op = previous();
            expr = new Expr.Logical(expr, op.lexeme(), and(), op.line());
        }
        return expr;
    }

    private Expr and() throws ScriptSyntaxException {
        Expr expr = equality();
        while (match(AND_AND)) {
            Token op = previous();
            expr = new Expr.Logical(expr, op.lexeme(), equality(), op.line());
        }
        return expr;
    }

    private Expr equality() throws ScriptSyntaxException {
        Expr expr = comparison();
        while (match(EQUAL_EQUAL, BANG_EQUAL)) {
            Token op = previous();
            String symbol = op.type() == EQUAL_EQUAL ? "==" : "!=";
            expr = new Expr.Binary(expr, symbol, comparison(), op.line());
        }
        return expr;
    }

    private Expr comparison() throws ScriptSyntaxException {
        Expr expr = term();
        while (match(LESS, LESS_EQUAL, GREATER, GREATER_EQUAL)) {
            Token op = previous();
            expr = new Expr.Binary(expr, op.lexeme(), term(), op.line());
        }
        return expr;
    }

    private Expr term() throws ScriptSyntaxException {
        Expr expr = factor();
        while (match(PLUS, MINUS)) {
            Token op = previous();
            expr = new Expr.Binary(expr, op.lexeme(), factor(), op.line());
        }
        return expr;
    }

    private Expr factor() throws ScriptSyntaxException {
        Expr expr = unary();
        while (match(STAR, SLASH, PERCENT)) {
            Token op = previous();
            expr = new Expr.Binary(expr, op.lexeme(), unary(), op.line());
        }
        return expr;
    }

    private Expr unary() throws ScriptSyntaxException {
        if (match(BANG, MINUS, PLUS)) {
            Token op = previous();
            return new Expr.Unary(op.lexeme(), unary(), op.line());
        }
        if (match(PLUS_PLUS, MINUS_MINUS)) {
            Token op = previous();
            Expr target = unary();
            requireTarget(target, op);
            return new Expr.Update(target, op.type() == PLUS_PLUS, true, op.line());
        }
        return postfix();
    }

    private Expr postfix() throws ScriptSyntaxException {
        Expr expr = call();
        if (check(PLUS_PLUS) || check(MINUS_MINUS)) {
            Token op = peek();
            if (op.line() == previous().line()) {
                advance();
                requireTarget(expr, op);
                return new Expr.Update(expr, op.type() == PLUS_PLUS, false, op.line());
            }
        }
        return expr;
    }

    private Expr call() throws ScriptSyntaxException {
        Expr expr = primary();
        while (true) {
            if (match(LEFT_PAREN)) {
                expr = finishCall(expr);
            } else if (match(DOT)) {
                Token name = advance();
                if (name.type() != IDENTIFIER && !isKeyword(name)) {
                    throw error(name, "Expected property name after '.'");
                }
                expr = new Expr.Member(expr, name.lexeme(), name.line());
            } else if (match(LEFT_BRACKET)) {
                int line = previous().line();
                Expr index = expression();
                consume(RIGHT_BRACKET, "Expected ']' after index");
                expr = new Expr.Index(expr, index, line);
            } else {
                break;
            }
        }
        return expr;
    }

    private Expr finishCall(Expr callee) throws ScriptSyntaxException {
        int line = previous().line();
        List<Expr> arguments = new ArrayList<>();
        if (!check(RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(COMMA));
        }
        consume(RIGHT_PAREN, "Expected ')' after arguments");
        return new Expr.Call(callee, List.copyOf(arguments), line);
    }

    private Expr primary() throws ScriptSyntaxException {
        Token token = peek();
        int line = token.line();

        if (match(FALSE)) return new Expr.Literal(Boolean.FALSE, line);
        if (match(TRUE)) return new Expr.Literal(Boolean.TRUE, line);
        if (match(NULL, UNDEFINED)) return new Expr.Literal(null, line);
        if (match(NUMBER, STRING)) return new Expr.Literal(previous().literal(), line);
        if (match(IDENTIFIER)) return new Expr.Variable(previous().lexeme(), line);

        if (match(LEFT_PAREN)) {
            Expr expr = expression();
            consume(RIGHT_PAREN, "Expected ')' after expression");
            return expr;
        }

        if (match(LEFT_BRACKET)) {
            List<Expr> elements = new ArrayList<>();
            if (!check(RIGHT_BRACKET)) {
                do {
                    if (check(RIGHT_BRACKET)) break;
                    elements.add(expression());
                } while (match(COMMA));
            }
            consume(RIGHT_BRACKET, "Expected ']' after array elements");
            return new Expr.ArrayLiteral(List.copyOf(elements), line);
        }

        if (match(LEFT_BRACE)) {
            return objectLiteral(line);
        }

        if (match(FUNCTION)) {
            String name = match(IDENTIFIER) ? previous().lexeme() : null;
            List<String> params = parameters();
            List<Stmt> body = functionBody();
            return new Expr.Function(name, params, body, line);
        }

        throw error(token, token.type() == EOF ? "Unexpected end of input" : "Unexpected token '" + token.lexeme() + "'");
    }

    private Expr objectLiteral(int line) throws ScriptSyntaxException {
        List<String> keys = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        if (!check(RIGHT_BRACE)) {
            do {
                if (check(RIGHT_BRACE)) break;
                Token key = advance();
                String name;
                if (key.type() == STRING) {
                    name = (String) key.literal();
                } else if (key.type() == NUMBER) {
                    name = GuestValues.toDisplayString(key.literal());
                } else if (key.type() == IDENTIFIER || isKeyword(key)) {
                    name = key.lexeme();
                } else {
                    throw error(key, "Expected property name");
                }
                consume(COLON, "Expected ':' after property name");
                keys.add(name);
                values.add(expression());
            } while (match(COMMA));
        }
        consume(RIGHT_BRACE, "Expected '}' after object literal");
        return new Expr.ObjectLiteral(List.copyOf(keys), List.copyOf(values), line);
    }

    // ========== Helpers ==========

    private void requireTarget(Expr target, Token op) throws ScriptSyntaxException {
        if (!(target instanceof Expr.Variable || target instanceof Expr.Member || target instanceof Expr.Index)) {
            throw error(op, "Invalid assignment target");
        }
    }

    private void consumeSemicolon() throws ScriptSyntaxException {
        if (match(SEMICOLON)) return;
        if (check(RIGHT_BRACE) || isAtEnd()) return;
        if (peek().line() > previous().line()) return;
        throw error(peek(), "Expected ';' but found '" + peek().lexeme() + "'");
    }

    private static boolean isKeyword(Token token) {
        return token.type() != IDENTIFIER && token.type() != EOF
                && !token.lexeme().isEmpty() && Character.isLetter(token.lexeme().charAt(0));
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) throws ScriptSyntaxException {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        return current + 1 < tokens.size() && tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    private ScriptSyntaxException error(Token token, String message) {
        return new ScriptSyntaxException(message, token.line());
    }
}
