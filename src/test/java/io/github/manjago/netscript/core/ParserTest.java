package io.github.manjago.netscript.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    @Nested
    @DisplayName("Imports")
    class Imports {

        @Test
        @DisplayName("Named import lists its functions")
        void namedImport() throws Exception {
            Program program = Parser.parse("import { a, b } from \"lib.script\";\nprint(1)");
            Stmt.Import declaration = program.imports().get(0);
            assertFalse(declaration.isNamespace());
            assertEquals(java.util.List.of("a", "b"), declaration.names());
            assertEquals("lib.script", declaration.source());
        }

        @Test
        @DisplayName("Namespace import keeps its alias")
        void namespaceImport() throws Exception {
            Stmt.Import declaration = Parser.parse("import * as lib from './lib.script'").imports().get(0);
            assertTrue(declaration.isNamespace());
            assertEquals("lib", declaration.namespace());
        }

        @Test
        @DisplayName("Span covers the declaration including its semicolon")
        void importSpan() throws Exception {
            String source = "import { a } from 'x';\nvar y = 1";
            Stmt.Import declaration = Parser.parse(source).imports().get(0);
            assertEquals("import { a } from 'x';", declaration.span().slice(source));
        }

        @Test
        @DisplayName("Import inside a function is a syntax error")
        void nestedImport() {
            assertThrows(ScriptSyntaxException.class,
                    () -> Parser.parse("function f() {\n import { a } from 'x'\n}"));
        }

        @Test
        @DisplayName("Empty named import is rejected")
        void emptyImport() {
            assertThrows(ScriptSyntaxException.class, () -> Parser.parse("import { } from 'x'"));
        }
    }

    @Nested
    @DisplayName("Statements")
    class Statements {

        @Test
        @DisplayName("Semicolons are optional at line ends")
        void optionalSemicolons() throws Exception {
            Program program = Parser.parse("var a = 1\nvar b = 2\nprint(a + b)");
            assertEquals(3, program.body().size());
        }

        @Test
        @DisplayName("Two statements on one line need a semicolon")
        void missingSemicolon() {
            ScriptSyntaxException e = assertThrows(ScriptSyntaxException.class,
                    () -> Parser.parse("var a = 1 var b = 2"));
            assertEquals(1, e.getLine());
        }

        @Test
        @DisplayName("Top-level functions are listed in source order")
        void functionsInOrder() throws Exception {
            Program program = Parser.parse("function b() {}\nvar x = 1\nfunction a() {}");
            assertEquals("b", program.functions().get(0).name());
            assertEquals("a", program.functions().get(1).name());
        }

        @Test
        @DisplayName("return outside a function is rejected")
        void topLevelReturn() {
            assertThrows(ScriptSyntaxException.class, () -> Parser.parse("return 1"));
        }

        @Test
        @DisplayName("break outside a loop is rejected")
        void breakOutsideLoop() {
            assertThrows(ScriptSyntaxException.class, () -> Parser.parse("if (true) { break }"));
        }

        @Test
        @DisplayName("Literal is not an assignment target")
        void invalidTarget() {
            assertThrows(ScriptSyntaxException.class, () -> Parser.parse("1 = 2"));
        }

        @Test
        @DisplayName("Error reports the line of the bad token")
        void errorLine() {
            ScriptSyntaxException e = assertThrows(ScriptSyntaxException.class,
                    () -> Parser.parse("var a = 1\nvar b = (2\n"));
            assertTrue(e.getLine() >= 2);
        }
    }
}
