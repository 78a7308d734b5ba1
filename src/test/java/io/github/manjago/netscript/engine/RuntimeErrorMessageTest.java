package io.github.manjago.netscript.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeErrorMessageTest {

    @Nested
    @DisplayName("Wire format")
    class WireFormat {

        @Test
        @DisplayName("Built message parses into its fields")
        void buildAndParse() {
            String text = RuntimeErrorMessage.build("home", "hack.script", "oops");
            assertEquals("RUNTIME ERROR|home|hack.script|oops", text);

            RuntimeErrorMessage parsed = RuntimeErrorMessage.parse(text).orElseThrow();
            assertEquals("home", parsed.host());
            assertEquals("hack.script", parsed.script());
            assertEquals("oops", parsed.message());
        }

        @Test
        @DisplayName("Separator inside a field is replaced")
        void sanitized() {
            String text = RuntimeErrorMessage.build("home", "a.script", "x | y");
            assertTrue(RuntimeErrorMessage.isValid(text));
            assertEquals("x / y", RuntimeErrorMessage.parse(text).orElseThrow().message());
        }

        @Test
        @DisplayName("Wrong field count or tag is invalid")
        void invalid() {
            assertEquals(Optional.empty(), RuntimeErrorMessage.parse("RUNTIME ERROR|home|a.script"));
            assertEquals(Optional.empty(), RuntimeErrorMessage.parse("ERROR|home|a.script|m"));
            assertEquals(Optional.empty(), RuntimeErrorMessage.parse("RUNTIME ERROR|a|b|c|d"));
            assertFalse(RuntimeErrorMessage.isValid(null));
        }
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("Rendered text names script, host and args")
        void withArgs() {
            RuntimeErrorMessage error = new RuntimeErrorMessage("home", "hack.script", "boom");
            assertEquals("RUNTIME ERROR\nhack.script@home\nArgs: [\"n00dles\", 2]\n\nboom",
                    error.render(List.of("n00dles", 2.0)));
        }

        @Test
        @DisplayName("Args line is left out when there are none")
        void withoutArgs() {
            RuntimeErrorMessage error = new RuntimeErrorMessage("home", "hack.script", "boom");
            assertEquals("RUNTIME ERROR\nhack.script@home\n\nboom", error.render(List.of()));
        }
    }
}
