package io.github.manjago.netscript.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GuestValuesTest {

    @Nested
    @DisplayName("Conversion")
    class Conversion {

        @Test
        @DisplayName("Host numbers become doubles, recursively")
        void toGuest() {
            Object guest = GuestValues.toGuest(List.of(1, 2L, Map.of("k", 3)));
            assertEquals(List.of(1.0, 2.0, Map.of("k", 3.0)), guest);
        }

        @Test
        @DisplayName("Java arrays become guest arrays")
        void arrays() {
            assertEquals(List.of(1.0, 2.0), GuestValues.toGuest(new int[] {1, 2}));
        }

        @Test
        @DisplayName("toNative copies guest arrays")
        void toNativeCopies() {
            List<Object> array = new ArrayList<>(List.of(1.0));
            Object copy = GuestValues.toNative(array);
            array.add(2.0);
            assertEquals(List.of(1.0), copy);
        }
    }

    @Nested
    @DisplayName("Operators")
    class Operators {

        @Test
        @DisplayName("Plus concatenates when either side is a string")
        void plus() {
            assertEquals("a1", GuestValues.binary("+", "a", 1.0));
            assertEquals(3.0, GuestValues.binary("+", 1.0, 2.0));
        }

        @Test
        @DisplayName("Loose equality converts numbers and strings")
        void looseEquality() {
            assertTrue(GuestValues.looseEquals(1.0, "1"));
            assertTrue(GuestValues.looseEquals(null, null));
            assertFalse(GuestValues.looseEquals(null, 0.0));
        }

        @Test
        @DisplayName("Comparisons with NaN are false")
        void nanComparison() {
            assertEquals(false, GuestValues.binary("<", "abc", 1.0));
            assertEquals(true, GuestValues.binary("<", "abc", "abd"));
        }

        @Test
        @DisplayName("Truthiness")
        void truthiness() {
            assertFalse(GuestValues.isTruthy(0.0));
            assertFalse(GuestValues.isTruthy(""));
            assertFalse(GuestValues.isTruthy(null));
            assertTrue(GuestValues.isTruthy(List.of()));
        }
    }

    @Nested
    @DisplayName("Display")
    class Display {

        @Test
        @DisplayName("Whole numbers print without fraction")
        void numbers() {
            assertEquals("42", GuestValues.toDisplayString(42.0));
            assertEquals("0.5", GuestValues.toDisplayString(0.5));
            assertEquals("NaN", GuestValues.toDisplayString(Double.NaN));
        }

        @Test
        @DisplayName("Arrays print comma-joined")
        void arrays() {
            assertEquals("1,a,", GuestValues.toDisplayString(java.util.Arrays.asList(1.0, "a", null)));
        }
    }

    @Nested
    @DisplayName("Members")
    class Members {

        @Test
        @DisplayName("Reading a property of null is a type error")
        void nullMember() {
            assertThrows(ScriptRuntimeException.class, () -> GuestValues.getMember(null, "x"));
        }

        @Test
        @DisplayName("Index assignment grows the array")
        void setIndexGrows() {
            List<Object> array = new ArrayList<>();
            GuestValues.setIndex(array, 2.0, "x");
            assertEquals(java.util.Arrays.asList(null, null, "x"), array);
        }

        @Test
        @DisplayName("Negative index assignment is a range error")
        void negativeIndex() {
            assertThrows(ScriptRuntimeException.class,
                    () -> GuestValues.setIndex(new ArrayList<>(), -1.0, "x"));
        }
    }
}
