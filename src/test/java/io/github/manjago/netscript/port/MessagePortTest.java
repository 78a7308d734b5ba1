package io.github.manjago.netscript.port;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessagePortTest {

    @Nested
    @DisplayName("Message port")
    class Port {

        @Test
        @DisplayName("Empty port reads the null marker")
        void emptyRead() {
            MessagePort port = new MessagePort(1, 3);
            assertEquals(MessagePort.NULL_PORT_DATA, port.read());
            assertEquals(MessagePort.NULL_PORT_DATA, port.peek());
        }

        @Test
        @DisplayName("Values come out in write order")
        void fifo() {
            MessagePort port = new MessagePort(1, 3);
            port.write("a");
            port.write(2.0);
            assertEquals("a", port.peek());
            assertEquals("a", port.read());
            assertEquals(2.0, port.read());
            assertTrue(port.isEmpty());
        }

        @Test
        @DisplayName("Writing to a full port evicts the oldest value")
        void eviction() {
            MessagePort port = new MessagePort(1, 2);
            assertNull(port.write(1.0));
            assertNull(port.write(2.0));
            assertEquals(1.0, port.write(3.0));
            assertEquals(2, port.size());
            assertEquals(2.0, port.read());
        }

        @Test
        @DisplayName("tryWrite refuses when full")
        void tryWrite() {
            MessagePort port = new MessagePort(1, 1);
            assertTrue(port.tryWrite("x"));
            assertTrue(port.isFull());
            assertFalse(port.tryWrite("y"));
            assertEquals("x", port.peek());
        }
    }

    @Nested
    @DisplayName("Port table")
    class Table {

        @Test
        @DisplayName("Ports are numbered from 1")
        void numbering() {
            PortTable table = new PortTable(20, 50);
            assertEquals(1, table.get(1).getNumber());
            assertEquals(20, table.get(20).getNumber());
            assertEquals(20, table.count());
        }

        @Test
        @DisplayName("Out of range port numbers are rejected")
        void outOfRange() {
            PortTable table = new PortTable(20, 50);
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> table.get(0));
            assertEquals("Invalid port number 0, must be 1-20", e.getMessage());
            assertThrows(IllegalArgumentException.class, () -> table.get(21));
        }

        @Test
        @DisplayName("clearAll empties ports but keeps them")
        void clearAll() {
            PortTable table = new PortTable(2, 5);
            MessagePort port = table.get(2);
            port.write("x");

            table.clearAll();

            assertSame(port, table.get(2));
            assertTrue(port.isEmpty());
        }
    }
}
