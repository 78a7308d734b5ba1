package io.github.manjago.netscript.port;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded FIFO channel scripts use to signal each other.
 */
public final class MessagePort {

    /** Returned by read and peek when the port is empty */
    public static final String NULL_PORT_DATA = "NULL PORT DATA";

    private final int number;
    private final int capacity;
    private final Deque<Object> data = new ArrayDeque<>();

    public MessagePort(int number, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Port capacity must be >= 1: " + capacity);
        }
        this.number = number;
        this.capacity = capacity;
    }

    public int getNumber() {
        return number;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Append a value, dropping the oldest one when the port is full.
     *
     * @return the dropped value, or null if nothing was dropped
     */
    public Object write(Object value) {
        data.addLast(value);
        return data.size() > capacity ? data.pollFirst() : null;
    }

    /**
     * Append a value only if the port has room.
     */
    public boolean tryWrite(Object value) {
        if (data.size() >= capacity) {
            return false;
        }
        data.addLast(value);
        return true;
    }

    public Object read() {
        return data.isEmpty() ? NULL_PORT_DATA : data.pollFirst();
    }

    public Object peek() {
        return data.isEmpty() ? NULL_PORT_DATA : data.peekFirst();
    }

    public void clear() {
        data.clear();
    }

    public int size() {
        return data.size();
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    public boolean isFull() {
        return data.size() >= capacity;
    }
}
