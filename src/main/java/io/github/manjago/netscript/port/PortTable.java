package io.github.manjago.netscript.port;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Numbered message ports {@code 1..count}.
 */
public final class PortTable {

    private final List<MessagePort> ports;

    public PortTable(int count, int capacity) {
        List<MessagePort> list = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            list.add(new MessagePort(i, capacity));
        }
        this.ports = Collections.unmodifiableList(list);
    }

    /**
     * @param number port number starting at 1
     * @throws IllegalArgumentException if there is no such port
     */
    public MessagePort get(int number) {
        if (number < 1 || number > ports.size()) {
            throw new IllegalArgumentException("Invalid port number " + number + ", must be 1-" + ports.size());
        }
        return ports.get(number - 1);
    }

    public int count() {
        return ports.size();
    }

    /**
     * Empty every port, keeping the ports themselves.
     */
    public void clearAll() {
        ports.forEach(MessagePort::clear);
    }
}
