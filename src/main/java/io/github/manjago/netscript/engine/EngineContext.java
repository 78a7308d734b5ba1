package io.github.manjago.netscript.engine;

import io.github.manjago.netscript.port.PortTable;

/**
 * Process-wide state: the live-process registry and the message ports.
 * <p>
 * Created once per engine and reset, not rebuilt, on a full restart.
 */
public final class EngineContext {

    private final ProcessRegistry registry = new ProcessRegistry();
    private final PortTable ports;

    public EngineContext(int portCount, int portCapacity) {
        this.ports = new PortTable(portCount, portCapacity);
    }

    public ProcessRegistry getRegistry() {
        return registry;
    }

    public PortTable getPorts() {
        return ports;
    }

    /**
     * Forget all processes and empty all ports.
     */
    public void reset() {
        registry.clear();
        ports.clearAll();
    }
}
