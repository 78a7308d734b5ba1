package io.github.manjago.netscript.api;

import java.util.Objects;

/**
 * A capability and the function implementing it.
 */
public record Binding(Capability capability, HostFunction function) {

    public Binding {
        Objects.requireNonNull(capability, "capability");
        Objects.requireNonNull(function, "function");
    }

    public String name() {
        return capability.name();
    }

    public CallKind kind() {
        return capability.kind();
    }
}
