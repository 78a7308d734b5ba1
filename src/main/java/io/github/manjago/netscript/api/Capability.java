package io.github.manjago.netscript.api;

import java.util.Objects;

/**
 * Descriptor of one function exposed to scripts.
 *
 * @param name name scripts call it by
 * @param kind how it returns
 */
public record Capability(String name, CallKind kind) {

    public Capability {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    public static Capability sync(String name) {
        return new Capability(name, CallKind.SYNC);
    }

    public static Capability async(String name) {
        return new Capability(name, CallKind.ASYNC);
    }

    public static Capability timer(String name) {
        return new Capability(name, CallKind.TIMER);
    }

    /**
     * Whether calls may overlap other in-flight calls of the same process.
     */
    public boolean isSerializationExempt() {
        return kind == CallKind.TIMER;
    }
}
