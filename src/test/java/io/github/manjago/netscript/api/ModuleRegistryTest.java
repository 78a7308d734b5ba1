package io.github.manjago.netscript.api;

import io.github.manjago.netscript.host.Script;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModuleRegistryTest {

    private final Script script = new Script("hack.js", "", 1.75);

    @Test
    @DisplayName("Registered module is loaded by file name")
    void load() {
        NativeScript module = ns -> null;
        ModuleRegistry registry = new ModuleRegistry().register("hack.js", module);

        assertSame(module, registry.load(script));
        assertTrue(registry.isLoaded("hack.js"));
    }

    @Test
    @DisplayName("Unknown module cannot be loaded")
    void unknown() {
        ModuleRegistry registry = new ModuleRegistry();

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> registry.load(script));
        assertTrue(e.getMessage().contains("hack.js"));
        assertFalse(registry.isLoaded("hack.js"));
    }

    @Test
    @DisplayName("Invalidation forgets loaded modules only")
    void invalidate() {
        ModuleRegistry registry = new ModuleRegistry().register("hack.js", ns -> null);
        registry.invalidate(script);
        assertEquals(0, registry.getInvalidations());

        registry.load(script);
        registry.invalidate(script);

        assertEquals(1, registry.getInvalidations());
        assertFalse(registry.isLoaded("hack.js"));
    }

    @Test
    @DisplayName("Capabilities tell timers apart")
    void capabilities() {
        assertTrue(Capability.timer("sleep").isSerializationExempt());
        assertFalse(Capability.async("hack").isSerializationExempt());
        assertTrue(Capability.async("hack").kind().isAsync());
        assertFalse(Capability.sync("print").kind().isAsync());
        assertThrows(NullPointerException.class, () -> new Capability(null, CallKind.SYNC));
    }
}
