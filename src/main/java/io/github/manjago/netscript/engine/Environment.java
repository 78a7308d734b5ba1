package io.github.manjago.netscript.engine;

import io.github.manjago.netscript.api.Binding;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Functions visible to one process, the stop flag, and the name of the
 * host call currently in flight.
 */
public final class Environment {

    private final Map<String, Binding> bindings = new LinkedHashMap<>();
    private volatile boolean stopFlag;
    private String runningFn;

    /**
     * Install a binding; a later binding with the same name replaces an earlier one.
     */
    void install(Binding binding) {
        bindings.put(binding.name(), binding);
    }

    public Optional<Binding> get(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    public Collection<Binding> bindings() {
        return Collections.unmodifiableCollection(bindings.values());
    }

    // ========== Stop flag ==========

    public boolean isStopRequested() {
        return stopFlag;
    }

    public void requestStop() {
        this.stopFlag = true;
    }

    // ========== In-flight call ==========

    public String getRunningFn() {
        return runningFn;
    }

    void setRunningFn(String runningFn) {
        this.runningFn = runningFn;
    }
}
