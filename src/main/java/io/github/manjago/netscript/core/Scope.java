package io.github.manjago.netscript.core;

import java.util.HashMap;
import java.util.Map;

/**
 * Variable bindings of one function activation, chained to the enclosing scope.
 */
public final class Scope {

    private final Map<String, Object> vars = new HashMap<>();
    private final Scope parent;

    public Scope(Scope parent) {
        this.parent = parent;
    }

    public Scope getParent() {
        return parent;
    }

    public void define(String name, Object value) {
        vars.put(name, value);
    }

    public boolean hasOwn(String name) {
        return vars.containsKey(name);
    }

    /**
     * @throws ScriptRuntimeException if the name is not bound anywhere in the chain
     */
    public Object get(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            if (s.vars.containsKey(name)) {
                return s.vars.get(name);
            }
        }
        throw new ScriptRuntimeException("ReferenceError: " + name + " is not defined");
    }

    /**
     * Assign to the nearest binding; unbound names become globals.
     */
    public void assign(String name, Object value) {
        Scope s = this;
        while (true) {
            if (s.vars.containsKey(name) || s.parent == null) {
                s.vars.put(name, value);
                return;
            }
            s = s.parent;
        }
    }
}
