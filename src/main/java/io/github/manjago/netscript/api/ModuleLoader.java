package io.github.manjago.netscript.api;

import io.github.manjago.netscript.host.Script;

/**
 * Turns a native-format script file into runnable code.
 */
public interface ModuleLoader {

    /**
     * @throws IllegalStateException if the script cannot be loaded
     */
    NativeScript load(Script script);

    /**
     * Forget any cached module of the script so the next load sees current code.
     */
    void invalidate(Script script);
}
