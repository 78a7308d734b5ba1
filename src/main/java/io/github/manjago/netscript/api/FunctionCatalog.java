package io.github.manjago.netscript.api;

import io.github.manjago.netscript.engine.WorkerScript;

import java.util.List;

/**
 * Game functions available to a process, on top of the engine's own.
 */
@FunctionalInterface
public interface FunctionCatalog {

    FunctionCatalog EMPTY = ws -> List.of();

    /**
     * Bindings visible to a process. Called once, before the process runs.
     */
    List<Binding> bindingsFor(WorkerScript ws);
}
