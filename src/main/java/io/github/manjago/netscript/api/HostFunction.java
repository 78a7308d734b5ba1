package io.github.manjago.netscript.api;

import io.github.manjago.netscript.engine.WorkerScript;

import java.util.List;

/**
 * Implementation of a function exposed to scripts.
 * <p>
 * ASYNC and TIMER functions return a {@link java.util.concurrent.CompletionStage}
 * that settles on the engine's event loop. Faults the script should see are
 * thrown as {@link io.github.manjago.netscript.core.ScriptRuntimeException}.
 */
@FunctionalInterface
public interface HostFunction {

    /**
     * @param caller process making the call
     * @param args   arguments as plain Java values
     * @return result
     */
    Object invoke(WorkerScript caller, List<Object> args);
}
