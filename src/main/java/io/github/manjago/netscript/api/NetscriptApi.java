package io.github.manjago.netscript.api;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * What a native script sees of the engine: its arguments and the functions
 * exposed to it.
 * <p>
 * Every call goes through the process's call serializer: only one call may be
 * outstanding at a time, except {@code sleep}.
 */
public interface NetscriptApi {

    List<Object> args();

    int pid();

    /**
     * Call an exposed function.
     *
     * @return the raw result; a CompletionStage for ASYNC and TIMER functions
     * @throws io.github.manjago.netscript.core.ScriptRuntimeException if no such function exists
     */
    Object call(String name, Object... args);

    /**
     * Call an ASYNC function and adapt its result to a future.
     */
    CompletableFuture<Object> callAsync(String name, Object... args);

    /**
     * Sleep for the given time. Never counts as a concurrent call.
     */
    CompletableFuture<Object> sleep(long millis);
}
