package io.github.manjago.netscript.engine;

import java.util.concurrent.CompletionException;

/**
 * Why a process failed, decided where the failure happened.
 */
public sealed interface ProcessFailure {

    /**
     * A fault inside the engine or a loaded module. Always a bug.
     */
    record NativeFault(Throwable cause) implements ProcessFailure {}

    /**
     * A runtime error in the {@code TAG|host|script|message} format.
     */
    record RuntimeError(String message) implements ProcessFailure {}

    /**
     * The process had already been stopped by another path.
     */
    record AlreadyTerminated(WorkerScript workerScript) implements ProcessFailure {}

    /**
     * Anything else the completion future failed with.
     */
    record Unrecognized(Object payload) implements ProcessFailure {}

    /**
     * Recover the failure carried by a completion exception.
     */
    static ProcessFailure of(Throwable t) {
        Throwable cause = t;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ProcessFailedException pfe) {
            return pfe.getFailure();
        }
        return new Unrecognized(cause);
    }
}
