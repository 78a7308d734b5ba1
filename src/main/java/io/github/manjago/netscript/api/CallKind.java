package io.github.manjago.netscript.api;

/**
 * How a host function returns to the script.
 */
public enum CallKind {
    /** Returns a value immediately */
    SYNC,

    /** Returns a CompletionStage for a multi-tick action */
    ASYNC,

    /** Sleep-style timer; may overlap other calls of the same process */
    TIMER;

    public boolean isAsync() {
        return this != SYNC;
    }
}
