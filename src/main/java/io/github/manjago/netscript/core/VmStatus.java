package io.github.manjago.netscript.core;

/**
 * Execution status of a legacy script program.
 */
public enum VmStatus {

    /** Loaded, no instruction executed yet. */
    READY,

    /** Executing instructions. */
    RUNNING,

    /** Waiting for an asynchronous host call to settle. */
    SUSPENDED,

    /** Program ran to completion. */
    DONE
}
