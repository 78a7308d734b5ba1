package io.github.manjago.netscript.engine;

/**
 * Why a process stopped.
 */
public enum ExitStatus {
    /** Reached the end of its script, or called exit() */
    FINISHED,

    /** Stopped by kill, killAll or a stop request */
    KILLED,

    /** Failed with a runtime error or an internal fault */
    CRASHED,

    /** Imports or syntax prevented it from running at all */
    FAILED_TO_START
}
