package io.github.manjago.netscript.engine;

/**
 * Listener for process events.
 * 
 * Implement this interface to react to processes starting and stopping,
 * and to show messages meant for the player.
 */
public interface EngineListener {

    /**
     * Called after a process is registered, before its script runs.
     */
    default void onStart(WorkerScript ws) {}

    /**
     * Called once per process, after its teardown.
     */
    default void onExit(WorkerScript ws, ExitStatus status) {}

    /**
     * Called with a message for the player (crash reports, rejected starts).
     */
    default void onUserMessage(String message) {}

    /**
     * Called with text a script printed to the terminal.
     */
    default void onTerminalOutput(String text) {}

    /**
     * No-op listener that does nothing.
     */
    EngineListener NOOP = new EngineListener() {};
}
