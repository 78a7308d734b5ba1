package io.github.manjago.netscript.engine;

/**
 * How a process executes its script.
 */
public enum ExecutionMode {

    /** Compiled and stepped one instruction per time slice */
    LEGACY,

    /** Native code whose host calls are serialized */
    NATIVE;

    /**
     * {@code .js} and {@code .ns} files are native, everything else is legacy.
     */
    public static ExecutionMode forFilename(String filename) {
        return filename.endsWith(".js") || filename.endsWith(".ns") ? NATIVE : LEGACY;
    }
}
