package io.github.manjago.netscript.engine;

/**
 * Thrown into a script whose process was asked to stop.
 */
public class ScriptKilledException extends RuntimeException {

    private final transient WorkerScript workerScript;

    public ScriptKilledException(WorkerScript workerScript) {
        super("Script " + workerScript.getName() + " (pid " + workerScript.getPid() + ") was killed", null, false, false);
        this.workerScript = workerScript;
    }

    public WorkerScript getWorkerScript() {
        return workerScript;
    }
}
