package io.github.manjago.netscript.engine;

import io.github.manjago.netscript.host.Host;
import io.github.manjago.netscript.host.RunningScript;
import io.github.manjago.netscript.loop.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A live process: one running instance of a script.
 * <p>
 * Every path that ends the process settles {@link #getCompletion()}; only the
 * first settlement counts.
 */
public class WorkerScript {

    private static final Logger log = LoggerFactory.getLogger(WorkerScript.class);

    /** Parent pid of processes started from outside any script */
    public static final int NO_PARENT = -1;

    private final int pid;
    private final RunningScript scriptRef;
    private final Host host;
    private final String code;
    private final ExecutionMode mode;
    private final double ramUsage;
    private final int parentPid;
    private final long startTime;
    private final Environment env = new Environment();
    private final CompletableFuture<WorkerScript> completion = new CompletableFuture<>();

    // Log
    private final int logCapacity;
    private final Deque<String> logs = new ArrayDeque<>();

    // Lifecycle
    private boolean running;
    private String errorMessage;
    private boolean tornDown;
    private ExitStatus exitStatus;

    // Pending sleep
    private EventLoop.Timer delay;
    private CompletableFuture<Object> delayFuture;

    /**
     * @param pid         process id
     * @param scriptRef   record this process runs
     * @param host        host the process runs on
     * @param code        script source
     * @param ramUsage    RAM reserved for the process, released at teardown
     * @param parentPid   pid of the starting process, or {@link #NO_PARENT}
     * @param logCapacity maximum entries in the process log
     * @param startTime   event loop time of the start
     */
    public WorkerScript(int pid, RunningScript scriptRef, Host host, String code, double ramUsage,
                        int parentPid, int logCapacity, long startTime) {
        this.pid = pid;
        this.scriptRef = scriptRef;
        this.host = host;
        this.code = code;
        this.mode = ExecutionMode.forFilename(scriptRef.getFilename());
        this.ramUsage = ramUsage;
        this.parentPid = parentPid;
        this.logCapacity = logCapacity;
        this.startTime = startTime;
        this.running = true;
    }

    // ========== Identity ==========

    public int getPid() {
        return pid;
    }

    public String getName() {
        return scriptRef.getFilename();
    }

    public RunningScript getScriptRef() {
        return scriptRef;
    }

    public Host getHost() {
        return host;
    }

    public List<Object> getArgs() {
        return scriptRef.getArgs();
    }

    public String getCode() {
        return code;
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public double getRamUsage() {
        return ramUsage;
    }

    public int getParentPid() {
        return parentPid;
    }

    public long getStartTime() {
        return startTime;
    }

    public Environment getEnv() {
        return env;
    }

    // ========== Lifecycle ==========

    public boolean isRunning() {
        return running;
    }

    void setRunning(boolean running) {
        this.running = running;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean isTornDown() {
        return tornDown;
    }

    /**
     * Status the process ended with, null while it is live.
     */
    public ExitStatus getExitStatus() {
        return exitStatus;
    }

    void markTornDown(ExitStatus status) {
        this.tornDown = true;
        this.exitStatus = status;
    }

    /**
     * Future settled once when the process ends: normally on success,
     * with a {@link ProcessFailedException} otherwise.
     */
    public CompletableFuture<WorkerScript> getCompletion() {
        return completion;
    }

    /**
     * Settle the process as finished.
     */
    void finish() {
        completion.complete(this);
    }

    /**
     * Settle the process as failed.
     */
    void fail(ProcessFailure failure) {
        if (failure instanceof ProcessFailure.RuntimeError re && errorMessage == null) {
            errorMessage = re.message();
        }
        completion.completeExceptionally(new ProcessFailedException(failure));
    }

    /**
     * Fail the process at once and ask it to stop, whatever the script does next.
     */
    void abort(ProcessFailure failure) {
        env.requestStop();
        fail(failure);
    }

    // ========== Sleep ==========

    void setDelay(EventLoop.Timer timer, CompletableFuture<Object> future) {
        this.delay = timer;
        this.delayFuture = future;
    }

    void clearDelay(CompletableFuture<Object> future) {
        if (delayFuture == future) {
            delay = null;
            delayFuture = null;
        }
    }

    /**
     * Cancel a pending sleep and reject it with {@link ScriptKilledException}.
     *
     * @return true if a sleep was pending
     */
    boolean cancelDelay() {
        if (delay == null) {
            return false;
        }
        delay.cancel();
        CompletableFuture<Object> future = delayFuture;
        delay = null;
        delayFuture = null;
        future.completeExceptionally(new ScriptKilledException(this));
        return true;
    }

    // ========== Log ==========

    /**
     * Append to the process log, dropping the oldest entry when full.
     *
     * @param fn      function the entry is about, may be empty
     * @param message text
     */
    public void log(String fn, String message) {
        String entry = fn == null || fn.isEmpty() ? message : fn + ": " + message;
        if (logs.size() >= logCapacity) {
            logs.pollFirst();
        }
        logs.addLast(entry);
        log.debug("[{} pid={}] {}", getName(), pid, entry);
    }

    public List<String> getLogs() {
        return new ArrayList<>(logs);
    }

    @Override
    public String toString() {
        return "WorkerScript{pid=" + pid + ", " + getName() + "@" + host.getHostname()
                + ", " + mode + (running ? ", running" : "") + '}';
    }
}
