package io.github.manjago.netscript.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * Execution state of one legacy script: call frames, status, and the host call
 * the program is waiting on while suspended.
 * <p>
 * One state belongs to exactly one process and is only touched from the
 * engine's event loop thread.
 */
public final class VmState {

    private final Deque<Frame> frames = new ArrayDeque<>();
    private final Scope globals;

    private VmStatus status = VmStatus.READY;

    /** Host call the program is suspended on, null unless SUSPENDED */
    private CompletableFuture<Object> pending;
    private String pendingName;

    /** Result of the program, set when DONE */
    private Object result;

    /** Instructions executed so far */
    private long steps;

    VmState(FunctionCode main, Scope globals) {
        this.globals = globals;
        frames.push(new Frame(main, globals));
    }

    // ========== Status ==========

    public VmStatus getStatus() {
        return status;
    }

    void setStatus(VmStatus status) {
        this.status = status;
    }

    public boolean isDone() {
        return status == VmStatus.DONE;
    }

    public boolean isSuspended() {
        return status == VmStatus.SUSPENDED;
    }

    public Object getResult() {
        return result;
    }

    void finish(Object result) {
        this.result = result;
        this.status = VmStatus.DONE;
        this.frames.clear();
    }

    // ========== Suspension ==========

    /**
     * The host call the program waits on, or null when it is not suspended.
     */
    public CompletableFuture<Object> getPending() {
        return pending;
    }

    public String getPendingName() {
        return pendingName;
    }

    void suspend(String name, CompletableFuture<Object> future) {
        this.pending = future;
        this.pendingName = name;
        this.status = VmStatus.SUSPENDED;
    }

    CompletableFuture<Object> takePending() {
        CompletableFuture<Object> future = pending;
        pending = null;
        pendingName = null;
        status = VmStatus.RUNNING;
        return future;
    }

    // ========== Frames ==========

    Frame currentFrame() {
        return frames.peek();
    }

    void pushFrame(Frame frame) {
        frames.push(frame);
    }

    Frame popFrame() {
        return frames.pop();
    }

    public int depth() {
        return frames.size();
    }

    public Scope getGlobals() {
        return globals;
    }

    /**
     * Line of the instruction about to run, or -1 when the program is done.
     */
    public int currentLine() {
        Frame frame = frames.peek();
        if (frame == null || frame.code.size() == 0) {
            return -1;
        }
        int ip = Math.min(Math.max(frame.ip - (status == VmStatus.SUSPENDED ? 1 : 0), 0), frame.code.size() - 1);
        return frame.code.at(ip).line();
    }

    // ========== Counters ==========

    public long getSteps() {
        return steps;
    }

    void incrementSteps() {
        steps++;
    }

    @Override
    public String toString() {
        return "VmState{status=" + status + ", depth=" + frames.size() + ", steps=" + steps
                + (pendingName != null ? ", waiting=" + pendingName : "") + '}';
    }
}
