package io.github.manjago.netscript.loop;

/**
 * The single logical thread all processes are multiplexed on.
 * <p>
 * Tasks submitted to one loop never run concurrently with each other.
 */
public interface EventLoop {

    /**
     * Run a task as soon as possible, after tasks submitted before it.
     */
    void execute(Runnable task);

    /**
     * Run a task after a delay.
     *
     * @param delayMillis delay in milliseconds, 0 or negative means "next turn"
     * @return handle that can cancel the task before it runs
     */
    Timer schedule(Runnable task, long delayMillis);

    /**
     * Current time of this loop in milliseconds.
     */
    long now();

    /**
     * Handle of a scheduled task.
     */
    interface Timer {

        /**
         * Cancel the task if it has not run yet.
         *
         * @return true if the task will no longer run
         */
        boolean cancel();

        boolean isCancelled();
    }
}
