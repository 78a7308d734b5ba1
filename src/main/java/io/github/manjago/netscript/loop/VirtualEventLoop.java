package io.github.manjago.netscript.loop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.PriorityQueue;

/**
 * Deterministic event loop driven by virtual time.
 * <p>
 * Nothing runs until the owner calls {@link #runUntilIdle()} or
 * {@link #runFor(long)}; tasks then run on the calling thread. Timers fire in
 * due-time order, ties in submission order.
 */
public final class VirtualEventLoop implements EventLoop {

    private static final Logger log = LoggerFactory.getLogger(VirtualEventLoop.class);

    private final Deque<Runnable> immediate = new ArrayDeque<>();
    private final PriorityQueue<ScheduledTask> timers = new PriorityQueue<>(
            Comparator.comparingLong((ScheduledTask t) -> t.due).thenComparingLong(t -> t.sequence));

    private long now;
    private long sequence;
    private long executed;

    @Override
    public void execute(Runnable task) {
        immediate.add(task);
    }

    @Override
    public Timer schedule(Runnable task, long delayMillis) {
        ScheduledTask scheduled = new ScheduledTask(task, now + Math.max(0, delayMillis), sequence++);
        timers.add(scheduled);
        return scheduled;
    }

    @Override
    public long now() {
        return now;
    }

    // ========== Driving ==========

    /**
     * Run every task, advancing virtual time to each timer, until nothing is left.
     *
     * @param maxTasks safety limit on the number of tasks to run
     * @return number of tasks run
     */
    public long runUntilIdle(long maxTasks) {
        long count = 0;
        while (count < maxTasks) {
            if (!immediate.isEmpty()) {
                run(immediate.poll());
                count++;
                continue;
            }
            ScheduledTask next = pollTimer(Long.MAX_VALUE);
            if (next == null) {
                break;
            }
            now = Math.max(now, next.due);
            run(next.task);
            count++;
        }
        return count;
    }

    public long runUntilIdle() {
        return runUntilIdle(Long.MAX_VALUE);
    }

    /**
     * Run tasks that become due within the next {@code millis} of virtual time,
     * then set the clock to the end of the window.
     *
     * @return number of tasks run
     */
    public long runFor(long millis) {
        long deadline = now + millis;
        long count = 0;
        while (true) {
            if (!immediate.isEmpty()) {
                run(immediate.poll());
                count++;
                continue;
            }
            ScheduledTask next = pollTimer(deadline);
            if (next == null) {
                break;
            }
            now = Math.max(now, next.due);
            run(next.task);
            count++;
        }
        now = deadline;
        return count;
    }

    public int pendingTasks() {
        timers.removeIf(t -> t.cancelled);
        return immediate.size() + timers.size();
    }

    public long getExecutedCount() {
        return executed;
    }

    private ScheduledTask pollTimer(long deadline) {
        while (!timers.isEmpty()) {
            ScheduledTask head = timers.peek();
            if (head.cancelled) {
                timers.poll();
                continue;
            }
            if (head.due > deadline) {
                return null;
            }
            return timers.poll();
        }
        return null;
    }

    private void run(Runnable task) {
        executed++;
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Event loop task failed", e);
        }
    }

    private static final class ScheduledTask implements Timer {
        final Runnable task;
        final long due;
        final long sequence;
        boolean cancelled;

        ScheduledTask(Runnable task, long due, long sequence) {
            this.task = task;
            this.due = due;
            this.sequence = sequence;
        }

        @Override
        public boolean cancel() {
            boolean wasPending = !cancelled;
            cancelled = true;
            return wasPending;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
