package im.arun.hoteltree.autosave;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link TaskTimer} driven by a virtual clock that tests advance explicitly.
 */
public class ManualTaskTimer implements TaskTimer {

    private final List<Entry> entries = new ArrayList<>();
    private long now;
    private long sequence;

    @Override
    public synchronized ScheduledTask schedule(Duration delay, Runnable task) {
        Entry entry = new Entry(now + delay.toMillis(), sequence++, task);
        entries.add(entry);
        return () -> entry.cancelled = true;
    }

    /**
     * Moves the clock forward, running every task that falls due on the way in due order. Tasks
     * scheduled by running tasks are picked up if they fall inside the window.
     */
    public void advance(Duration duration) {
        long target = now + duration.toMillis();
        while (true) {
            Entry next;
            synchronized (this) {
                next = entries.stream()
                        .filter(entry -> !entry.cancelled && entry.dueAt <= target)
                        .min(Comparator.comparingLong((Entry entry) -> entry.dueAt).thenComparingLong(entry -> entry.sequence))
                        .orElse(null);
                if (next == null) {
                    now = target;
                    return;
                }
                entries.remove(next);
                now = next.dueAt;
            }
            next.task.run();
        }
    }

    public synchronized int pendingTasks() {
        return (int) entries.stream().filter(entry -> !entry.cancelled).count();
    }

    private static final class Entry {
        final long dueAt;
        final long sequence;
        final Runnable task;
        volatile boolean cancelled;

        Entry(long dueAt, long sequence, Runnable task) {
            this.dueAt = dueAt;
            this.sequence = sequence;
            this.task = task;
        }
    }
}
