package im.arun.hoteltree.autosave;

import java.time.Duration;

/**
 * Runs tasks after a delay. Production code uses {@link ExecutorTaskTimer}; tests substitute a
 * clock they advance by hand.
 */
public interface TaskTimer {

    ScheduledTask schedule(Duration delay, Runnable task);

    interface ScheduledTask {
        /** Prevents the task from running if it has not started yet. */
        void cancel();
    }
}
