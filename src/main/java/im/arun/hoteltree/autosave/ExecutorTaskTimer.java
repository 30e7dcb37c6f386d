package im.arun.hoteltree.autosave;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskTimer} on a single daemon thread.
 */
public class ExecutorTaskTimer implements TaskTimer, AutoCloseable {
    private final ScheduledExecutorService scheduler;

    public ExecutorTaskTimer() {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "hoteltree-autosave-timer");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ScheduledTask schedule(Duration delay, Runnable task) {
        ScheduledFuture<?> future = scheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
