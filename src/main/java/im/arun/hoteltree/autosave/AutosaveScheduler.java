package im.arun.hoteltree.autosave;

import im.arun.hoteltree.sync.SaveResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Debounces edits into infrequent saves and tracks the save status shown to the user.
 * <p>
 * Every {@link #markDirty()} restarts the quiet period; when it elapses without further edits one
 * save runs. At most one save is in flight at any time: a timer firing during a save is ignored and
 * re-armed when the save finishes, and {@link #saveNow()} during a save queues a follow-up save.
 * <pre>
 *   IDLE -> DIRTY -> SAVING -> SAVED -> IDLE (after the hold period)
 *                          \-> ERROR -> DIRTY (next edit)
 * </pre>
 */
public class AutosaveScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AutosaveScheduler.class);

    public static final Duration DEFAULT_QUIET_PERIOD = Duration.ofMillis(2000);
    public static final Duration DEFAULT_SAVED_HOLD = Duration.ofMillis(3000);

    /**
     * Persists the current document. The returned future completes when the write has finished.
     */
    @FunctionalInterface
    public interface SaveAction {
        CompletableFuture<SaveResult> save();
    }

    private final TaskTimer timer;
    private final Duration quietPeriod;
    private final Duration savedHold;
    private final SaveAction saveAction;
    private final Clock clock;
    private final List<SaveStatusListener> listeners = new CopyOnWriteArrayList<>();

    private SaveStatus status = SaveStatus.IDLE;
    private boolean dirty;
    private boolean inFlight;
    private long debounceGeneration;
    private long holdGeneration;
    private TaskTimer.ScheduledTask debounceTask;
    private TaskTimer.ScheduledTask holdTask;
    private Instant lastSavedAt;
    private List<CompletableFuture<SaveStatus>> waitingForNextSave = new ArrayList<>();
    private List<CompletableFuture<SaveStatus>> waitingForCurrentSave = new ArrayList<>();

    public AutosaveScheduler(TaskTimer timer, Duration quietPeriod, Duration savedHold, SaveAction saveAction) {
        this(timer, quietPeriod, savedHold, saveAction, Clock.systemUTC());
    }

    public AutosaveScheduler(TaskTimer timer, Duration quietPeriod, Duration savedHold, SaveAction saveAction, Clock clock) {
        this.timer = timer;
        this.quietPeriod = quietPeriod;
        this.savedHold = savedHold;
        this.saveAction = saveAction;
        this.clock = clock;
    }

    public void addListener(SaveStatusListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SaveStatusListener listener) {
        listeners.remove(listener);
    }

    public synchronized SaveStatus getStatus() {
        return status;
    }

    public synchronized boolean hasUnsavedChanges() {
        return dirty;
    }

    public synchronized Instant getLastSavedAt() {
        return lastSavedAt;
    }

    /**
     * Records an edit and restarts the quiet period.
     */
    public synchronized void markDirty() {
        dirty = true;
        cancelHold();
        if (!inFlight) {
            transition(SaveStatus.DIRTY);
        }
        restartDebounce();
    }

    /**
     * Saves immediately, bypassing the quiet period. If a save is already running the request is
     * queued behind it.
     *
     * @return completes with the status the requested save ended in
     */
    public CompletableFuture<SaveStatus> saveNow() {
        CompletableFuture<SaveStatus> outcome = new CompletableFuture<>();
        boolean start;
        synchronized (this) {
            cancelDebounce();
            waitingForNextSave.add(outcome);
            start = !inFlight;
            if (start) {
                beginSave();
            }
        }
        if (start) {
            runSave();
        }
        return outcome;
    }

    /**
     * Saves now if there are unsaved edits or a save is running; otherwise completes immediately.
     */
    public CompletableFuture<SaveStatus> flush() {
        synchronized (this) {
            if (!dirty && !inFlight) {
                return CompletableFuture.completedFuture(status);
            }
        }
        return saveNow();
    }

    @Override
    public synchronized void close() {
        cancelDebounce();
        cancelHold();
    }

    private void onQuietPeriodElapsed(long generation) {
        synchronized (this) {
            if (generation != debounceGeneration) {
                return;
            }
            debounceTask = null;
            if (!dirty || inFlight) {
                return;
            }
            beginSave();
        }
        runSave();
    }

    private void beginSave() {
        dirty = false;
        inFlight = true;
        cancelHold();
        waitingForCurrentSave.addAll(waitingForNextSave);
        waitingForNextSave = new ArrayList<>();
        transition(SaveStatus.SAVING);
    }

    private void runSave() {
        CompletableFuture<SaveResult> result;
        try {
            result = saveAction.save();
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        result.whenComplete(this::onSaveFinished);
    }

    private void onSaveFinished(SaveResult result, Throwable error) {
        SaveStatus outcome;
        List<CompletableFuture<SaveStatus>> finished;
        boolean followUp = false;

        synchronized (this) {
            inFlight = false;
            if (error != null) {
                logger.error("Save failed: {}", error.getMessage(), error);
                outcome = SaveStatus.ERROR;
            } else if (result == SaveResult.REMOTE) {
                lastSavedAt = clock.instant();
                outcome = SaveStatus.SAVED;
            } else {
                logger.warn("Save landed in local cache only ({})", result);
                outcome = SaveStatus.ERROR;
            }
            finished = waitingForCurrentSave;
            waitingForCurrentSave = new ArrayList<>();

            if (!waitingForNextSave.isEmpty()) {
                transition(outcome);
                beginSave();
                followUp = true;
            } else if (dirty) {
                transition(outcome == SaveStatus.SAVED ? SaveStatus.DIRTY : SaveStatus.ERROR);
                if (debounceTask == null) {
                    restartDebounce();
                }
            } else {
                transition(outcome);
                if (outcome == SaveStatus.SAVED) {
                    scheduleHold();
                }
            }
        }

        finished.forEach(waiter -> waiter.complete(outcome));
        if (followUp) {
            runSave();
        }
    }

    private void restartDebounce() {
        cancelDebounce();
        long generation = debounceGeneration;
        debounceTask = timer.schedule(quietPeriod, () -> onQuietPeriodElapsed(generation));
    }

    private void cancelDebounce() {
        debounceGeneration++;
        if (debounceTask != null) {
            debounceTask.cancel();
            debounceTask = null;
        }
    }

    private void scheduleHold() {
        cancelHold();
        long generation = holdGeneration;
        holdTask = timer.schedule(savedHold, () -> {
            synchronized (this) {
                if (generation == holdGeneration && status == SaveStatus.SAVED && !dirty) {
                    holdTask = null;
                    transition(SaveStatus.IDLE);
                }
            }
        });
    }

    private void cancelHold() {
        holdGeneration++;
        if (holdTask != null) {
            holdTask.cancel();
            holdTask = null;
        }
    }

    private void transition(SaveStatus next) {
        if (status == next) {
            return;
        }
        SaveStatus previous = status;
        status = next;
        logger.debug("Save status {} -> {}", previous, next);
        for (SaveStatusListener listener : listeners) {
            listener.onStatusChange(previous, next);
        }
    }
}
