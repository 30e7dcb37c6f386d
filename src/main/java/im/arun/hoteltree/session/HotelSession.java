package im.arun.hoteltree.session;

import im.arun.hoteltree.autosave.AutosaveScheduler;
import im.arun.hoteltree.autosave.SaveStatus;
import im.arun.hoteltree.autosave.SaveStatusListener;
import im.arun.hoteltree.autosave.TaskTimer;
import im.arun.hoteltree.model.ApplyOutcome;
import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.model.MovePosition;
import im.arun.hoteltree.model.NodePatch;
import im.arun.hoteltree.model.StructuralAction;
import im.arun.hoteltree.sync.SaveResult;
import im.arun.hoteltree.sync.ShardSyncGateway;
import im.arun.hoteltree.tree.ActionApplier;
import im.arun.hoteltree.tree.IdGenerator;
import im.arun.hoteltree.tree.TreeStore;
import im.arun.hoteltree.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * The single owner of the hotel tree being edited.
 * <p>
 * Every edit goes through {@link TreeStore}, replaces the tree atomically, notifies tree
 * subscribers and marks the autosave scheduler dirty. Edits that leave the tree unchanged are
 * reported as {@code false} and trigger nothing. Saves always write the tree as it is when the save
 * starts, so edits made while a save is running are picked up by the next one.
 */
public class HotelSession implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(HotelSession.class);

    private final ShardSyncGateway gateway;
    private final ActionApplier actionApplier;
    private final TaskTimer timer;
    private final Duration quietPeriod;
    private final Duration savedHold;
    private final Executor ioExecutor;
    private final boolean ownsExecutor;
    private final List<Consumer<ContentNode>> treeListeners = new CopyOnWriteArrayList<>();
    private final List<SaveStatusListener> statusListeners = new CopyOnWriteArrayList<>();

    private String hotelId;
    private ContentNode tree;
    private AutosaveScheduler scheduler;

    /**
     * Runs saves on a pool owned by this session and shut down by {@link #close()}.
     */
    public HotelSession(ShardSyncGateway gateway, ActionApplier actionApplier, TaskTimer timer,
                        Duration quietPeriod, Duration savedHold) {
        this(gateway, actionApplier, timer, quietPeriod, savedHold, ExecutorProvider.newIoExecutor(), true);
    }

    /**
     * Runs saves on {@code ioExecutor}, which stays the caller's to shut down.
     */
    public HotelSession(ShardSyncGateway gateway, ActionApplier actionApplier, TaskTimer timer,
                        Duration quietPeriod, Duration savedHold, Executor ioExecutor) {
        this(gateway, actionApplier, timer, quietPeriod, savedHold, ioExecutor, false);
    }

    HotelSession(ShardSyncGateway gateway, ActionApplier actionApplier, TaskTimer timer,
                 Duration quietPeriod, Duration savedHold, Executor ioExecutor, boolean ownsExecutor) {
        this.gateway = gateway;
        this.actionApplier = actionApplier;
        this.timer = timer;
        this.quietPeriod = quietPeriod;
        this.savedHold = savedHold;
        this.ioExecutor = ioExecutor;
        this.ownsExecutor = ownsExecutor;
    }

    // --- document lifecycle ---

    /**
     * Flushes the open hotel, then loads {@code id} and makes it current.
     *
     * @return false if no hotel with that id exists remotely or locally; the previous hotel stays open
     */
    public boolean open(String id) {
        // reopening the same hotel must load what the pending edits just wrote
        flushCurrent();
        Optional<ContentNode> loaded = gateway.load(id);
        if (loaded.isEmpty()) {
            logger.warn("Hotel {} not found", id);
            return false;
        }
        attach(id, loaded.get());
        return true;
    }

    /**
     * Creates a new hotel from {@code initialTree} and makes it current.
     *
     * @return the new hotel id
     */
    public String create(ContentNode initialTree) {
        ContentNode created = gateway.create(initialTree);
        attach(created.getId(), created);
        return created.getId();
    }

    private void attach(String id, ContentNode root) {
        AutosaveScheduler previous;
        synchronized (this) {
            previous = scheduler;
        }
        if (previous != null) {
            previous.flush().join();
            previous.close();
        }

        AutosaveScheduler next = new AutosaveScheduler(timer, quietPeriod, savedHold, this::saveSnapshot);
        next.addListener((from, to) -> statusListeners.forEach(listener -> listener.onStatusChange(from, to)));
        synchronized (this) {
            hotelId = id;
            tree = root;
            scheduler = next;
        }
        logger.info("Opened hotel {} ({})", id, root.getName());
        treeListeners.forEach(listener -> listener.accept(root));
    }

    private void flushCurrent() {
        AutosaveScheduler current;
        synchronized (this) {
            current = scheduler;
        }
        if (current != null) {
            current.flush().join();
        }
    }

    private CompletableFuture<SaveResult> saveSnapshot() {
        String id;
        ContentNode snapshot;
        synchronized (this) {
            id = hotelId;
            snapshot = tree;
        }
        return CompletableFuture.supplyAsync(() -> gateway.save(id, snapshot), ioExecutor);
    }

    // --- edits ---

    public boolean insertChild(String parentId, ContentNode node) {
        return mutate(root -> TreeStore.insertChild(root, parentId, node));
    }

    /**
     * Appends an empty child to {@code parentId}. A null {@code kind} picks the parent's default
     * child kind.
     *
     * @return the new node, or empty if the parent does not exist
     */
    public Optional<ContentNode> addChild(String parentId, String kind) {
        ContentNode parent = TreeStore.findNode(requireTree(), parentId).orElse(null);
        if (parent == null) {
            return Optional.empty();
        }
        String childKind = kind != null ? kind : TreeStore.defaultChildKind(parent.getKind());
        ContentNode child = ContentNode.builder()
                .id(IdGenerator.generate(IdGenerator.prefixFor(childKind)))
                .kind(childKind)
                .name("New " + childKind.replace('_', ' '))
                .value("")
                .build();
        return insertChild(parentId, child) ? Optional.of(child) : Optional.empty();
    }

    public boolean updateNode(String id, NodePatch patch) {
        return mutate(root -> TreeStore.updateNode(root, id, patch));
    }

    public boolean changeNodeId(String oldId, String newId) {
        return mutate(root -> TreeStore.changeNodeId(root, oldId, newId));
    }

    public boolean deleteNode(String id) {
        return mutate(root -> TreeStore.deleteNode(root, id));
    }

    public boolean moveNode(String sourceId, String targetId, MovePosition position) {
        return mutate(root -> TreeStore.moveNode(root, sourceId, targetId, position));
    }

    /**
     * Applies AI-proposed actions as one edit: subscribers see only the final tree.
     */
    public ApplyOutcome applyActions(List<StructuralAction> actions) {
        ApplyOutcome[] outcome = new ApplyOutcome[1];
        mutate(root -> {
            outcome[0] = actionApplier.apply(root, actions);
            return outcome[0].getTree();
        });
        return outcome[0];
    }

    /**
     * Swaps in a whole new tree, for example after an import. The hotel id is kept on the root.
     */
    public boolean replaceTree(ContentNode newTree) {
        return mutate(root -> newTree.withId(root.getId()));
    }

    private boolean mutate(UnaryOperator<ContentNode> edit) {
        ContentNode after;
        AutosaveScheduler current;
        synchronized (this) {
            ContentNode before = requireTree();
            after = edit.apply(before);
            if (after == before) {
                return false;
            }
            tree = after;
            current = scheduler;
        }
        for (Consumer<ContentNode> listener : treeListeners) {
            listener.accept(after);
        }
        current.markDirty();
        return true;
    }

    // --- saving and observation ---

    public CompletableFuture<SaveStatus> saveNow() {
        return requireScheduler().saveNow();
    }

    public CompletableFuture<SaveStatus> flush() {
        return requireScheduler().flush();
    }

    public synchronized SaveStatus getStatus() {
        return scheduler == null ? SaveStatus.IDLE : scheduler.getStatus();
    }

    public synchronized ContentNode getTree() {
        return tree;
    }

    public synchronized String getHotelId() {
        return hotelId;
    }

    public Subscription subscribe(Consumer<ContentNode> listener) {
        treeListeners.add(listener);
        return () -> treeListeners.remove(listener);
    }

    public Subscription onStatusChange(SaveStatusListener listener) {
        statusListeners.add(listener);
        return () -> statusListeners.remove(listener);
    }

    /**
     * Flushes pending edits, stops the scheduler and shuts down an owned save pool.
     */
    @Override
    public void close() {
        AutosaveScheduler current;
        synchronized (this) {
            current = scheduler;
        }
        try {
            if (current != null) {
                current.flush().join();
                current.close();
            }
        } finally {
            if (ownsExecutor && ioExecutor instanceof ExecutorService) {
                ((ExecutorService) ioExecutor).shutdown();
            }
        }
    }

    private synchronized ContentNode requireTree() {
        if (tree == null) {
            throw new IllegalStateException("No hotel is open");
        }
        return tree;
    }

    private synchronized AutosaveScheduler requireScheduler() {
        if (scheduler == null) {
            throw new IllegalStateException("No hotel is open");
        }
        return scheduler;
    }
}
