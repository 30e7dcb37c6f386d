package im.arun.hoteltree.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.hoteltree.autosave.ManualTaskTimer;
import im.arun.hoteltree.autosave.SaveStatus;
import im.arun.hoteltree.json.NodeCodec;
import im.arun.hoteltree.model.ApplyOutcome;
import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.model.MovePosition;
import im.arun.hoteltree.model.NodePatch;
import im.arun.hoteltree.model.StructuralAction;
import im.arun.hoteltree.store.InMemoryDocumentStore;
import im.arun.hoteltree.sync.FileLocalCache;
import im.arun.hoteltree.sync.ShardSyncGateway;
import im.arun.hoteltree.tree.ActionApplier;
import im.arun.hoteltree.tree.TemplateImporter;
import im.arun.hoteltree.tree.TreeStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

public class HotelSessionTest {

    private static final Duration QUIET = Duration.ofMillis(2000);
    private static final Duration HOLD = Duration.ofMillis(3000);

    private final NodeCodec codec = new NodeCodec();
    private InMemoryDocumentStore store;
    private ShardSyncGateway gateway;
    private ManualTaskTimer timer;
    private HotelSession session;

    @TempDir
    Path cacheDir;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        gateway = new ShardSyncGateway(store, new FileLocalCache(cacheDir, "", codec), codec, "hotels", "nodes");
        timer = new ManualTaskTimer();
        session = new HotelSession(gateway, new ActionApplier(codec), timer, QUIET, HOLD, Runnable::run);
        gateway.save("h1", ContentNode.builder().id("h1").kind("root").name("Seaside")
                .child(ContentNode.builder().id("info").kind("category").name("Info")
                        .child(ContentNode.builder().id("wifi").kind("field").name("Wifi").build())
                        .build())
                .child(ContentNode.builder().id("rooms").kind("category").name("Rooms").build())
                .build());
    }

    @Test
    void editsAreAutosavedAfterQuietPeriod() {
        assertTrue(session.open("h1"));
        int commitsAfterOpen = store.getCommits();

        assertTrue(session.updateNode("wifi", NodePatch.value("Free")));
        assertTrue(session.updateNode("wifi", NodePatch.value("Free, 100 Mbit")));
        assertEquals(SaveStatus.DIRTY, session.getStatus());

        timer.advance(QUIET);

        assertEquals(SaveStatus.SAVED, session.getStatus());
        assertEquals(commitsAfterOpen + 1, store.getCommits());
        ContentNode stored = gateway.load("h1").orElseThrow();
        assertEquals("Free, 100 Mbit", TreeStore.findNode(stored, "wifi").get().getValue());
    }

    @Test
    void noOpEditsReportFalseAndTriggerNothing() {
        session.open("h1");
        List<ContentNode> seen = new ArrayList<>();
        session.subscribe(seen::add);

        assertFalse(session.deleteNode("h1"));
        assertFalse(session.updateNode("ghost", NodePatch.value("x")));
        assertFalse(session.moveNode("info", "wifi", MovePosition.INSIDE));
        assertFalse(session.changeNodeId("wifi", "rooms"));

        assertTrue(seen.isEmpty());
        assertEquals(SaveStatus.IDLE, session.getStatus());
    }

    @Test
    void subscribersSeeEachNewTreeUntilClosed() {
        session.open("h1");
        List<ContentNode> seen = new ArrayList<>();
        Subscription subscription = session.subscribe(seen::add);

        session.moveNode("rooms", "info", MovePosition.BEFORE);
        subscription.close();
        session.deleteNode("rooms");

        assertEquals(1, seen.size());
        assertEquals("rooms", seen.get(0).getChildren().get(0).getId());
        assertFalse(TreeStore.containsId(session.getTree(), "rooms"));
    }

    @Test
    void addChildPicksDefaultKindAndFreshId() {
        session.open("h1");

        Optional<ContentNode> added = session.addChild("h1", null);
        Optional<ContentNode> item = session.addChild("info", "menu");

        assertEquals("category", added.orElseThrow().getKind());
        assertTrue(added.get().getId().startsWith("cat-"));
        assertEquals("menu", item.orElseThrow().getKind());
        assertTrue(session.addChild("ghost", null).isEmpty());
        assertEquals(3, session.getTree().getChildren().size());
    }

    @Test
    void applyActionsNotifiesOnceWithFinalTree() throws Exception {
        session.open("h1");
        List<ContentNode> seen = new ArrayList<>();
        session.subscribe(seen::add);
        ObjectMapper mapper = new ObjectMapper();

        ApplyOutcome outcome = session.applyActions(List.of(
                new StructuralAction("add", "rooms", mapper.readTree("{\"id\":\"suite\",\"name\":\"Suite\"}"), null),
                new StructuralAction("update", "suite", mapper.readTree("{\"value\":\"Sea view\"}"), null),
                new StructuralAction("delete", "ghost", null, null)));

        assertEquals(2, outcome.getApplied());
        assertEquals(1, outcome.getFailures().size());
        assertEquals(1, seen.size());
        assertEquals("Sea view", TreeStore.findNode(session.getTree(), "suite").get().getValue());
        assertEquals(SaveStatus.DIRTY, session.getStatus());
    }

    @Test
    void saveNowWritesImmediately() {
        session.open("h1");
        session.changeNodeId("wifi", "internet");

        assertEquals(SaveStatus.SAVED, session.saveNow().join());
        assertTrue(TreeStore.containsId(gateway.load("h1").orElseThrow(), "internet"));
    }

    @Test
    void offlineSaveIsReportedAsErrorAndKeptLocally() {
        session.open("h1");
        store.setOffline(true);
        session.deleteNode("rooms");

        assertEquals(SaveStatus.ERROR, session.saveNow().join());

        ContentNode cached = gateway.load("h1").orElseThrow();
        assertFalse(TreeStore.containsId(cached, "rooms"));
    }

    @Test
    void openingAnotherHotelFlushesPendingEdits() {
        gateway.save("h2", TemplateImporter.initialTree("Harbour Inn").withId("h2"));
        session.open("h1");
        session.updateNode("info", NodePatch.name("General"));
        List<SaveStatus> statuses = new ArrayList<>();
        session.onStatusChange((previous, current) -> statuses.add(current));

        assertTrue(session.open("h2"));

        assertEquals("General", TreeStore.findNode(gateway.load("h1").orElseThrow(), "info").get().getName());
        assertEquals("h2", session.getHotelId());
        assertEquals(SaveStatus.IDLE, session.getStatus());

        session.updateNode("h2", NodePatch.name("Harbour Inn & Spa"));
        assertEquals(SaveStatus.DIRTY, statuses.get(statuses.size() - 1));
    }

    @Test
    void reopeningSameHotelKeepsPendingEdit() {
        session.open("h1");
        session.updateNode("wifi", NodePatch.value("Free"));

        assertTrue(session.open("h1"));

        assertEquals("Free", TreeStore.findNode(session.getTree(), "wifi").get().getValue());
        session.updateNode("info", NodePatch.name("General"));
        assertEquals(SaveStatus.SAVED, session.saveNow().join());
        ContentNode stored = gateway.load("h1").orElseThrow();
        assertEquals("Free", TreeStore.findNode(stored, "wifi").get().getValue());
        assertEquals("General", TreeStore.findNode(stored, "info").get().getName());
    }

    @Test
    void unknownHotelKeepsCurrentDocument() {
        session.open("h1");
        session.updateNode("wifi", NodePatch.value("Free"));

        assertFalse(session.open("nope"));

        assertEquals("h1", session.getHotelId());
        assertEquals("Free", TreeStore.findNode(gateway.load("h1").orElseThrow(), "wifi").get().getValue());
        assertTrue(session.updateNode("wifi", NodePatch.value("Paid")));
        assertEquals(SaveStatus.SAVED, session.saveNow().join());
    }

    @Test
    void createOpensTheNewHotel() {
        String id = session.create(TemplateImporter.initialTree("Harbour Inn"));

        assertTrue(id.startsWith("hotel-"));
        assertEquals(id, session.getTree().getId());
        assertEquals("Harbour Inn", gateway.load(id).orElseThrow().getName());
    }

    @Test
    void replaceTreeKeepsHotelId() {
        session.open("h1");

        assertTrue(session.replaceTree(TemplateImporter.initialTree("Imported")));

        assertEquals("h1", session.getTree().getId());
        assertEquals("Imported", session.getTree().getName());
    }

    @Test
    void closeFlushesPendingEdits() {
        session.open("h1");
        session.updateNode("wifi", NodePatch.value("Paid"));

        session.close();

        assertEquals("Paid", TreeStore.findNode(gateway.load("h1").orElseThrow(), "wifi").get().getValue());
    }

    @Test
    void closeShutsDownOwnedSavePoolAfterFlushing() {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        HotelSession owning = new HotelSession(gateway, new ActionApplier(codec), timer, QUIET, HOLD, pool, true);
        owning.open("h1");
        owning.updateNode("wifi", NodePatch.value("Paid"));

        owning.close();

        assertTrue(pool.isShutdown());
        assertEquals("Paid", TreeStore.findNode(gateway.load("h1").orElseThrow(), "wifi").get().getValue());
    }

    @Test
    void closeLeavesCallersPoolRunning() {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            HotelSession borrowing = new HotelSession(gateway, new ActionApplier(codec), timer, QUIET, HOLD, pool);
            borrowing.open("h1");
            borrowing.close();

            assertFalse(pool.isShutdown());
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void editsBeforeOpenAreRejected() {
        assertThrows(IllegalStateException.class, () -> session.deleteNode("x"));
        assertThrows(IllegalStateException.class, () -> session.saveNow());
        assertEquals(SaveStatus.IDLE, session.getStatus());
    }
}
