package im.arun.hoteltree.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.hoteltree.json.NodeCodec;
import im.arun.hoteltree.model.ArchitectResponse;
import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.tree.TreeExporter;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class ArchitectServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private ArchitectService service;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        OpenAIClient client = new OpenAIClient("test-key", server.url("/v1").toString(), 2, 0);
        // a Monday
        Clock clock = Clock.fixed(Instant.parse("2024-05-06T14:30:00Z"), ZoneOffset.UTC);
        service = new ArchitectService(client, new TreeExporter(new NodeCodec(mapper)), "gpt-test", 2000, clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private static ContentNode hotel() {
        return ContentNode.builder().id("h1").kind("root").name("Seaside")
                .child(ContentNode.builder().id("dining").kind("category").name("Dining")
                        .child(ContentNode.builder().id("grill").kind("item").name("Grill").value("Steaks").build())
                        .build())
                .build();
    }

    private MockResponse completion(String content) throws Exception {
        ObjectNode body = mapper.createObjectNode();
        ObjectNode choice = body.putArray("choices").addObject();
        choice.putObject("message").put("role", "assistant").put("content", content);
        choice.put("finish_reason", "stop");
        return new MockResponse().setBody(mapper.writeValueAsString(body));
    }

    @Test
    void proposeActionsParsesActionsAndSendsIdsInContext() throws Exception {
        server.enqueue(completion("```json\n{\"summary\":\"Adding a bar\",\"actions\":[{\"type\":\"add\","
                + "\"targetId\":\"dining\",\"data\":{\"name\":\"Bar\",\"features\":{\"Happy Hour\":\"5-7\"}},"
                + "\"reason\":\"requested\"}]}\n```"));

        ArchitectResponse response = service.proposeActions(hotel(), "Add a bar to dining");

        assertEquals("Adding a bar", response.getSummary());
        assertEquals(1, response.getActions().size());
        assertEquals("dining", response.getActions().get(0).getTargetId());
        assertEquals("5-7", response.getActions().get(0).getData().get("features").get("Happy Hour").asText());

        RecordedRequest request = server.takeRequest();
        assertEquals("/v1/chat/completions", request.getPath());
        assertEquals("Bearer test-key", request.getHeader("Authorization"));
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertEquals("gpt-test", body.get("model").asText());
        assertEquals("json_object", body.get("response_format").get("type").asText());
        String prompt = body.get("messages").get(0).get("content").asText();
        assertTrue(prompt.contains("Add a bar to dining"));
        assertTrue(prompt.contains("\"id\" : \"grill\""));
    }

    @Test
    void unparseableProposalYieldsNoActions() throws Exception {
        server.enqueue(completion("I cannot help with that."));

        ArchitectResponse response = service.proposeActions(hotel(), "Do something");

        assertTrue(response.getActions().isEmpty());
        assertEquals("Error parsing AI response.", response.getSummary());
    }

    @Test
    void missingActionsListBecomesEmpty() throws Exception {
        server.enqueue(completion("{\"summary\":\"Already exists\",\"actions\":null}"));

        ArchitectResponse response = service.proposeActions(hotel(), "Add grill");

        assertEquals("Already exists", response.getSummary());
        assertNotNull(response.getActions());
        assertTrue(response.getActions().isEmpty());
    }

    @Test
    void chatSendsSystemPromptWithDayHistoryAndQuestion() throws Exception {
        server.enqueue(completion("The grill serves steaks."));

        String answer = service.chat(hotel(), "What does the grill serve?",
                List.of(Map.of("role", "user", "content", "Hi"), Map.of("role", "assistant", "content", "Hello!")));

        assertEquals("The grill serves steaks.", answer);
        JsonNode messages = mapper.readTree(server.takeRequest().getBody().readUtf8()).get("messages");
        assertEquals(4, messages.size());
        assertEquals("system", messages.get(0).get("role").asText());
        assertTrue(messages.get(0).get("content").asText().contains("Monday, 2024-05-06"));
        assertTrue(messages.get(0).get("content").asText().contains("- Grill: Steaks"));
        assertEquals("What does the grill serve?", messages.get(3).get("content").asText());
    }

    @Test
    void analyzeRetriesAfterServerError() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("overloaded"));
        server.enqueue(completion("A cosy seaside hotel."));

        assertEquals("A cosy seaside hotel.", service.analyze(hotel()));
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void auditGivesUpAfterMaxRetries() {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(502));

        assertThrows(RuntimeException.class, () -> service.audit(hotel()));
    }

    @Test
    void clientRequiresApiKey() {
        assumeTrue(System.getenv("CHATGPT_API_KEY") == null);
        assertThrows(IllegalArgumentException.class, () -> new OpenAIClient(null));
    }
}
