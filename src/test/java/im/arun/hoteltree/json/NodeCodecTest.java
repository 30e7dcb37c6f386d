package im.arun.hoteltree.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.model.DiningPayload;
import im.arun.hoteltree.model.GenericPayload;
import im.arun.hoteltree.model.HotelTemplate;
import im.arun.hoteltree.model.NodePatch;
import im.arun.hoteltree.model.RoomPayload;
import im.arun.hoteltree.model.ScheduledEventPayload;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NodeCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final NodeCodec codec = new NodeCodec(mapper);

    @Test
    void decodesStoredDocumentWithLegacyExtensions() throws Exception {
        String json = "{\"id\":\"n1\",\"type\":\"menu_item\",\"name\":\"Soup\",\"price\":\"9\","
                + "\"tags\":[\"hot\"],\"attributes\":[{\"id\":\"a1\",\"key\":\"Size\",\"value\":\"L\",\"type\":\"select\","
                + "\"options\":[\"S\",\"L\"]}],\"children\":[]}";

        ContentNode node = codec.fromJson(json);

        assertEquals("n1", node.getId());
        assertEquals("menu_item", node.getKind());
        assertTrue(node.isLeaf());
        assertEquals("9", node.extensionText("price"));
        assertTrue(node.getExtensions().get("tags").isArray());
        assertEquals("select", node.getAttributes().get(0).getKind());
        assertEquals(2, node.getAttributes().get(0).getOptions().size());
    }

    @Test
    void encodeKeepsKindUnderTypeAndPreservesUnknownKeys() throws Exception {
        ContentNode node = codec.fromJson("{\"id\":\"n1\",\"type\":\"qa_pair\",\"question\":\"Pets?\",\"answer\":\"No\"}");

        ObjectNode json = codec.encode(node);

        assertEquals("qa_pair", json.get("type").asText());
        assertEquals("Pets?", json.get("question").asText());
        assertEquals("No", json.get("answer").asText());
        assertTrue(json.get("children").isArray());
        assertEquals(node, codec.decode(json));
    }

    @Test
    void encodeScalarsLeavesOutChildren() {
        ContentNode node = ContentNode.builder().id("r").kind("root").name("Hotel")
                .child(ContentNode.builder().id("c").kind("category").name("Info").build())
                .build();

        ObjectNode json = codec.encodeScalars(node);

        assertFalse(json.has("children"));
        assertEquals("Hotel", json.get("name").asText());
    }

    @Test
    void payloadUnionRoundTripsThroughSchemaType() {
        ContentNode event = ContentNode.builder().id("e").kind("event").name("Yoga")
                .payload(ScheduledEventPayload.builder().recurrenceType("weekly").day("Mon").day("Thu")
                        .startTime("08:00").externalAllowed(true).minAge(12).build())
                .build();
        ContentNode room = ContentNode.builder().id("r").kind("item").name("Suite")
                .payload(RoomPayload.builder().capacity(3).bedType("King").build())
                .build();

        ObjectNode eventJson = codec.encode(event);
        assertEquals("scheduled_event", eventJson.get("payload").get("schemaType").asText());
        assertTrue(eventJson.get("payload").get("isExternalAllowed").asBoolean());

        assertEquals(event, codec.decode(eventJson));
        assertEquals(room, codec.decode(codec.encode(room)));
    }

    @Test
    void decodesDiningPayloadFromJson() throws Exception {
        ContentNode node = codec.fromJson("{\"id\":\"m\",\"type\":\"menu_item\",\"payload\":"
                + "{\"schemaType\":\"dining\",\"price\":\"12\",\"isPaid\":true,\"tags\":[\"vegan\"]}}");

        DiningPayload payload = (DiningPayload) node.getPayload();
        assertEquals("12", payload.getPrice());
        assertTrue(payload.getPaid());
        assertEquals("vegan", payload.getTags().get(0));
    }

    @Test
    void unknownPayloadIsKeptAsExtension() throws Exception {
        ContentNode node = codec.fromJson("{\"id\":\"x\",\"payload\":{\"schemaType\":\"spaceship\",\"warp\":9}}");

        assertNull(node.getPayload());
        assertEquals(9, node.getExtensions().get("payload").get("warp").asInt());
        assertEquals("spaceship", codec.encode(node).get("payload").get("schemaType").asText());
    }

    @Test
    void genericPayloadCarriesArbitraryFields() throws Exception {
        ContentNode node = codec.fromJson("{\"id\":\"g\",\"payload\":{\"schemaType\":\"generic\","
                + "\"fields\":{\"floor\":3,\"open\":true}}}");

        GenericPayload payload = (GenericPayload) node.getPayload();
        assertEquals(3, payload.getFields().get("floor").asInt());
    }

    @Test
    void nullFieldsAndNonObjectChildrenAreSkipped() throws Exception {
        ContentNode node = codec.fromJson("{\"id\":\"p\",\"name\":null,\"children\":[{\"id\":\"c\"},42,null]}");

        assertNull(node.getName());
        assertEquals(1, node.getChildren().size());
        assertTrue(node.getExtensions().isEmpty());
    }

    @Test
    void decodeRejectsNonObjects() {
        assertThrows(IllegalArgumentException.class, () -> codec.decode(mapper.readTree("[1,2]")));
    }

    @Test
    void decodePatchCarriesOnlyPresentFields() throws Exception {
        JsonNode json = mapper.readTree("{\"value\":\"Free\",\"id\":\"sneaky\"}");

        NodePatch patch = codec.decodePatch(json);

        assertEquals("Free", patch.getValue());
        assertNull(patch.getName());
        assertNull(patch.getAttributes());
        assertTrue(patch.touchesId());
    }

    @Test
    void decodesTemplate() throws Exception {
        HotelTemplate template = codec.decodeTemplate(mapper.readTree("{\"id\":\"t1\",\"name\":\"Resort\","
                + "\"createdAt\":1700000000000,\"data\":{\"id\":\"root\",\"type\":\"root\",\"children\":[{\"id\":\"c\"}]}}"));

        assertEquals("Resort", template.getName());
        assertEquals(1700000000000L, template.getCreatedAt());
        assertEquals(1, template.getData().getChildren().size());
        assertThrows(IllegalArgumentException.class, () -> codec.decodeTemplate(mapper.readTree("{\"id\":\"t2\"}")));
    }

    @Test
    void encodesTemplateWithTreeUnderData() {
        ContentNode tree = ContentNode.builder().id("root").kind("root").name("Resort")
                .child(ContentNode.builder().id("c").kind("category").name("Rooms").build())
                .build();
        HotelTemplate template = HotelTemplate.builder()
                .id("t1").name("Resort").description("").createdAt(1700000000000L).data(tree).build();

        ObjectNode json = codec.encodeTemplate(template);

        assertEquals("t1", json.path("id").asText());
        assertEquals("", json.path("description").asText(null));
        assertEquals(1700000000000L, json.path("createdAt").asLong());
        assertEquals("root", json.path("data").path("type").asText());
        assertEquals(template, codec.decodeTemplate(json));
    }
}
