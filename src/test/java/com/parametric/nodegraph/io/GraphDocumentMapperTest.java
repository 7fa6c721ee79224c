package com.parametric.nodegraph.io;

import static com.parametric.nodegraph.Fixtures.custom;
import static org.junit.Assert.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parametric.nodegraph.GraphEditor;
import com.parametric.nodegraph.NodeGraph;
import com.parametric.nodegraph.config.EditorConfig;
import com.parametric.nodegraph.model.Connection;
import com.parametric.nodegraph.model.Node;
import com.parametric.nodegraph.model.NodeType;
import com.parametric.nodegraph.store.GraphState;

public class GraphDocumentMapperTest {
    private final GraphDocumentMapper mapper = new GraphDocumentMapper();

    private GraphEditor compiledSession() {
        GraphEditor editor = NodeGraph.editor(EditorConfig.defaults());
        editor.history().reset(new GraphState(
                List.of(custom("a", 0, 0),
                        custom("x", 400, 0).withData(custom("x", 0, 0).data()
                                .withProperties(Map.of("min", 0, "max", 10, "tags", List.of("t1")))),
                        custom("y", 800, 0), custom("d", 1200, 0)),
                List.of(Connection.of("ax", "a", "o1", "x", "i1"),
                        new Connection("xy", "x", "o1", "y", "i1", true, true),
                        Connection.of("yd", "y", "o1", "d", "i1"))));
        Node g = editor.groups().createGroup(List.of("x", "y")).orElseThrow();
        editor.compiler().compile(g.id()).orElseThrow();
        return editor;
    }

    @Test
    public void testWireNames() throws Exception {
        String json = mapper.write(compiledSession().exportDocument());
        JsonNode root = new ObjectMapper().readTree(json);

        JsonNode instance = root.get("nodes").get(2);
        assertEquals("component", instance.get("type").asText());
        assertTrue(instance.get("data").has("componentId"));
        assertTrue(instance.get("data").has("customName"));
        assertEquals("in-1", instance.get("data").get("inputs").get(0).get("id").asText());
        assertFalse(instance.has("group"));

        JsonNode ax = root.get("connections").get(0);
        assertEquals("a", ax.get("sourceNodeId").asText());
        assertEquals("o1", ax.get("sourcePort").asText());
        assertEquals(instance.get("id").asText(), ax.get("targetNodeId").asText());
        assertFalse(ax.has("isDashed"));

        JsonNode def = root.get("components").get(0);
        for (String field : List.of("id", "name", "inputPorts", "outputPorts", "internalNodes",
                "internalConnections", "inputBindings", "outputBindings", "origin"))
            assertTrue(field, def.has(field));
        JsonNode xy = def.get("internalConnections").get(0);
        assertTrue(xy.get("isDashed").asBoolean());
        assertTrue(xy.get("isGhost").asBoolean());
        assertTrue(def.get("inputBindings").get(0).has("componentPortId"));
    }

    @Test
    public void testLoadSaveReproducesDocument() throws Exception {
        GraphDocument original = compiledSession().exportDocument();
        GraphDocument loaded = mapper.read(mapper.write(original));

        assertEquals(original.getNodes(), loaded.getNodes());
        assertEquals(original.getConnections(), loaded.getConnections());
        assertEquals(original.getComponents(), loaded.getComponents());
        assertEquals(mapper.write(original), mapper.write(loaded));
    }

    @Test
    public void testFileRoundTrip() throws Exception {
        GraphDocument original = compiledSession().exportDocument();
        Path file = Files.createTempFile("graph", ".json");
        try {
            mapper.write(original, file);
            assertEquals(original, mapper.read(file));
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    public void testReadsHandWrittenDocument() throws Exception {
        String json = "{\"nodes\":[{\"id\":\"s\",\"type\":\"number-slider\",\"position\":{\"x\":5,\"y\":6},"
                + "\"data\":{\"customName\":\"Speed\",\"outputs\":[{\"id\":\"output-main\",\"label\":\"Value\"}],"
                + "\"min\":0,\"unknownKey\":true}}],"
                + "\"connections\":[],\"viewport\":{\"zoom\":2}}";
        GraphDocument doc = mapper.read(json);
        Node s = doc.getNodes().get(0);
        assertEquals(NodeType.NUMBER_SLIDER, s.type());
        assertEquals("Speed", s.data().displayName());
        assertEquals(5, s.position().x(), 0);
        assertTrue(doc.getComponents().isEmpty());
    }
}
