package com.parametric.nodegraph.store;

import static com.parametric.nodegraph.Fixtures.custom;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.parametric.nodegraph.model.Connection;
import com.parametric.nodegraph.model.Node;

public class GraphStateTest {

    @Test
    public void testEmpty() {
        assertTrue(GraphState.EMPTY.nodes().isEmpty());
        assertTrue(GraphState.EMPTY.connections().isEmpty());
        GraphState.EMPTY.checkIntegrity();
    }

    @Test
    public void testListsAreCopied() {
        List<Node> nodes = new ArrayList<>(List.of(custom("a", 0, 0)));
        GraphState state = new GraphState(nodes, null);
        nodes.add(custom("b", 0, 0));
        assertEquals(1, state.nodes().size());
        assertTrue(state.connections().isEmpty());
    }

    @Test
    public void testLookups() {
        Connection ab = Connection.of("c1", "a", "o1", "b", "i1");
        GraphState state = new GraphState(List.of(custom("a", 0, 0), custom("b", 0, 0), custom("c", 0, 0)),
                List.of(ab));
        assertTrue(state.containsNode("b"));
        assertFalse(state.containsNode("x"));
        assertEquals(ab, state.connection("c1").orElseThrow());
        assertTrue(state.containsConnection(ab.endpoints()));
        assertEquals(List.of(ab), state.connectionsTouching("a"));
        assertTrue(state.connectionsTouching("c").isEmpty());
    }

    @Test(expected = GraphIntegrityException.class)
    public void testDuplicateNodeId() {
        new GraphState(List.of(custom("a", 0, 0), custom("a", 10, 10)), List.of()).checkIntegrity();
    }

    @Test(expected = GraphIntegrityException.class)
    public void testDuplicateEndpoints() {
        new GraphState(List.of(custom("a", 0, 0), custom("b", 0, 0)), List.of(
                Connection.of("c1", "a", "o1", "b", "i1"),
                Connection.of("c2", "a", "o1", "b", "i1"))).checkIntegrity();
    }

    @Test(expected = GraphIntegrityException.class)
    public void testDuplicateConnectionId() {
        new GraphState(List.of(custom("a", 0, 0), custom("b", 0, 0)), List.of(
                Connection.of("c1", "a", "o1", "b", "i1"),
                Connection.of("c1", "b", "o1", "a", "i1"))).checkIntegrity();
    }

    @Test(expected = GraphIntegrityException.class)
    public void testConnectionToMissingNode() {
        new GraphState(List.of(custom("a", 0, 0)), List.of(
                Connection.of("c1", "a", "o1", "b", "i1"))).checkIntegrity();
    }

    @Test(expected = GraphIntegrityException.class)
    public void testConnectionToUndeclaredPort() {
        new GraphState(List.of(custom("a", 0, 0), custom("b", 0, 0)), List.of(
                Connection.of("c1", "a", "o1", "b", "i9"))).checkIntegrity();
    }

    @Test
    public void testConnectionBetweenDeclaredPortsOfEitherList() {
        // Boundary rewiring may end on an output, as in A.o1 -> B.o1.
        new GraphState(List.of(custom("a", 0, 0), custom("b", 0, 0)), List.of(
                Connection.of("c1", "a", "o1", "b", "o1"))).checkIntegrity();
    }
}
