package com.parametric.nodegraph.store;

import static com.parametric.nodegraph.Fixtures.custom;
import static com.parametric.nodegraph.Fixtures.node;
import static com.parametric.nodegraph.Fixtures.port;
import static org.junit.Assert.*;

import java.util.List;
import java.util.Optional;

import org.junit.Test;

import com.parametric.nodegraph.model.Connection;
import com.parametric.nodegraph.model.NodeType;
import com.parametric.nodegraph.model.PortRole;

public class GraphStoreTest {

    @Test
    public void testStartsEmpty() {
        GraphStore store = new GraphStore();
        assertSame(GraphState.EMPTY, store.state());
        assertFalse(store.node("a").isPresent());
    }

    @Test
    public void testReplaceIndexesNodes() {
        GraphStore store = new GraphStore();
        store.replace(new GraphState(List.of(custom("a", 0, 0), custom("b", 0, 0)),
                List.of(Connection.of("c1", "a", "o1", "b", "i1"))));
        assertTrue(store.containsNode("a"));
        assertEquals("b", store.node("b").orElseThrow().id());
        assertTrue(store.containsConnection(new Connection.Endpoints("a", "o1", "b", "i1")));
        assertEquals(1, store.connections().size());
    }

    @Test
    public void testFailedReplaceLeavesStateUnchanged() {
        GraphStore store = new GraphStore();
        GraphState good = new GraphState(List.of(custom("a", 0, 0)), List.of());
        store.replace(good);
        try {
            store.replace(new GraphState(List.of(custom("x", 0, 0), custom("x", 0, 0)), List.of()));
            fail("Duplicate ids must be rejected");
        } catch (GraphIntegrityException e) {
            assertSame(good, store.state());
            assertTrue(store.containsNode("a"));
            assertFalse(store.containsNode("x"));
        }
    }

    @Test
    public void testPortRoleUsesDeclaredMembership() {
        GraphStore store = new GraphStore();
        // Port ids deliberately contradict the legacy naming convention.
        store.replace(new GraphState(List.of(node("n", NodeType.CUSTOM, 0, 0,
                List.of(port("output-looking")), List.of(port("input-looking")))), List.of()));

        assertEquals(Optional.of(PortRole.INPUT), store.portRole("n", "output-looking"));
        assertEquals(Optional.of(PortRole.OUTPUT), store.portRole("n", "input-looking"));
        assertEquals(Optional.empty(), store.portRole("n", "input-undeclared"));
    }

    @Test
    public void testPortRoleFallsBackToLegacyIdForMissingNode() {
        GraphStore store = new GraphStore();
        assertEquals(Optional.of(PortRole.INPUT), store.portRole("gone", "Input-3"));
        assertEquals(Optional.of(PortRole.OUTPUT), store.portRole("gone", "output-main"));
        assertEquals(Optional.empty(), store.portRole("gone", "o1"));
    }
}
