package com.parametric.nodegraph.history;

import static com.parametric.nodegraph.Fixtures.custom;
import static org.junit.Assert.*;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.parametric.nodegraph.model.Connection;
import com.parametric.nodegraph.store.GraphIntegrityException;
import com.parametric.nodegraph.store.GraphState;
import com.parametric.nodegraph.store.GraphStore;

public class GraphTransactionTest {
    private GraphStore store;
    private HistoryManager history;

    @Before
    public void setUp() {
        store = new GraphStore();
        history = new HistoryManager(store);
        history.reset(new GraphState(List.of(custom("a", 0, 0), custom("b", 100, 0)),
                List.of(Connection.of("c1", "a", "o1", "b", "i1"))));
    }

    @Test
    public void testNothingVisibleBeforeCommit() {
        GraphTransaction tx = history.begin();
        tx.addNode(custom("c", 0, 0));
        tx.removeConnection("c1");
        assertFalse(store.containsNode("c"));
        assertEquals(1, store.connections().size());
        tx.rollback();
        assertFalse(tx.isOpen());
        assertFalse(history.canUndo());
    }

    @Test(expected = GraphIntegrityException.class)
    public void testDuplicateNodeIdRejected() {
        history.begin().addNode(custom("a", 0, 0));
    }

    @Test(expected = GraphIntegrityException.class)
    public void testDuplicateEndpointsRejected() {
        history.begin().addConnection(Connection.of("c2", "a", "o1", "b", "i1"));
    }

    @Test
    public void testRoleCheckedAtCommit() {
        GraphTransaction tx = history.begin();
        // a.i1 is an input, so it cannot be a source.
        tx.addConnection(Connection.of("c2", "a", "i1", "b", "i1"));
        try {
            tx.commit();
            fail("Input used as source must be rejected");
        } catch (GraphIntegrityException e) {
            assertEquals(1, store.connections().size());
        }
    }

    @Test
    public void testMissingEndpointNodeRejected() {
        GraphTransaction tx = history.begin();
        tx.addConnection(Connection.of("c2", "b", "o1", "a", "i1"));
        tx.removeNode("a");
        try {
            tx.commit();
            fail("Connection to a removed node must be rejected");
        } catch (GraphIntegrityException e) {
            assertTrue(store.containsNode("a"));
        }
    }

    @Test
    public void testDeclaredCheckAcceptsEitherList() {
        GraphTransaction tx = history.begin();
        tx.addConnection(Connection.of("c2", "b", "i1", "a", "o1"), GraphTransaction.EndpointCheck.DECLARED);
        assertTrue(tx.commit());
        assertEquals(2, store.connections().size());
    }

    @Test
    public void testDeclaredCheckRejectsUnknownPort() {
        GraphTransaction tx = history.begin();
        tx.addConnection(Connection.of("c2", "b", "nope", "a", "i1"), GraphTransaction.EndpointCheck.DECLARED);
        try {
            tx.validate();
            fail();
        } catch (GraphIntegrityException e) {
            assertTrue(e.getMessage().contains("nope"));
        }
    }

    @Test
    public void testRewireKeepsIdAndChecksChangedEndpoint() {
        GraphTransaction tx = history.begin();
        tx.addNode(custom("c", 200, 0));
        tx.rewire(store.connections().get(0).withTarget("c", "i1"));
        assertTrue(tx.commit());
        Connection c1 = store.state().connection("c1").orElseThrow();
        assertEquals("c", c1.targetNodeId());
        assertEquals("a", c1.sourceNodeId());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRewireUnknownConnection() {
        history.begin().rewire(Connection.of("zz", "a", "o1", "b", "i1"));
    }

    @Test(expected = IllegalStateException.class)
    public void testStaleTransactionRejected() {
        GraphTransaction tx = history.begin();
        tx.addNode(custom("c", 0, 0));
        history.setConnections(c -> List.of());
        tx.commit();
    }

    @Test(expected = IllegalStateException.class)
    public void testClosedTransactionRejected() {
        GraphTransaction tx = history.begin();
        tx.rollback();
        tx.addNode(custom("c", 0, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUpdateMustKeepId() {
        history.begin().updateNode("a", n -> n.withId("z"));
    }

    @Test
    public void testAddNodeFirst() {
        GraphTransaction tx = history.begin();
        tx.addNodeFirst(custom("g", 0, 0));
        assertEquals("g", tx.snapshot().nodes().get(0).id());
        assertEquals(3, tx.nodes().size());
    }
}
