package com.parametric.nodegraph.connect;

import static com.parametric.nodegraph.Fixtures.custom;
import static com.parametric.nodegraph.Fixtures.node;
import static org.junit.Assert.*;

import java.util.List;
import java.util.Optional;

import org.junit.Before;
import org.junit.Test;

import com.parametric.nodegraph.api.CanvasViewport;
import com.parametric.nodegraph.history.HistoryManager;
import com.parametric.nodegraph.model.Connection;
import com.parametric.nodegraph.model.NodeType;
import com.parametric.nodegraph.model.Port;
import com.parametric.nodegraph.model.Position;
import com.parametric.nodegraph.store.GraphState;
import com.parametric.nodegraph.store.GraphStore;
import com.parametric.nodegraph.util.SequentialIdGenerator;

public class ConnectionRouterTest {
    private GraphStore store;
    private HistoryManager history;
    private ConnectionRouter router;

    @Before
    public void setUp() {
        store = new GraphStore();
        history = new HistoryManager(store);
        router = new ConnectionRouter(history, new SequentialIdGenerator());
        history.reset(new GraphState(List.of(
                node("src", NodeType.BOX, 0, 0, List.of(), List.of(new Port("out", "Out"))),
                node("dst", NodeType.BOX, 400, 0, List.of(new Port("in", "In")), List.of()),
                node("dst2", NodeType.BOX, 400, 300, List.of(new Port("in", "In"), new Port("in2", "In 2")),
                        List.of())),
                List.of()));
    }

    @Test
    public void testConnectFromOutput() {
        router.startConnection("src", "out", Position.ORIGIN);
        Connection c = router.completeConnection("dst", "in").orElseThrow();
        assertEquals("src", c.sourceNodeId());
        assertEquals("out", c.sourcePort());
        assertEquals("dst", c.targetNodeId());
        assertEquals("in", c.targetPort());
        assertEquals(1, store.connections().size());
        assertFalse(router.isDragging());
        assertTrue(history.canUndo());
    }

    @Test
    public void testDirectionNormalizedWhenDraggingFromInput() {
        router.startConnection("dst", "in", Position.ORIGIN);
        Connection c = router.completeConnection("src", "out").orElseThrow();
        assertEquals("src", c.sourceNodeId());
        assertEquals("out", c.sourcePort());
        assertEquals("dst", c.targetNodeId());
        assertEquals("in", c.targetPort());
    }

    @Test
    public void testDirectionNormalizedForEveryPair() {
        String[][] inputs = { { "dst", "in" }, { "dst2", "in" }, { "dst2", "in2" } };
        for (String[] in : inputs) {
            for (boolean fromInput : new boolean[] { false, true }) {
                setUp();
                Optional<Connection> c = fromInput
                        ? router.connect(in[0], in[1], "src", "out")
                        : router.connect("src", "out", in[0], in[1]);
                assertTrue(c.isPresent());
                assertEquals("src", c.get().sourceNodeId());
                assertEquals(in[0], c.get().targetNodeId());
                assertEquals(in[1], c.get().targetPort());
            }
        }
    }

    @Test
    public void testSameRoleRejected() {
        GraphState before = store.state();
        router.startConnection("dst", "in", Position.ORIGIN);
        assertFalse(router.completeConnection("dst2", "in").isPresent());
        assertSame(before, store.state());
        assertFalse(history.canUndo());
        assertFalse(router.isDragging());
    }

    @Test
    public void testDuplicateRejected() {
        router.connect("src", "out", "dst", "in").orElseThrow();
        GraphState before = store.state();
        router.startConnection("dst", "in", Position.ORIGIN);
        assertFalse(router.completeConnection("src", "out").isPresent());
        assertSame(before, store.state());
        assertEquals(1, history.undoDepth());
    }

    @Test
    public void testUnknownPortRejected() {
        assertFalse(router.connect("src", "out", "dst", "input-ghost").isPresent());
        assertFalse(router.connect("src", "out", "missing", "input-1").isPresent());
        assertTrue(store.connections().isEmpty());
    }

    @Test
    public void testReleaseOverEmptyCanvasLeavesGraphUnchanged() {
        GraphState before = store.state();
        router.startConnection("src", "out", new Position(10, 10));
        router.updateDrag(new Position(200, 250));
        router.releaseOverEmptyCanvas();
        assertFalse(router.isDragging());
        assertSame(before, store.state());
        assertFalse(history.canUndo());
    }

    @Test
    public void testCancel() {
        router.startConnection("src", "out", Position.ORIGIN);
        router.cancelConnection();
        assertFalse(router.completeConnection("dst", "in").isPresent());
        assertTrue(store.connections().isEmpty());
    }

    @Test
    public void testViewportConvertsPointer() {
        router.setViewport(CanvasViewport.offset(100, 50));
        DragSession drag = router.startConnection("src", "out", new Position(130, 80));
        assertEquals(new Position(30, 30), drag.pointer());
        router.updateDrag(new Position(100, 50));
        assertEquals(Position.ORIGIN, router.dragSession().orElseThrow().pointer());
    }

    @Test
    public void testNewDragReplacesOld() {
        router.startConnection("src", "out", Position.ORIGIN);
        router.startConnection("dst", "in", Position.ORIGIN);
        assertEquals("dst", router.dragSession().orElseThrow().nodeId());
    }

    @Test
    public void testDeleteConnection() {
        Connection c = router.connect("src", "out", "dst", "in").orElseThrow();
        assertTrue(router.deleteConnection(c.id()));
        assertTrue(store.connections().isEmpty());
        assertEquals(3, store.nodes().size());
        assertFalse(router.deleteConnection(c.id()));
    }

    @Test
    public void testElasticTargetGrowsInputSlot() {
        history.reset(new GraphState(List.of(
                custom("a", 0, 0),
                custom("b", 0, 200),
                node("out", NodeType.OUTPUT, 400, 0, NodeType.OUTPUT.defaultInputs(), List.of())), List.of()));

        router.connect("a", "o1", "out", "input-1").orElseThrow();
        assertEquals(List.of("input-1", "input-2"),
                store.node("out").orElseThrow().inputs().stream().map(Port::id).toList());

        router.connect("b", "o1", "out", "input-2").orElseThrow();
        assertEquals(3, store.node("out").orElseThrow().inputs().size());
        assertEquals("Input 3", store.node("out").orElseThrow().inputs().get(2).label());

        // Connection and new slot are one step.
        history.undo();
        assertEquals(2, store.node("out").orElseThrow().inputs().size());
        assertEquals(1, store.connections().size());
    }

    @Test
    public void testElasticTargetWithFreeSlotDoesNotGrow() {
        history.reset(new GraphState(List.of(
                custom("a", 0, 0),
                node("c", NodeType.CUSTOM, 400, 0, List.of(new Port("x", ""), new Port("y", "")), List.of())),
                List.of()));
        router.connect("a", "o1", "c", "x").orElseThrow();
        assertEquals(2, store.node("c").orElseThrow().inputs().size());
    }

    @Test
    public void testNonElasticTargetDoesNotGrow() {
        router.connect("src", "out", "dst", "in").orElseThrow();
        assertEquals(1, store.node("dst").orElseThrow().inputs().size());
    }
}
