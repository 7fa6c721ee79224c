package com.parametric.nodegraph;

import java.util.List;

import com.parametric.nodegraph.model.Node;
import com.parametric.nodegraph.model.NodeData;
import com.parametric.nodegraph.model.NodeType;
import com.parametric.nodegraph.model.Port;
import com.parametric.nodegraph.model.Position;

/** Node builders shared by the tests. */
public final class Fixtures {

    private Fixtures() {
    }

    public static Node node(String id, NodeType type, double x, double y, List<Port> inputs, List<Port> outputs) {
        return new Node(id, type, new Position(x, y),
                new NodeData(id.toUpperCase(), inputs, outputs, null, null, null, null, null));
    }

    /** A custom node with one input {@code i1} and one output {@code o1}. */
    public static Node custom(String id, double x, double y) {
        return node(id, NodeType.CUSTOM, x, y, List.of(new Port("i1", "In")), List.of(new Port("o1", "Out")));
    }

    public static Node group(String id, String... members) {
        return new Node(id, NodeType.GROUP, new Position(0, 0),
                new NodeData("Group", null, null, 400.0, 300.0, List.of(members), null, null));
    }

    public static Port port(String id) {
        return new Port(id, "");
    }
}
