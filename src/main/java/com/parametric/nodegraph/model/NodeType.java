package com.parametric.nodegraph.model;

import java.util.List;
import java.util.function.ToDoubleFunction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Node types known to the editor core, with the structural traits the
 * component compiler and the connection router depend on.
 */
public enum NodeType {
    BOX("box", BoundaryRole.NONE, false, "Box", List.of(), List.of(),
            n -> 300, NodeType::primitiveHeight),
    SPHERE("sphere", BoundaryRole.NONE, false, "Sphere", List.of(), List.of(),
            n -> 300, NodeType::primitiveHeight),
    VECTOR_XYZ("vector-xyz", BoundaryRole.NONE, false, "Vector XYZ", List.of(),
            List.of(new Port("output-vector", "Vector")),
            n -> 300, NodeType::primitiveHeight),
    CUSTOM("custom", BoundaryRole.NONE, true, "Custom Node", List.of(), List.of(),
            NodeType::customWidth, NodeType::customHeight),
    ANTIVIRUS("antivirus", BoundaryRole.NONE, true, "AntiVirus Node", List.of(), List.of(),
            NodeType::customWidth, NodeType::customHeight),
    INPUT("input", BoundaryRole.SOURCE, false, "Input Node", List.of(),
            List.of(new Port("output-1", "Output 1")),
            NodeType::customWidth, NodeType::customHeight),
    OUTPUT("output", BoundaryRole.SINK, true, "Output Node",
            List.of(new Port("input-1", "Input 1")), List.of(),
            NodeType::customWidth, NodeType::customHeight),
    NUMBER_SLIDER("number-slider", BoundaryRole.SOURCE, false, "Number Slider", List.of(),
            List.of(new Port("output-main", "Value")),
            n -> 300, n -> 160),
    SERIES("series", BoundaryRole.SOURCE, false, "Series", List.of(),
            List.of(new Port("output-series", "Series")),
            n -> 260, n -> n.maxPortCount() > 0 ? 182 + n.maxPortCount() * 28 : 160),
    PANEL("panel", BoundaryRole.NONE, false, "Panel",
            List.of(new Port("input-main", "Inspector Input")),
            List.of(new Port("output-main", "Panel Output")),
            n -> 340, n -> 300),
    GROUP("group", BoundaryRole.NONE, false, "Group", List.of(), List.of(),
            n -> Double.NaN, n -> Double.NaN),
    COMPONENT("component", BoundaryRole.NONE, false, "Component", List.of(), List.of(),
            NodeType::customWidth, NodeType::customHeight);

    /** How a node of this type contributes to a compiled component's interface. */
    public enum BoundaryRole {
        /** Each output socket becomes a component input. */
        SOURCE,
        /** Each input socket becomes a component output. */
        SINK,
        NONE
    }

    private final String wireName;
    private final BoundaryRole boundaryRole;
    private final boolean elasticInputs;
    private final String defaultName;
    private final List<Port> defaultInputs;
    private final List<Port> defaultOutputs;
    private final ToDoubleFunction<Node> fallbackWidth;
    private final ToDoubleFunction<Node> fallbackHeight;

    NodeType(String wireName, BoundaryRole boundaryRole, boolean elasticInputs, String defaultName,
            List<Port> defaultInputs, List<Port> defaultOutputs,
            ToDoubleFunction<Node> fallbackWidth, ToDoubleFunction<Node> fallbackHeight) {
        this.wireName = wireName;
        this.boundaryRole = boundaryRole;
        this.elasticInputs = elasticInputs;
        this.defaultName = defaultName;
        this.defaultInputs = defaultInputs;
        this.defaultOutputs = defaultOutputs;
        this.fallbackWidth = fallbackWidth;
        this.fallbackHeight = fallbackHeight;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public BoundaryRole boundaryRole() {
        return boundaryRole;
    }

    /** True if the type accepts an unbounded number of inputs. */
    public boolean hasElasticInputs() {
        return elasticInputs;
    }

    public String defaultName() {
        return defaultName;
    }

    public List<Port> defaultInputs() {
        return defaultInputs;
    }

    public List<Port> defaultOutputs() {
        return defaultOutputs;
    }

    /** True for types whose stored dimensions are not their on-canvas size. */
    public boolean isPrimitive() {
        return this == BOX || this == SPHERE || this == VECTOR_XYZ;
    }

    /** Estimated width for a node without measured dimensions; NaN if the type has no estimate. */
    public double fallbackWidth(Node node) {
        return fallbackWidth.applyAsDouble(node);
    }

    public double fallbackHeight(Node node) {
        return fallbackHeight.applyAsDouble(node);
    }

    @JsonCreator
    public static NodeType fromString(String text) {
        for (NodeType t : NodeType.values()) {
            if (t.wireName.equalsIgnoreCase(text) || t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown NodeType: " + text);
    }

    private static double customWidth(Node node) {
        String name = node.data().displayName() != null ? node.data().displayName() : "Custom Node";
        return Math.min(620, Math.max(320, name.length() * 8 + 180));
    }

    private static double customHeight(Node node) {
        int ports = node.maxPortCount();
        return ports > 0 ? 182 + ports * 28 : 200;
    }

    private static double primitiveHeight(Node node) {
        int ports = node.maxPortCount();
        return ports > 0 ? 110 + ports * 28 : 200;
    }
}
