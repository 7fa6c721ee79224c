package com.parametric.nodegraph.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.parametric.nodegraph.model.ComponentDefinition;
import com.parametric.nodegraph.model.Connection;
import com.parametric.nodegraph.model.Node;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Serialized form of an editor session: the graph plus the component
 * definitions its instances refer to.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDocument {
    private List<Node> nodes = new ArrayList<>();
    private List<Connection> connections = new ArrayList<>();
    private List<ComponentDefinition> components = new ArrayList<>();

    public GraphDocument(List<Node> nodes, List<Connection> connections, List<ComponentDefinition> components) {
        this.nodes = new ArrayList<>(nodes);
        this.connections = new ArrayList<>(connections);
        this.components = new ArrayList<>(components);
    }
}
