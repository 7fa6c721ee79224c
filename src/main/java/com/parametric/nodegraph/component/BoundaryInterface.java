package com.parametric.nodegraph.component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.parametric.nodegraph.model.Port;
import com.parametric.nodegraph.model.PortBinding;

/**
 * Port interface of a component under construction.
 *
 * <p>
 * Ports are keyed by the internal endpoint they stand for; the first port
 * created for a key wins. Input ids run {@code in-1, in-2, ...} and output ids
 * {@code out-1, out-2, ...} across every synthesis pass, so they never collide.
 */
final class BoundaryInterface {

    /** An internal endpoint, {@code (nodeId, portId)}. */
    record Endpoint(String nodeId, String portId) {
    }

    private final Map<Endpoint, Port> inputs = new LinkedHashMap<>();
    private final Map<Endpoint, Port> outputs = new LinkedHashMap<>();
    private final List<PortBinding> inputBindings = new ArrayList<>();
    private final List<PortBinding> outputBindings = new ArrayList<>();
    private int nextInput = 1;
    private int nextOutput = 1;

    /** Ordinal the next input port will get. */
    int nextInputOrdinal() {
        return nextInput;
    }

    int nextOutputOrdinal() {
        return nextOutput;
    }

    Optional<Port> input(Endpoint key) {
        return Optional.ofNullable(inputs.get(key));
    }

    Optional<Port> output(Endpoint key) {
        return Optional.ofNullable(outputs.get(key));
    }

    /** Returns the input port for {@code key}, creating it with {@code label} if absent. */
    Port inputFor(Endpoint key, String label) {
        Port existing = inputs.get(key);
        if (existing != null)
            return existing;
        Port port = new Port("in-" + nextInput++, label);
        inputs.put(key, port);
        inputBindings.add(new PortBinding(port.id(), key.nodeId(), key.portId()));
        return port;
    }

    Port outputFor(Endpoint key, String label) {
        Port existing = outputs.get(key);
        if (existing != null)
            return existing;
        Port port = new Port("out-" + nextOutput++, label);
        outputs.put(key, port);
        outputBindings.add(new PortBinding(port.id(), key.nodeId(), key.portId()));
        return port;
    }

    List<Port> inputPorts() {
        return List.copyOf(inputs.values());
    }

    List<Port> outputPorts() {
        return List.copyOf(outputs.values());
    }

    List<PortBinding> inputBindings() {
        return List.copyOf(inputBindings);
    }

    List<PortBinding> outputBindings() {
        return List.copyOf(outputBindings);
    }
}
