package com.parametric.nodegraph.api;

import com.parametric.nodegraph.store.GraphState;

/**
 * Observer of graph state changes, e.g. a renderer or a scene mirror.
 *
 * <p>
 * Callbacks run synchronously on the editing thread after the new state is in
 * place. During undo and redo the history manager reports
 * {@code isRestoring() == true} for the whole callback; a synchronization
 * collaborator must not write back into the graph while that flag is set.
 */
@FunctionalInterface
public interface GraphListener {

    /**
     * Called after every committed state change.
     *
     * @param state  The state now held by the store.
     * @param source What caused the change.
     */
    void onGraphChanged(GraphState state, ChangeSource source);
}
