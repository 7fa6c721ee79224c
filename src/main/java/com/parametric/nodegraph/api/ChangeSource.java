package com.parametric.nodegraph.api;

/** What caused a graph state change. */
public enum ChangeSource {
    /** A history-recorded edit. */
    EDIT,
    UNDO,
    REDO,
    /** A raw write from a synchronization collaborator; not recorded. */
    SYNC,
    /** A document import; history was cleared. */
    LOAD
}
