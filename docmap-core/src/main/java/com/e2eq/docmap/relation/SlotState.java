package com.e2eq.docmap.relation;

public enum SlotState {
    UNLOADED,
    BUILT,      // set in memory, not yet written with the parent
    ATTACHED,   // present in the persisted document, possibly hollow
    ABSENT,     // no value and no document key
    REMOVED     // cleared in memory, pending the next save
}
