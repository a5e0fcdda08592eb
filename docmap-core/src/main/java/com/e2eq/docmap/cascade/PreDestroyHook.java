package com.e2eq.docmap.cascade;

import com.e2eq.docmap.mapping.DocumentEntity;

/**
 * Invoked before an entity's cascade runs and before its document is removed. Throwing aborts the
 * destroy; nothing has been mutated at that point except by earlier hooks.
 */
@FunctionalInterface
public interface PreDestroyHook {
    void beforeDestroy(DocumentEntity entity) throws RuntimeException;
}
