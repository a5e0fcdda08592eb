package com.e2eq.docmap.cascade;

import com.e2eq.docmap.mapping.DocumentEntity;

/**
 * Invoked after an entity's document has been removed and its cascade completed.
 */
@FunctionalInterface
public interface PostDestroyHook {
    void afterDestroy(DocumentEntity entity) throws RuntimeException;
}
