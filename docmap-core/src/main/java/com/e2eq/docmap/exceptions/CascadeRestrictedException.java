package com.e2eq.docmap.exceptions;

/**
 * Thrown when a destroy is blocked by a relation declared with the restrict policy.
 * No document has been modified when this is raised.
 */
public class CascadeRestrictedException extends DocMapException {
    private static final long serialVersionUID = 1L;

    private final String entityType;
    private final String entityId;
    private final String relation;
    private final long relatedCount;

    public CascadeRestrictedException(String entityType, String entityId, String relation, long relatedCount) {
        super(String.format("Cannot destroy %s[%s]: relation '%s' still has %d related document(s)",
                entityType, entityId, relation, relatedCount));
        this.entityType = entityType;
        this.entityId = entityId;
        this.relation = relation;
        this.relatedCount = relatedCount;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getRelation() {
        return relation;
    }

    public long getRelatedCount() {
        return relatedCount;
    }
}
